/**
 * RunControl Application Layer - 오케스트레이터 측 Run 제어 API.
 *
 * <p>오케스트레이터가 Run을 생성하고 취소/일시정지/재개를 요청하며
 * 상태를 조회하는 경계를 정의합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runcontrol.application.controller.RunController} - Run 제어 API</li>
 *   <li>{@link com.ryuqq.runcontrol.application.controller.RunHandle} - Run 상태 스냅샷</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 *   <li><strong>불변성:</strong> RunHandle은 불변 객체</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.runcontrol.application.controller;
