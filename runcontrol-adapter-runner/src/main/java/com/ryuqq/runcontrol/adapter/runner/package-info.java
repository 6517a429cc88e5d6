/**
 * 워커/오케스트레이터 런타임 어댑터.
 *
 * <p><strong>주요 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.runcontrol.adapter.runner.WorkItemRunner}: 컨트롤 포인트를 거치며 작업 목록 실행</li>
 *   <li>{@link com.ryuqq.runcontrol.adapter.runner.StoreBackedControlPointInterceptor}: ControlStore 기반 제어</li>
 *   <li>{@link com.ryuqq.runcontrol.adapter.runner.UncontrolledControlPointInterceptor}: RunId 없는 워커용</li>
 *   <li>{@link com.ryuqq.runcontrol.adapter.runner.RunIdResolver}: 명령행 인자/환경 변수에서 RunId 해석</li>
 *   <li>{@link com.ryuqq.runcontrol.adapter.runner.DefaultRunController}: 오케스트레이터 측 제어 API</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.runcontrol.adapter.runner;
