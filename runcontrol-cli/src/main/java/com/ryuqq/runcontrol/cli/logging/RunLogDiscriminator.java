package com.ryuqq.runcontrol.cli.logging;

import ch.qos.logback.classic.sift.MDCBasedDiscriminator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import com.ryuqq.runcontrol.core.context.CorrelationContext;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Run별 로그 디렉토리 이름을 정하는 Logback Discriminator.
 *
 * <p>MDC {@value CorrelationContext#MDC_RUN_ID} 값을 디렉토리 이름으로 쓸 수 있게 인코딩합니다.
 * RunId는 임의의 문자열이므로 그대로 쓰면 {@code ../} 같은 값이 로그 디렉토리를 벗어날 수 있습니다.</p>
 *
 * <ul>
 *   <li>퍼센트 인코딩: {@code job:42} → {@code job%3A42}, 점(.)도 인코딩</li>
 *   <li>200자를 넘으면 {@code ~} + SHA-256</li>
 *   <li>Run 밖의 로그: {@value #NO_RUN}</li>
 * </ul>
 *
 * <pre>
 * &lt;appender class="ch.qos.logback.classic.sift.SiftingAppender"&gt;
 *   &lt;discriminator class="com.ryuqq.runcontrol.cli.logging.RunLogDiscriminator"/&gt;
 *   ...
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RunLogDiscriminator extends MDCBasedDiscriminator {

    /**
     * Run 식별자가 없는 이벤트의 디렉토리 이름 (인코딩 결과와 겹치지 않음).
     */
    public static final String NO_RUN = "~no-run";

    private static final int MAX_NAME_LENGTH = 200;

    public RunLogDiscriminator() {
        setKey(CorrelationContext.MDC_RUN_ID);
        setDefaultValue(NO_RUN);
    }

    @Override
    public String getDiscriminatingValue(ILoggingEvent event) {
        String value = super.getDiscriminatingValue(event);
        if (NO_RUN.equals(value)) {
            return value;
        }
        return directoryName(value);
    }

    /**
     * RunId 값을 디렉토리 이름으로 변환.
     *
     * @param runId RunId 값
     * @return 디렉토리 이름
     */
    static String directoryName(String runId) {
        String encoded = URLEncoder.encode(runId, StandardCharsets.UTF_8)
            .replace("*", "%2A")
            .replace(".", "%2E");
        if (encoded.length() <= MAX_NAME_LENGTH) {
            return encoded;
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(runId.getBytes(StandardCharsets.UTF_8));
            return "~" + HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
