package com.ryuqq.ingest.adapter.runner;

import com.typesafe.config.Config;

import java.time.Duration;

/**
 * BatchFlusher 설정 (불변 record).
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>bulkSize: 500</li>
 *   <li>waitTimeout: 60초</li>
 *   <li>flushOnIdle: true</li>
 *   <li>reconnect backoff: 1초 ~ 60초, jitter 0.1</li>
 * </ul>
 *
 * @param bulkSize 배치당 최대 문서 수
 * @param waitTimeout pull 한 번의 최대 대기
 * @param flushOnIdle pull 타임아웃 시 부분 배치 제출 여부
 * @param reconnectBaseDelay 첫 재연결 지연
 * @param reconnectMaxDelay 최대 재연결 지연
 * @param reconnectJitter 재연결 jitter 비율
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public record FlusherConfig(
    int bulkSize,
    Duration waitTimeout,
    boolean flushOnIdle,
    Duration reconnectBaseDelay,
    Duration reconnectMaxDelay,
    double reconnectJitter
) {

    public FlusherConfig() {
        this(500, Duration.ofSeconds(60), true, Duration.ofSeconds(1), Duration.ofSeconds(60), 0.1);
    }

    public FlusherConfig {
        if (bulkSize <= 0) {
            throw new IllegalArgumentException("bulkSize must be positive (current: " + bulkSize + ")");
        }
        if (waitTimeout == null || waitTimeout.isNegative() || waitTimeout.isZero()) {
            throw new IllegalArgumentException("waitTimeout must be positive (current: " + waitTimeout + ")");
        }
        if (reconnectBaseDelay == null) {
            throw new IllegalArgumentException("reconnectBaseDelay cannot be null");
        }
        if (reconnectMaxDelay == null) {
            throw new IllegalArgumentException("reconnectMaxDelay cannot be null");
        }
    }

    /**
     * {@code ingest.bulk-size}, {@code ingest.wait-timeout}, {@code ingest.flush-on-idle},
     * {@code ingest.reconnect-backoff.*} 읽기.
     *
     * @param config 해석된 설정
     * @return flusher 설정
     */
    public static FlusherConfig fromConfig(Config config) {
        Config ingest = config.getConfig("ingest");
        Config backoff = ingest.getConfig("reconnect-backoff");
        return new FlusherConfig(
            ingest.getInt("bulk-size"),
            ingest.getDuration("wait-timeout"),
            ingest.getBoolean("flush-on-idle"),
            backoff.getDuration("base"),
            backoff.getDuration("max"),
            backoff.getDouble("jitter")
        );
    }

    /**
     * @return 재연결 백오프 계산기
     */
    public BackoffCalculator reconnectBackoff() {
        return new BackoffCalculator(reconnectBaseDelay.toMillis(), reconnectMaxDelay.toMillis(), reconnectJitter);
    }

    public FlusherConfig withBulkSize(int bulkSize) {
        return new FlusherConfig(bulkSize, waitTimeout, flushOnIdle, reconnectBaseDelay, reconnectMaxDelay, reconnectJitter);
    }

    public FlusherConfig withWaitTimeout(Duration waitTimeout) {
        return new FlusherConfig(bulkSize, waitTimeout, flushOnIdle, reconnectBaseDelay, reconnectMaxDelay, reconnectJitter);
    }

    public FlusherConfig withFlushOnIdle(boolean flushOnIdle) {
        return new FlusherConfig(bulkSize, waitTimeout, flushOnIdle, reconnectBaseDelay, reconnectMaxDelay, reconnectJitter);
    }

    public FlusherConfig withReconnectBackoff(Duration baseDelay, Duration maxDelay, double jitter) {
        return new FlusherConfig(bulkSize, waitTimeout, flushOnIdle, baseDelay, maxDelay, jitter);
    }
}
