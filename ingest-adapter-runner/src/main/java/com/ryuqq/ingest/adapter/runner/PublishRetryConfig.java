package com.ryuqq.ingest.adapter.runner;

import com.typesafe.config.Config;

import java.time.Duration;

/**
 * PublishTask 재시도 설정 (불변 record).
 *
 * <ul>
 *   <li>maxRetries: 첫 시도 이후 추가 재시도 횟수 (기본값: 3)</li>
 *   <li>baseDelay / maxDelay / jitterFactor: 재시도 간 백오프 (기본값: 1s / 30s / 0.1)</li>
 * </ul>
 *
 * @param maxRetries 최대 재시도 횟수 (0 이상)
 * @param baseDelay 첫 재시도 지연
 * @param maxDelay 최대 지연
 * @param jitterFactor Jitter 비율
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public record PublishRetryConfig(
    int maxRetries,
    Duration baseDelay,
    Duration maxDelay,
    double jitterFactor
) {

    public PublishRetryConfig() {
        this(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 0.1);
    }

    public PublishRetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative (current: " + maxRetries + ")");
        }
        if (baseDelay == null) {
            throw new IllegalArgumentException("baseDelay cannot be null");
        }
        if (maxDelay == null) {
            throw new IllegalArgumentException("maxDelay cannot be null");
        }
    }

    /**
     * {@code ingest.publish.*} 읽기.
     *
     * @param config 해석된 설정
     * @return 재시도 설정
     */
    public static PublishRetryConfig fromConfig(Config config) {
        Config publish = config.getConfig("ingest.publish");
        Config backoff = publish.getConfig("backoff");
        return new PublishRetryConfig(
            publish.getInt("max-retries"),
            backoff.getDuration("base"),
            backoff.getDuration("max"),
            backoff.getDouble("jitter")
        );
    }

    /**
     * @return 이 설정의 백오프 계산기
     */
    public BackoffCalculator backoff() {
        return new BackoffCalculator(baseDelay.toMillis(), maxDelay.toMillis(), jitterFactor);
    }

    public PublishRetryConfig withMaxRetries(int maxRetries) {
        return new PublishRetryConfig(maxRetries, baseDelay, maxDelay, jitterFactor);
    }

    public PublishRetryConfig withBackoff(Duration baseDelay, Duration maxDelay, double jitterFactor) {
        return new PublishRetryConfig(maxRetries, baseDelay, maxDelay, jitterFactor);
    }
}
