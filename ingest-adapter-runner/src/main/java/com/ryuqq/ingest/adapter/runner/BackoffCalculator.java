package com.ryuqq.ingest.adapter.runner;

import com.typesafe.config.Config;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 지수 백오프 + Jitter 계산기.
 *
 * <p>Publish 재시도와 Flusher 재연결 간격에 공통으로 사용합니다.
 * 여러 worker가 동시에 끊겨도 같은 시점에 브로커로 몰리지 않도록 jitter를 더합니다.</p>
 *
 * <p><strong>계산식:</strong></p>
 * <pre>
 * exponential = min(baseDelay * 2^(attempt-1), maxDelay)
 * delay       = min(exponential + random(0, exponential * jitterFactor), maxDelay)
 * </pre>
 *
 * <p><strong>예시 (base=1s, max=60s, jitter=0.1):</strong></p>
 * <ul>
 *   <li>attempt=1: 1000-1100ms</li>
 *   <li>attempt=3: 4000-4400ms</li>
 *   <li>attempt=7 이상: 60000ms 고정</li>
 * </ul>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본값: base=1000ms, max=60000ms, jitter=0.1.
     */
    public BackoffCalculator() {
        this(1000, 60000, 0.1);
    }

    /**
     * @param baseDelayMs 첫 재시도 지연 (밀리초, 양수)
     * @param maxDelayMs 최대 지연 (밀리초, baseDelayMs 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급자를 주입하는 생성자 (테스트에서 jitter 고정용).
     *
     * @param baseDelayMs 첫 재시도 지연 (밀리초, 양수)
     * @param maxDelayMs 최대 지연 (밀리초, baseDelayMs 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @param random [0, 1) 범위 난수 공급자
     */
    BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * {@code base}, {@code max}, {@code jitter} 키를 가진 설정 블록에서 생성.
     *
     * @param config 백오프 설정 블록 (예: {@code ingest.reconnect-backoff})
     * @return 계산기
     */
    public static BackoffCalculator fromConfig(Config config) {
        return new BackoffCalculator(
            config.getDuration("base").toMillis(),
            config.getDuration("max").toMillis(),
            config.getDouble("jitter")
        );
    }

    /**
     * @param attempt 연속 실패 횟수 (1부터 시작)
     * @return 다음 시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }

        // shift가 63을 넘으면 overflow, 그 전에 max에 도달
        int shift = Math.min(attempt - 1, 62);
        long exponential = baseDelayMs > (maxDelayMs >> shift)
            ? maxDelayMs
            : Math.min(baseDelayMs << shift, maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
