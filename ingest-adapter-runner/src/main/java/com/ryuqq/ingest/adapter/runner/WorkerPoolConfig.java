package com.ryuqq.ingest.adapter.runner;

import com.typesafe.config.Config;

import java.time.Duration;

/**
 * WorkerPoolSupervisor 설정 (불변 record).
 *
 * <ul>
 *   <li>concurrency: worker 수, 0이면 CPU 코어 수 (기본값: 0)</li>
 *   <li>restartPolicy: 기본값 ALWAYS</li>
 *   <li>restartDelay: 재기동 전 대기 (기본값: 1초)</li>
 *   <li>shutdownTimeout: stop() 기본 대기 (기본값: 30초)</li>
 * </ul>
 *
 * @param concurrency worker 수 (0 = 코어 수)
 * @param restartPolicy 재기동 정책
 * @param restartDelay 재기동 지연
 * @param shutdownTimeout 종료 대기
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public record WorkerPoolConfig(
    int concurrency,
    RestartPolicy restartPolicy,
    Duration restartDelay,
    Duration shutdownTimeout
) {

    public WorkerPoolConfig() {
        this(0, RestartPolicy.ALWAYS, Duration.ofSeconds(1), Duration.ofSeconds(30));
    }

    public WorkerPoolConfig {
        if (concurrency < 0) {
            throw new IllegalArgumentException("concurrency must be non-negative (current: " + concurrency + ")");
        }
        if (restartPolicy == null) {
            throw new IllegalArgumentException("restartPolicy cannot be null");
        }
        if (restartDelay == null || restartDelay.isNegative()) {
            throw new IllegalArgumentException("restartDelay must be non-negative (current: " + restartDelay + ")");
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be non-negative (current: " + shutdownTimeout + ")");
        }
    }

    /**
     * {@code ingest.workers.*} 읽기.
     *
     * @param config 해석된 설정
     * @return worker pool 설정
     */
    public static WorkerPoolConfig fromConfig(Config config) {
        Config workers = config.getConfig("ingest.workers");
        return new WorkerPoolConfig(
            workers.getInt("concurrency"),
            workers.getEnum(RestartPolicy.class, "restart-policy"),
            workers.getDuration("restart-delay"),
            workers.getDuration("shutdown-timeout")
        );
    }

    /**
     * @return 실제 worker 수 (0이면 availableProcessors)
     */
    public int effectiveConcurrency() {
        return concurrency == 0 ? Runtime.getRuntime().availableProcessors() : concurrency;
    }

    public WorkerPoolConfig withConcurrency(int concurrency) {
        return new WorkerPoolConfig(concurrency, restartPolicy, restartDelay, shutdownTimeout);
    }

    public WorkerPoolConfig withRestartPolicy(RestartPolicy restartPolicy) {
        return new WorkerPoolConfig(concurrency, restartPolicy, restartDelay, shutdownTimeout);
    }

    public WorkerPoolConfig withRestartDelay(Duration restartDelay) {
        return new WorkerPoolConfig(concurrency, restartPolicy, restartDelay, shutdownTimeout);
    }

    public WorkerPoolConfig withShutdownTimeout(Duration shutdownTimeout) {
        return new WorkerPoolConfig(concurrency, restartPolicy, restartDelay, shutdownTimeout);
    }
}
