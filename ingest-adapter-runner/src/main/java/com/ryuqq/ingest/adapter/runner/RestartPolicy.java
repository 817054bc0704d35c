package com.ryuqq.ingest.adapter.runner;

/**
 * 비정상 종료한 worker의 재기동 정책.
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public enum RestartPolicy {

    /**
     * restartDelay 후 새 flusher로 재기동.
     */
    ALWAYS,

    /**
     * 재기동하지 않음. 동시성이 그만큼 줄어듭니다.
     */
    NEVER
}
