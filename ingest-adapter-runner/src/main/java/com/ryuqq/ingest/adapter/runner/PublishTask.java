package com.ryuqq.ingest.adapter.runner;

import com.ryuqq.ingest.application.publisher.DocumentPublisher;
import com.ryuqq.ingest.core.exception.ChannelException;
import com.ryuqq.ingest.core.exception.PublishFailedException;
import com.ryuqq.ingest.core.exception.WorkerInterruptedException;
import com.ryuqq.ingest.core.model.IndexingAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 재시도를 포함한 문서 적재 작업.
 *
 * <p>{@link DocumentPublisher#enqueueDocument}를 호출하고, 일시적인 채널 오류
 * ({@link ChannelException})는 백오프 후 재시도합니다.</p>
 *
 * <p><strong>재시도 규칙:</strong></p>
 * <ul>
 *   <li>ChannelException: 최대 maxRetries회 재시도</li>
 *   <li>MalformedDocumentException: 재시도 없이 즉시 전파</li>
 *   <li>재시도 소진: 전체 컨텍스트를 로깅한 뒤 {@link PublishFailedException}</li>
 * </ul>
 *
 * <p>성공한 호출은 정확히 하나의 메시지를 채널에 남기고, 실패한 호출은 아무것도 남기지 않습니다.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public final class PublishTask {

    private static final Logger log = LoggerFactory.getLogger(PublishTask.class);

    private final DocumentPublisher publisher;
    private final int maxRetries;
    private final BackoffCalculator backoff;

    public PublishTask(DocumentPublisher publisher, PublishRetryConfig config) {
        this(publisher, requireConfig(config).maxRetries(), config.backoff());
    }

    /**
     * @param publisher 문서 발행기
     * @param maxRetries 최대 재시도 횟수
     * @param backoff 재시도 간 백오프
     */
    public PublishTask(DocumentPublisher publisher, int maxRetries, BackoffCalculator backoff) {
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative (current: " + maxRetries + ")");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        this.publisher = publisher;
        this.maxRetries = maxRetries;
        this.backoff = backoff;
    }

    /**
     * 문서를 적재 큐에 넣습니다.
     *
     * @param tenant 테넌트
     * @param pattern 상관 패턴
     * @param document 문서
     * @return 발행된 action
     * @throws com.ryuqq.ingest.core.exception.MalformedDocumentException 잘못된 입력
     * @throws PublishFailedException 재시도 소진
     * @throws WorkerInterruptedException 백오프 대기 중 인터럽트
     */
    public IndexingAction run(String tenant, String pattern, Object document) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return publisher.enqueueDocument(tenant, pattern, document);
            } catch (ChannelException e) {
                if (attempt > maxRetries) {
                    log.error("Giving up publishing document for tenant '{}' pattern '{}' after {} attempts",
                        tenant, pattern, attempt, e);
                    throw new PublishFailedException(
                        "Failed to publish document for tenant '" + tenant + "' pattern '" + pattern
                            + "' after " + attempt + " attempts",
                        attempt, e);
                }
                long delay = backoff.calculate(attempt);
                log.warn("Publish attempt {} for tenant '{}' pattern '{}' failed: {}. Retrying in {}ms",
                    attempt, tenant, pattern, e.getMessage(), delay);
                sleep(delay);
            }
        }
    }

    private static PublishRetryConfig requireConfig(PublishRetryConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerInterruptedException("Interrupted while waiting to retry publish", e);
        }
    }
}
