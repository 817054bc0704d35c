package com.ryuqq.ingest.adapter.runner;

import com.ryuqq.ingest.application.runtime.FlushLoop;
import com.ryuqq.ingest.application.runtime.FlusherState;
import com.ryuqq.ingest.core.exception.WorkerInterruptedException;
import com.ryuqq.ingest.core.spi.BackendConnection;
import com.ryuqq.ingest.core.spi.ChannelConsumer;
import com.ryuqq.ingest.core.spi.DurableChannel;
import com.ryuqq.ingest.core.spi.SearchBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 한 worker의 consume → bulk → ack 루프.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * NEW → CONNECTING → STREAMING ⇄ ACK_OR_SKIP
 *            ↑            │ (예외)
 *            └── backoff ─┘
 * stop() / interrupt → STOPPED
 * </pre>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>연결마다 백엔드 connection과 채널 consumer를 하나씩 열고, 모든 경로에서 닫음</li>
 *   <li>성공한 문서만 pull 순서대로 ack, 실패한 문서는 WARN 로그 후 ack하지 않음</li>
 *   <li>스트리밍 중 예외: 로그, 보류 ack 폐기, 백오프 후 재연결</li>
 * </ul>
 *
 * <p>ack하지 않은 메시지는 consumer close 또는 visibility timeout 후 브로커가 재전달합니다.
 * 인스턴스는 한 번만 실행할 수 있습니다.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public final class BatchFlusher implements FlushLoop {

    private static final Logger log = LoggerFactory.getLogger(BatchFlusher.class);

    private final DurableChannel channel;
    private final SearchBackend backend;
    private final FlusherConfig config;
    private final BackoffCalculator reconnectBackoff;

    private final AtomicLong acknowledged = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicInteger restarts = new AtomicInteger();

    private volatile FlusherState state = FlusherState.NEW;
    private volatile boolean stopped;
    private volatile StreamReader currentReader;

    public BatchFlusher(DurableChannel channel, SearchBackend backend, FlusherConfig config) {
        this(channel, backend, config, config == null ? null : config.reconnectBackoff());
    }

    /**
     * @param channel 소비할 채널
     * @param backend 검색 백엔드
     * @param config flusher 설정
     * @param reconnectBackoff 재연결 백오프
     */
    public BatchFlusher(DurableChannel channel, SearchBackend backend, FlusherConfig config,
                        BackoffCalculator reconnectBackoff) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (reconnectBackoff == null) {
            throw new IllegalArgumentException("reconnectBackoff cannot be null");
        }
        this.channel = channel;
        this.backend = backend;
        this.config = config;
        this.reconnectBackoff = reconnectBackoff;
    }

    @Override
    public void runFlushLoop() {
        synchronized (this) {
            if (state != FlusherState.NEW) {
                throw new IllegalStateException("BatchFlusher can only run once (state: " + state + ")");
            }
            state = FlusherState.CONNECTING;
        }

        int consecutiveFailures = 0;
        try {
            while (!stopped && !Thread.currentThread().isInterrupted()) {
                state = FlusherState.CONNECTING;
                try {
                    consecutiveFailures = stream(consecutiveFailures);
                } catch (WorkerInterruptedException e) {
                    log.info("Flusher interrupted on channel '{}', leaving un-acked messages for redelivery",
                        channel.name());
                    Thread.currentThread().interrupt();
                    return;
                } catch (RuntimeException e) {
                    if (stopped) {
                        log.debug("Flusher stopped while streaming from '{}'", channel.name(), e);
                        return;
                    }
                    consecutiveFailures++;
                    restarts.incrementAndGet();
                    long delay = reconnectBackoff.calculate(consecutiveFailures);
                    log.error("Flush loop on channel '{}' failed (consecutive failures: {}), reconnecting in {}ms",
                        channel.name(), consecutiveFailures, delay, e);
                    if (!pause(delay)) {
                        return;
                    }
                }
            }
        } finally {
            state = FlusherState.STOPPED;
            currentReader = null;
        }
    }

    /**
     * 연결 하나의 수명 동안 스트리밍합니다.
     *
     * @return 갱신된 연속 실패 횟수 (배치 성공 시 0)
     */
    private int stream(int consecutiveFailures) {
        PendingAcks pendingAcks = new PendingAcks(config.bulkSize());
        try (BackendConnection connection = backend.connect();
             ChannelConsumer consumer = channel.openConsumer()) {
            StreamReader reader = new StreamReader(consumer, pendingAcks, config.waitTimeout());
            currentReader = reader;
            if (stopped) {
                reader.close();
            }
            BulkStreamer streamer = new BulkStreamer(reader, connection, config.bulkSize(), config.flushOnIdle());
            log.debug("Flusher connected to channel '{}'", channel.name());

            while (!stopped) {
                state = FlusherState.STREAMING;
                List<FlushResult> results = streamer.nextBatch();
                if (results.isEmpty()) {
                    continue;
                }
                state = FlusherState.ACK_OR_SKIP;
                ackOrSkip(results, pendingAcks);
                consecutiveFailures = 0;
            }
            return consecutiveFailures;
        } finally {
            int discarded = pendingAcks.discard();
            if (discarded > 0) {
                log.warn("Discarded {} pending acks on channel '{}', broker will redeliver them",
                    discarded, channel.name());
            }
        }
    }

    private void ackOrSkip(List<FlushResult> results, PendingAcks pendingAcks) {
        for (FlushResult result : results) {
            pendingAcks.popHead(result.message());
            if (result.success()) {
                result.message().ack();
                acknowledged.incrementAndGet();
            } else {
                skipped.incrementAndGet();
                log.warn("Document {} for index '{}' was rejected (status {}): {}. Leaving it for redelivery",
                    result.result().actionId().asString(), result.message().action().targetIndex(),
                    result.result().status(), result.result().error());
            }
        }
    }

    private boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return !stopped;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void stop() {
        stopped = true;
        StreamReader reader = currentReader;
        if (reader != null) {
            reader.close();
        }
    }

    @Override
    public FlusherState state() {
        return state;
    }

    public long acknowledged() {
        return acknowledged.get();
    }

    public long skipped() {
        return skipped.get();
    }

    public int restarts() {
        return restarts.get();
    }
}
