package com.ryuqq.ingest.adapter.runner;

import com.ryuqq.ingest.core.exception.NoMessageAvailableException;
import com.ryuqq.ingest.core.spi.ChannelConsumer;
import com.ryuqq.ingest.core.spi.ChannelMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * 채널 consumer를 끝없는 메시지 스트림으로 노출합니다.
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>{@link #hasNext()}: 닫히기 전까지 항상 true</li>
 *   <li>{@link #next()}: 메시지가 올 때까지 pull 반복 (타임아웃은 빈 사이클로 취급)</li>
 *   <li>{@link #poll()}: pull 한 번, 타임아웃이면 empty</li>
 *   <li>반환 직전 메시지를 {@link PendingAcks}에 추가</li>
 * </ul>
 *
 * <p>ChannelException은 그대로 전파되어 스트림을 끝냅니다. 재연결은 BatchFlusher 몫입니다.
 * 대기는 pull 안에서만 일어납니다.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public final class StreamReader implements Iterator<ChannelMessage> {

    private static final Logger log = LoggerFactory.getLogger(StreamReader.class);

    private final ChannelConsumer consumer;
    private final PendingAcks pendingAcks;
    private final Duration waitTimeout;
    private volatile boolean open = true;

    public StreamReader(ChannelConsumer consumer, PendingAcks pendingAcks, Duration waitTimeout) {
        if (consumer == null) {
            throw new IllegalArgumentException("consumer cannot be null");
        }
        if (pendingAcks == null) {
            throw new IllegalArgumentException("pendingAcks cannot be null");
        }
        if (waitTimeout == null || waitTimeout.isNegative() || waitTimeout.isZero()) {
            throw new IllegalArgumentException("waitTimeout must be positive (current: " + waitTimeout + ")");
        }
        this.consumer = consumer;
        this.pendingAcks = pendingAcks;
        this.waitTimeout = waitTimeout;
    }

    @Override
    public boolean hasNext() {
        return open;
    }

    /**
     * @return 다음 메시지
     * @throws NoSuchElementException 대기 중 reader가 닫힌 경우
     */
    @Override
    public ChannelMessage next() {
        while (open) {
            Optional<ChannelMessage> message = poll();
            if (message.isPresent()) {
                return message.get();
            }
        }
        throw new NoSuchElementException("Stream reader is closed");
    }

    /**
     * pull 한 번.
     *
     * @return 메시지, 타임아웃이면 empty
     */
    public Optional<ChannelMessage> poll() {
        ChannelMessage message;
        try {
            message = consumer.pull(waitTimeout);
        } catch (NoMessageAvailableException e) {
            log.trace("No message within {}ms", waitTimeout.toMillis());
            return Optional.empty();
        }
        pendingAcks.append(message);
        return Optional.of(message);
    }

    /**
     * 현재 pull이 끝난 뒤 스트림을 종료합니다. consumer는 닫지 않습니다.
     */
    public void close() {
        open = false;
    }
}
