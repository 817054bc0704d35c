package com.ryuqq.ingest.adapter.runner;

import com.ryuqq.ingest.core.spi.ChannelMessage;

import java.util.ArrayDeque;

/**
 * 한 worker가 pull했지만 아직 처리 결과가 없는 메시지의 FIFO 큐.
 *
 * <p>StreamReader가 pull 순서대로 뒤에 추가하고, BatchFlusher가 bulk 결과 순서대로
 * 앞에서 꺼냅니다. 꺼낼 때 기대한 메시지와 동일한 인스턴스인지 확인하므로
 * 결과가 다른 메시지에 적용되는 일은 없습니다.</p>
 *
 * <p>단일 worker 스레드 전용이며 동기화하지 않습니다.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public final class PendingAcks {

    private final ArrayDeque<ChannelMessage> queue;
    private final int capacity;

    /**
     * @param capacity 최대 보류 개수 (bulkSize)
     */
    public PendingAcks(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(capacity);
    }

    /**
     * @param message pull한 메시지
     * @throws IllegalStateException capacity 초과 시
     */
    public void append(ChannelMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (queue.size() >= capacity) {
            throw new IllegalStateException("Pending acks full (capacity: " + capacity + ")");
        }
        queue.addLast(message);
    }

    /**
     * 맨 앞 메시지를 꺼냅니다.
     *
     * @param expected 결과가 가리키는 메시지
     * @return 꺼낸 메시지 (expected와 동일 인스턴스)
     * @throws IllegalStateException 비어 있거나 맨 앞이 expected가 아닌 경우
     */
    public ChannelMessage popHead(ChannelMessage expected) {
        ChannelMessage head = queue.peekFirst();
        if (head == null) {
            throw new IllegalStateException("No pending ack for delivery " + expected.deliveryTag());
        }
        if (head != expected) {
            throw new IllegalStateException("Result for delivery " + expected.deliveryTag()
                + " does not match pending head " + head.deliveryTag());
        }
        return queue.pollFirst();
    }

    /**
     * 보류 중인 메시지를 모두 버립니다. 버린 메시지는 ack되지 않았으므로 브로커가 재전달합니다.
     *
     * @return 버린 개수
     */
    public int discard() {
        int discarded = queue.size();
        queue.clear();
        return discarded;
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int capacity() {
        return capacity;
    }
}
