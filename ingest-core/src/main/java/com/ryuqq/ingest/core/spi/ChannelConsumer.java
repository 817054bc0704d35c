package com.ryuqq.ingest.core.spi;

import java.time.Duration;

/**
 * One consumer connection to a {@link DurableChannel}.
 *
 * <p>Not thread-safe: a consumer belongs to exactly one worker.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public interface ChannelConsumer extends AutoCloseable {

    /**
     * Blocks until a message is available or the timeout elapses.
     *
     * <p>The returned message is invisible to other consumers until it is
     * acknowledged, this consumer is closed, or the broker's redelivery timeout
     * expires.</p>
     *
     * @param timeout maximum time to wait
     * @return the next message
     * @throws com.ryuqq.ingest.core.exception.NoMessageAvailableException on timeout, a normal empty cycle
     * @throws com.ryuqq.ingest.core.exception.ChannelException on broker failure
     * @throws com.ryuqq.ingest.core.exception.WorkerInterruptedException if the thread is interrupted
     */
    ChannelMessage pull(Duration timeout);

    /**
     * Releases the connection. Messages this consumer pulled but never
     * acknowledged become eligible for redelivery.
     */
    @Override
    void close();
}
