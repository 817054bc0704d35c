package com.ryuqq.ingest.core.spi;

import com.ryuqq.ingest.core.model.IndexingAction;

/**
 * Handle of one delivered message: the decoded action plus the capability to acknowledge it.
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public interface ChannelMessage {

    /**
     * @return the deserialized indexing action
     */
    IndexingAction action();

    /**
     * @return broker-assigned tag, unique per delivery
     */
    long deliveryTag();

    /**
     * @return content type the message was published with, {@code application/json} for actions
     */
    String contentType();

    /**
     * @return true if this message was delivered before and never acknowledged
     */
    boolean redelivered();

    /**
     * Permanently removes the message from the channel.
     *
     * <p>Idempotent: acknowledging an already acknowledged message is a no-op.</p>
     *
     * @throws com.ryuqq.ingest.core.exception.ChannelException if the broker is unavailable
     */
    void ack();
}
