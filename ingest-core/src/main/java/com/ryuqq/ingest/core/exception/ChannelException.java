package com.ryuqq.ingest.core.exception;

/**
 * Transient broker failure on the durable channel.
 *
 * <p>Raised when the channel is unavailable, not declared, or a message
 * cannot be routed. Publishers retry it a bounded number of times; the
 * batch flusher recovers from it by reconnecting.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public class ChannelException extends IngestException {

    public ChannelException(String message) {
        super(message);
    }

    public ChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
