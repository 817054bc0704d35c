package com.ryuqq.ingest.core.exception;

import java.time.Duration;

/**
 * A pull timed out with no message available.
 *
 * <p>This is a normal empty cycle, not an error. Consumers retry the pull and
 * must never escalate it. Stack traces are not captured.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public class NoMessageAvailableException extends IngestException {

    private final Duration waited;

    public NoMessageAvailableException(String channelName, Duration waited) {
        super("No message available on channel '" + channelName + "' after " + waited.toMillis() + "ms");
        this.waited = waited;
    }

    public Duration getWaited() {
        return waited;
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }
}
