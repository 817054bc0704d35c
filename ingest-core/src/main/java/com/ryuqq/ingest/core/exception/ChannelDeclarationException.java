package com.ryuqq.ingest.core.exception;

/**
 * The durable channel could not be declared and the declaration policy is fail-fast.
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public class ChannelDeclarationException extends IngestException {

    public ChannelDeclarationException(String message, Throwable cause) {
        super(message, cause);
    }
}
