package com.ryuqq.ingest.core.exception;

/**
 * Root of the ingest pipeline's exception hierarchy.
 *
 * <p>All pipeline failures are unchecked. Callers distinguish transient from
 * permanent failures by subtype, not by message.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public class IngestException extends RuntimeException {

    public IngestException(String message) {
        super(message);
    }

    public IngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
