package com.ryuqq.ingest.core.exception;

/**
 * Whole-batch failure talking to the search backend.
 *
 * <p>Connection failures, timeouts and malformed bulk responses end up here.
 * Per-document indexing failures are reported through
 * {@link com.ryuqq.ingest.core.spi.BulkItemResult} instead.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public class BackendException extends IngestException {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
