package com.ryuqq.ingest.core.exception;

/**
 * The document cannot be turned into an indexing action.
 *
 * <p>Either it is not JSON-serializable or it lacks the routing metadata the
 * action is derived from. Retrying cannot fix it, so it is never retried.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public class MalformedDocumentException extends IngestException {

    public MalformedDocumentException(String message) {
        super(message);
    }

    public MalformedDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
