package com.ryuqq.ingest.core.exception;

/**
 * Publishing a document failed after the retry budget was exhausted.
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public class PublishFailedException extends IngestException {

    private final int attempts;

    public PublishFailedException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    /**
     * @return total number of publish attempts made, including the first
     */
    public int getAttempts() {
        return attempts;
    }
}
