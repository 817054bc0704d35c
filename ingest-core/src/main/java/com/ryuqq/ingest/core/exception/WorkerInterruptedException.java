package com.ryuqq.ingest.core.exception;

/**
 * The worker thread was interrupted while blocked.
 *
 * <p>The interrupt flag is restored before this is thrown.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public class WorkerInterruptedException extends IngestException {

    public WorkerInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
