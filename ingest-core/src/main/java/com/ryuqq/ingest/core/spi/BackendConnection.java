package com.ryuqq.ingest.core.spi;

import com.ryuqq.ingest.core.model.IndexingAction;

import java.util.List;

/**
 * One connection to the search backend.
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public interface BackendConnection extends AutoCloseable {

    /**
     * Submits the batch as one bulk request.
     *
     * <p>Returns exactly one result per input action, in input order. A document the
     * backend rejects yields a failed result, not an exception.</p>
     *
     * @param batch non-empty batch of actions
     * @return per-document results in input order
     * @throws IllegalArgumentException if batch is null or empty
     * @throws com.ryuqq.ingest.core.exception.BackendException if the whole request fails
     */
    List<BulkItemResult> submit(List<IndexingAction> batch);

    @Override
    void close();
}
