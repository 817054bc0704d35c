package com.ryuqq.ingest.core.spi;

/**
 * Search backend SPI.
 *
 * <p>The pipeline only needs to open a connection and submit batches of
 * indexing actions with per-document results.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public interface SearchBackend {

    /**
     * Opens one connection to the backend.
     *
     * @return a new connection; the caller must close it
     * @throws com.ryuqq.ingest.core.exception.BackendException if the backend cannot be reached
     */
    BackendConnection connect();
}
