/**
 * OpenSearch adapter for the search backend SPI.
 *
 * <p>{@link com.ryuqq.ingest.adapter.opensearch.OpenSearchClientFactory} builds the client from
 * {@link com.ryuqq.ingest.adapter.opensearch.OpenSearchConfig};
 * {@link com.ryuqq.ingest.adapter.opensearch.OpenSearchSearchBackend} submits bulk index
 * requests and reports one result per document.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
package com.ryuqq.ingest.adapter.opensearch;
