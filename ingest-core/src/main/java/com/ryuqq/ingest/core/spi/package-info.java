/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Interfaces implemented by infrastructure adapters: the durable channel the
 * documents are queued on and the search backend they are flushed to.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.ingest.core.spi.DurableChannel} - declare, publish, open consumers</li>
 *   <li>{@link com.ryuqq.ingest.core.spi.ChannelConsumer} - blocking pull with timeout</li>
 *   <li>{@link com.ryuqq.ingest.core.spi.ChannelMessage} - delivered message with ack capability</li>
 *   <li>{@link com.ryuqq.ingest.core.spi.SearchBackend} - opens backend connections</li>
 *   <li>{@link com.ryuqq.ingest.core.spi.BackendConnection} - bulk submission with per-document results</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (ingest-adapter-inmemory, ingest-adapter-opensearch) provide the
 * concrete implementations. Core does not depend on any broker or search client.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
package com.ryuqq.ingest.core.spi;
