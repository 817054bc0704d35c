/**
 * In-memory durable channel adapter for testing and reference.
 *
 * <p>Reference implementation of {@link com.ryuqq.ingest.core.spi.DurableChannel} built on
 * concurrent collections.</p>
 *
 * <h2>Message Lifecycle</h2>
 *
 * <pre>
 * ┌─────────────┐
 * │   publish   │ (pooled producer, JSON body)
 * └──────┬──────┘
 *        │
 *        ▼
 * ┌─────────────┐
 * │ Ready Queue │ (FIFO)
 * └──────┬──────┘
 *        │
 *        ▼
 * ┌─────────────┐
 * │    pull     │ → un-acked, owned by the pulling consumer
 * └──────┬──────┘
 *        │
 *        ├──► ack() ─────────────────────────► [Permanently Removed]
 *        │
 *        ├──► consumer close() ──────────────► [Requeued at front, redelivered=true]
 *        │
 *        ├──► disconnect() ──────────────────► [Requeued at front, redelivered=true]
 *        │
 *        └──► Owner silent past timeout ─────► [Requeued at front, redelivered=true]
 * </pre>
 *
 * <h2>Limitations</h2>
 *
 * <ul>
 *   <li><strong>In-Memory Only:</strong> messages survive consumer crashes but not a JVM restart</li>
 *   <li><strong>Single JVM:</strong> producers and consumers must share the instance</li>
 * </ul>
 *
 * @see com.ryuqq.ingest.core.spi.DurableChannel
 * @author Ingest Team
 * @since 1.0.0
 */
package com.ryuqq.ingest.adapter.inmemory.channel;
