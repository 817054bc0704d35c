package com.ryuqq.ingest.core.spi;

import com.ryuqq.ingest.core.model.IndexingAction;

/**
 * Durable Channel SPI.
 *
 * <p>A named, durable, direct-routed channel that keeps messages until they are
 * consumed and acknowledged.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Declaring the channel and its routing binding (idempotent)</li>
 *   <li>Publishing serialized indexing actions through a pooled producer</li>
 *   <li>Opening consumer connections for blocking pulls</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: declare and publish may be called from many threads</li>
 *   <li>At-least-once delivery: each message is delivered to exactly one consumer at a time
 *       and redelivered if that consumer never acknowledges it</li>
 *   <li>Failures on an undeclared or unavailable channel are reported per call as
 *       {@link com.ryuqq.ingest.core.exception.ChannelException}</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * channel.declare();
 * channel.publish(action, channel.name());
 *
 * try (ChannelConsumer consumer = channel.openConsumer()) {
 *     ChannelMessage message = consumer.pull(Duration.ofSeconds(60));
 *     index(message.action());
 *     message.ack();
 * }
 * </pre>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public interface DurableChannel {

    /**
     * @return the channel name, also the only routing key bound to it
     */
    String name();

    /**
     * Creates the channel and its direct routing binding with durability enabled.
     *
     * <p>Idempotent and safe to call concurrently from several workers; redeclaring
     * never duplicates the channel or drops queued messages.</p>
     *
     * @throws com.ryuqq.ingest.core.exception.ChannelException if the broker rejects the declaration
     */
    void declare();

    /**
     * Serializes the action to JSON and enqueues it durably.
     *
     * <p>Blocks until a producer is acquired from the pool. The producer is released
     * on every exit path.</p>
     *
     * @param action the action to publish
     * @param routingKey routing key; must equal {@link #name()}
     * @throws IllegalArgumentException if action or routingKey is null
     * @throws com.ryuqq.ingest.core.exception.ChannelException if the channel is unavailable,
     *         undeclared, or the routing key is not bound
     * @throws com.ryuqq.ingest.core.exception.MalformedDocumentException if the action cannot be serialized
     */
    void publish(IndexingAction action, String routingKey);

    /**
     * Opens one consumer connection.
     *
     * @return a new consumer; the caller must close it
     * @throws com.ryuqq.ingest.core.exception.ChannelException if the channel is unavailable or undeclared
     */
    ChannelConsumer openConsumer();
}
