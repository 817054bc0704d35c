package com.ryuqq.ingest.application.publisher;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.ingest.application.config.PublisherConfig;
import com.ryuqq.ingest.core.codec.ActionCodec;
import com.ryuqq.ingest.core.exception.MalformedDocumentException;
import com.ryuqq.ingest.core.model.IndexingAction;
import com.ryuqq.ingest.core.spi.DurableChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps documents into {@link IndexingAction} envelopes and publishes them onto the durable channel.
 *
 * <p><strong>Routing:</strong> index and kind come from the metadata the document declares
 * about itself, not from the caller's arguments, so a queued message is self-describing.
 * A mismatch between the two is logged and the document wins.</p>
 *
 * <p><strong>Failure contract:</strong></p>
 * <ul>
 *   <li>{@link MalformedDocumentException}: bad input, do not retry</li>
 *   <li>{@link com.ryuqq.ingest.core.exception.ChannelException}: transient, the caller's task retries</li>
 * </ul>
 *
 * <p>Every call publishes a new action with a fresh id; a retried call can
 * therefore index the same document twice.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public final class DocumentPublisher {

    private static final Logger log = LoggerFactory.getLogger(DocumentPublisher.class);

    private final DurableChannel channel;
    private final ActionCodec codec;
    private final PublisherConfig config;

    public DocumentPublisher(DurableChannel channel, ActionCodec codec, PublisherConfig config) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.channel = channel;
        this.codec = codec;
        this.config = config;
    }

    /**
     * Queues one document for indexing.
     *
     * @param tenant tenant the caller publishes for (non-blank)
     * @param pattern correlation pattern the caller publishes for (non-blank)
     * @param document JSON-serializable document carrying its own routing metadata
     * @return the published action
     * @throws MalformedDocumentException if arguments are blank, the document is not serializable,
     *         or it lacks routing metadata
     * @throws com.ryuqq.ingest.core.exception.ChannelException if the channel rejects the publish
     */
    public IndexingAction enqueueDocument(String tenant, String pattern, Object document) {
        if (tenant == null || tenant.isBlank()) {
            throw new MalformedDocumentException("tenant cannot be null or blank");
        }
        if (pattern == null || pattern.isBlank()) {
            throw new MalformedDocumentException("pattern cannot be null or blank");
        }

        JsonNode tree = codec.toTree(document);
        String index = config.routing().tenantOf(tree);
        String kind = config.routing().patternOf(tree);
        if (!tenant.equals(index) || !pattern.equals(kind)) {
            log.warn("Caller routing ({}/{}) differs from document routing ({}/{}), using the document's",
                tenant, pattern, index, kind);
        }

        IndexingAction action = IndexingAction.create(index, kind, config.defaultTtlMillis(), tree);
        channel.publish(action, channel.name());
        log.debug("Queued action {} for index '{}' kind '{}'", action.actionId().asString(), index, kind);
        return action;
    }
}
