package com.ryuqq.ingest.application.config;

import com.ryuqq.ingest.core.model.DocumentRouting;
import com.typesafe.config.Config;

import java.time.Duration;

/**
 * Publisher settings (immutable record).
 *
 * <ul>
 *   <li>defaultTtl: lifetime hint stamped on every action, null for none (default none)</li>
 *   <li>routing: where documents declare their tenant and pattern</li>
 * </ul>
 *
 * @param defaultTtl default time to live, null for none
 * @param routing routing metadata pointers
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public record PublisherConfig(
    Duration defaultTtl,
    DocumentRouting routing
) {

    public PublisherConfig() {
        this(null, DocumentRouting.DEFAULT);
    }

    public PublisherConfig {
        if (defaultTtl != null && (defaultTtl.isNegative() || defaultTtl.isZero())) {
            throw new IllegalArgumentException("defaultTtl must be positive (current: " + defaultTtl + ")");
        }
        if (routing == null) {
            throw new IllegalArgumentException("routing cannot be null");
        }
    }

    /**
     * Reads {@code ingest.ttl} and {@code ingest.routing.*}.
     *
     * @param config resolved configuration
     * @return publisher settings
     */
    public static PublisherConfig fromConfig(Config config) {
        Duration ttl = config.hasPath("ingest.ttl") ? config.getDuration("ingest.ttl") : null;
        DocumentRouting routing = new DocumentRouting(
            config.getString("ingest.routing.tenant-pointer"),
            config.getString("ingest.routing.pattern-pointer")
        );
        return new PublisherConfig(ttl, routing);
    }

    /**
     * @return default TTL in milliseconds, or null
     */
    public Long defaultTtlMillis() {
        return defaultTtl == null ? null : defaultTtl.toMillis();
    }

    public PublisherConfig withDefaultTtl(Duration defaultTtl) {
        return new PublisherConfig(defaultTtl, routing);
    }

    public PublisherConfig withRouting(DocumentRouting routing) {
        return new PublisherConfig(defaultTtl, routing);
    }
}
