package com.ryuqq.ingest.application.config;

import com.ryuqq.ingest.application.bootstrap.DeclarationFailurePolicy;
import com.typesafe.config.Config;

/**
 * Durable channel settings (immutable record).
 *
 * <ul>
 *   <li>name: channel name and routing key (default "elasticsearch")</li>
 *   <li>declarationFailurePolicy: behaviour when declare fails (default DEGRADE)</li>
 * </ul>
 *
 * @param name channel name
 * @param declarationFailurePolicy fail-fast or degrade on declaration failure
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public record ChannelConfig(
    String name,
    DeclarationFailurePolicy declarationFailurePolicy
) {

    public static final String DEFAULT_NAME = "elasticsearch";

    public ChannelConfig() {
        this(DEFAULT_NAME, DeclarationFailurePolicy.DEGRADE);
    }

    public ChannelConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (declarationFailurePolicy == null) {
            throw new IllegalArgumentException("declarationFailurePolicy cannot be null");
        }
    }

    /**
     * Reads {@code ingest.channel.*}.
     *
     * @param config resolved configuration
     * @return channel settings
     */
    public static ChannelConfig fromConfig(Config config) {
        Config channel = config.getConfig("ingest.channel");
        return new ChannelConfig(
            channel.getString("name"),
            channel.getEnum(DeclarationFailurePolicy.class, "declare-on-failure")
        );
    }

    public ChannelConfig withName(String name) {
        return new ChannelConfig(name, declarationFailurePolicy);
    }

    public ChannelConfig withDeclarationFailurePolicy(DeclarationFailurePolicy declarationFailurePolicy) {
        return new ChannelConfig(name, declarationFailurePolicy);
    }
}
