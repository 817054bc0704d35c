package com.ryuqq.ingest.application.bootstrap;

import com.ryuqq.ingest.core.exception.ChannelDeclarationException;
import com.ryuqq.ingest.core.spi.DurableChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares the durable channel at startup according to a {@link DeclarationFailurePolicy}.
 *
 * <p>Declaration is idempotent, so every process (and every worker) may call it.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public final class ChannelBootstrap {

    private static final Logger log = LoggerFactory.getLogger(ChannelBootstrap.class);

    private final DurableChannel channel;
    private final DeclarationFailurePolicy policy;

    public ChannelBootstrap(DurableChannel channel, DeclarationFailurePolicy policy) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.channel = channel;
        this.policy = policy;
    }

    /**
     * Declares the channel.
     *
     * @return true if the channel is declared, false if running degraded
     * @throws ChannelDeclarationException on failure under {@link DeclarationFailurePolicy#FAIL_FAST}
     */
    public boolean declare() {
        try {
            channel.declare();
            return true;
        } catch (RuntimeException e) {
            if (policy == DeclarationFailurePolicy.FAIL_FAST) {
                throw new ChannelDeclarationException("Failed to declare channel '" + channel.name() + "'", e);
            }
            log.error("Failed to declare channel '{}', continuing degraded: publish and pull will fail until it exists",
                channel.name(), e);
            return false;
        }
    }
}
