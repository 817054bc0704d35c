package com.ryuqq.ingest.application.bootstrap;

/**
 * What to do when the durable channel cannot be declared at startup.
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public enum DeclarationFailurePolicy {

    /**
     * Throw {@link com.ryuqq.ingest.core.exception.ChannelDeclarationException} and stop startup.
     */
    FAIL_FAST,

    /**
     * Log the failure and keep running; publish and pull calls fail individually afterwards.
     */
    DEGRADE
}
