package com.ryuqq.ingest.application.runtime;

/**
 * States of a flush loop.
 *
 * <pre>
 * CONNECTING → STREAMING → ACK_OR_SKIP → STREAMING → ...
 *      ▲                                      │
 *      └──────────── on failure ──────────────┘
 * any → STOPPED (on stop)
 * </pre>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public enum FlusherState {
    NEW,
    CONNECTING,
    STREAMING,
    ACK_OR_SKIP,
    STOPPED
}
