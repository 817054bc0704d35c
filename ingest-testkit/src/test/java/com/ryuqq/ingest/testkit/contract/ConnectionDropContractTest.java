package com.ryuqq.ingest.testkit.contract;

import com.ryuqq.ingest.adapter.runner.BatchFlusher;
import com.ryuqq.ingest.application.runtime.FlusherState;
import com.ryuqq.ingest.core.model.IndexingAction;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: recovery from dropped connections.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Backend connection drops during submission → document redelivered and indexed</li>
 *   <li>Backend unreachable for a while → flusher keeps retrying, nothing is acknowledged early</li>
 *   <li>Broker connection drops → flusher reconnects and keeps consuming</li>
 * </ul>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
class ConnectionDropContractTest extends AbstractContractTest {

    @Test
    void testBackendDropDuringSubmission_DocumentRedeliveredAndIndexed() {
        // Given
        IndexingAction action = publish("acme", "login", 1);
        backend.failNextSubmissions(1);

        // When
        BatchFlusher flusher = startFlusher(flusherConfig(1));
        awaitUntil(() -> flusher.acknowledged() == 1, "document acknowledged after reconnect");

        // Then
        assertEquals(1, flusher.restarts());
        assertEquals(2, backend.submittedBatches().size());
        assertIndexed(action);
        assertChannelDepth(0);
    }

    @Test
    void testBackendUnreachable_NothingAcknowledgedUntilItRecovers() {
        // Given
        IndexingAction action = publish("acme", "login", 1);
        backend.failNextConnections(3);

        // When
        BatchFlusher flusher = startFlusher(flusherConfig(1));
        awaitUntil(() -> flusher.restarts() >= 3, "three failed connection attempts");

        // Then
        awaitUntil(() -> flusher.acknowledged() == 1, "document acknowledged after recovery");
        assertIndexed(action);
        assertChannelDepth(0);
        assertTrue(backend.openConnectionCount() <= 1, "at most one open connection per worker");
    }

    @Test
    void testBrokerDrop_FlusherReconnects() {
        // Given
        BatchFlusher flusher = startFlusher(flusherConfig(2));
        awaitUntil(() -> flusher.state() == FlusherState.STREAMING, "flusher streaming");

        // When
        channel.disconnect();
        awaitUntil(() -> flusher.restarts() >= 1, "flusher noticed the dropped connection");
        channel.reconnect();
        IndexingAction action = publish("acme", "login", 1);

        // Then
        awaitUntil(() -> flusher.acknowledged() == 1, "document acknowledged after reconnect");
        assertIndexed(action);
        assertChannelDepth(0);
    }
}
