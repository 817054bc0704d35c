package com.ryuqq.ingest.testkit.contract;

import com.ryuqq.ingest.adapter.runner.BatchFlusher;
import com.ryuqq.ingest.adapter.runner.PendingAcks;
import com.ryuqq.ingest.adapter.runner.StreamReader;
import com.ryuqq.ingest.application.runtime.FlusherState;
import com.ryuqq.ingest.core.exception.NoMessageAvailableException;
import com.ryuqq.ingest.core.model.IndexingAction;
import com.ryuqq.ingest.core.spi.ChannelConsumer;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: a pull timeout is an empty cycle, not an error.
 *
 * @author Ingest Team
 * @since 1.0.0
 */
class TimeoutContractTest extends AbstractContractTest {

    @Test
    void testEmptyChannel_PullTimesOut() {
        // Given
        try (ChannelConsumer consumer = channel.openConsumer()) {
            // When & Then
            NoMessageAvailableException timeout = assertThrows(NoMessageAvailableException.class,
                () -> consumer.pull(Duration.ofMillis(50)));
            assertEquals(Duration.ofMillis(50), timeout.getWaited());
        }
    }

    @Test
    void testEmptyChannel_StreamReaderPollReturnsEmpty() {
        // Given
        try (ChannelConsumer consumer = channel.openConsumer()) {
            PendingAcks pending = new PendingAcks(1);
            StreamReader reader = new StreamReader(consumer, pending, Duration.ofMillis(50));

            // When & Then
            assertTrue(reader.poll().isEmpty());
            assertTrue(pending.isEmpty());
        }
    }

    @Test
    void testIdleFlusher_NoRestartsAndResumesOnTraffic() {
        // Given
        BatchFlusher flusher = startFlusher(flusherConfig(10));
        awaitUntil(() -> flusher.state() == FlusherState.STREAMING, "flusher streaming");

        // When: several pull timeouts pass
        sleep(300);

        // Then
        assertEquals(0, flusher.restarts());
        assertEquals(FlusherState.STREAMING, flusher.state());
        assertEquals(1, channel.openConsumers());

        // And: traffic after the idle period is processed
        IndexingAction action = publish("acme", "login", 1);
        awaitUntil(() -> flusher.acknowledged() == 1, "document acknowledged");
        assertIndexed(action);
    }
}
