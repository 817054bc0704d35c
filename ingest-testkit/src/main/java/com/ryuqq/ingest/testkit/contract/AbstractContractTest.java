package com.ryuqq.ingest.testkit.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.ingest.adapter.inmemory.backend.InMemorySearchBackend;
import com.ryuqq.ingest.adapter.inmemory.channel.InMemoryDurableChannel;
import com.ryuqq.ingest.adapter.runner.BatchFlusher;
import com.ryuqq.ingest.adapter.runner.FlusherConfig;
import com.ryuqq.ingest.application.config.PublisherConfig;
import com.ryuqq.ingest.application.publisher.DocumentPublisher;
import com.ryuqq.ingest.core.codec.ActionCodec;
import com.ryuqq.ingest.core.model.IndexingAction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for pipeline contract tests.
 *
 * <p>Provides a fresh in-memory channel, search backend and publisher per test, plus
 * helpers to run {@link BatchFlusher} workers on background threads.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryDurableChannel: broker simulation with redelivery</li>
 *   <li>InMemorySearchBackend: bulk indexing with scripted rejections</li>
 *   <li>DocumentPublisher: publishes documents that carry their own routing metadata</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         IndexingAction action = publish("acme", "login", 1);
 *         BatchFlusher flusher = startFlusher(flusherConfig(3));
 *
 *         awaitUntil(() -&gt; flusher.acknowledged() == 1, "document acknowledged");
 *         assertChannelDepth(0);
 *     }
 * }
 * </pre>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected static final String CHANNEL_NAME = "elasticsearch";
    protected static final Duration AWAIT_TIMEOUT = Duration.ofSeconds(5);

    protected InMemoryDurableChannel channel;
    protected InMemorySearchBackend backend;
    protected ActionCodec codec;
    protected DocumentPublisher publisher;

    private final List<BatchFlusher> flushers = new ArrayList<>();
    private final List<Thread> workerThreads = new ArrayList<>();

    /**
     * Creates fresh SPI implementations and declares the channel.
     */
    @BeforeEach
    void setUp() {
        codec = new ActionCodec();
        channel = createChannel();
        channel.declare();
        backend = new InMemorySearchBackend();
        publisher = new DocumentPublisher(channel, codec, new PublisherConfig());
    }

    /**
     * Stops every worker started by the test and clears in-memory state.
     */
    @AfterEach
    void tearDown() throws InterruptedException {
        flushers.forEach(BatchFlusher::stop);
        for (Thread thread : workerThreads) {
            thread.interrupt();
            thread.join(AWAIT_TIMEOUT.toMillis());
        }
        flushers.clear();
        workerThreads.clear();
        if (channel != null) {
            channel.clear();
        }
        if (backend != null) {
            backend.clear();
        }
    }

    /**
     * Channel used by the test. Override to change the visibility timeout.
     *
     * @return a new, undeclared channel
     */
    protected InMemoryDurableChannel createChannel() {
        return new InMemoryDurableChannel(CHANNEL_NAME);
    }

    /**
     * Builds a document declaring the given routing metadata.
     *
     * @param tenant tenant (becomes the target index)
     * @param pattern correlation pattern (becomes the document kind)
     * @param seq sequence number stored in the document
     * @return the document
     */
    protected ObjectNode document(String tenant, String pattern, int seq) {
        ObjectNode document = JsonNodeFactory.instance.objectNode();
        ObjectNode routing = document.putObject("routing");
        routing.put("tenant", tenant);
        routing.putObject("correlation").put("pattern", pattern);
        document.put("seq", seq);
        document.put("message", "event " + seq);
        return document;
    }

    /**
     * Publishes one document through the publisher.
     *
     * @return the published action
     */
    protected IndexingAction publish(String tenant, String pattern, int seq) {
        return publisher.enqueueDocument(tenant, pattern, document(tenant, pattern, seq));
    }

    /**
     * Publishes documents numbered 1..count for one tenant and pattern.
     *
     * @return the published actions in publish order
     */
    protected List<IndexingAction> publishAll(String tenant, String pattern, int count) {
        List<IndexingAction> actions = new ArrayList<>(count);
        for (int seq = 1; seq <= count; seq++) {
            actions.add(publish(tenant, pattern, seq));
        }
        return actions;
    }

    /**
     * Flusher settings with short timeouts suitable for tests.
     *
     * @param bulkSize documents per batch
     * @return flusher settings
     */
    protected FlusherConfig flusherConfig(int bulkSize) {
        return new FlusherConfig()
            .withBulkSize(bulkSize)
            .withWaitTimeout(Duration.ofMillis(50))
            .withReconnectBackoff(Duration.ofMillis(10), Duration.ofMillis(100), 0.0);
    }

    /**
     * Runs a new flusher on a background thread. It is stopped after the test.
     *
     * @param config flusher settings
     * @return the running flusher
     */
    protected BatchFlusher startFlusher(FlusherConfig config) {
        BatchFlusher flusher = new BatchFlusher(channel, backend, config);
        Thread thread = new Thread(flusher::runFlushLoop, "contract-flusher-" + (flushers.size() + 1));
        flushers.add(flusher);
        workerThreads.add(thread);
        thread.start();
        return flusher;
    }

    /**
     * Stops a flusher started by {@link #startFlusher} and waits for its thread.
     */
    protected void stopFlusher(BatchFlusher flusher) {
        int index = flushers.indexOf(flusher);
        assertTrue(index >= 0, "Flusher was not started by this test");
        flusher.stop();
        Thread thread = workerThreads.get(index);
        try {
            thread.join(AWAIT_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while stopping flusher", e);
        }
        assertFalse(thread.isAlive(), "Flusher thread should have stopped");
    }

    /**
     * Polls the condition until it holds or {@link #AWAIT_TIMEOUT} passes.
     *
     * @param condition condition to wait for
     * @param description shown when the wait times out
     */
    protected void awaitUntil(BooleanSupplier condition, String description) {
        long deadline = System.nanoTime() + AWAIT_TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() - deadline > 0) {
                fail("Timed out after " + AWAIT_TIMEOUT.toMillis() + "ms waiting for: " + description);
            }
            sleep(10);
        }
    }

    /**
     * Asserts the number of messages still held by the channel (ready + un-acked).
     *
     * @param expected expected depth
     */
    protected void assertChannelDepth(int expected) {
        assertEquals(expected, channel.messageCount(),
            String.format("Expected %d messages on channel '%s' (ready=%d, unacked=%d)",
                expected, CHANNEL_NAME, channel.readyCount(), channel.unackedCount()));
    }

    /**
     * Asserts the action's document is indexed.
     */
    protected void assertIndexed(IndexingAction action) {
        assertTrue(backend.isIndexed(action.actionId()),
            String.format("Expected action %s (seq %s) to be indexed",
                action.actionId().asString(), seqOf(action)));
    }

    protected void assertNotIndexed(IndexingAction action) {
        assertFalse(backend.isIndexed(action.actionId()),
            String.format("Expected action %s (seq %s) not to be indexed",
                action.actionId().asString(), seqOf(action)));
    }

    /**
     * @return the {@code seq} field of the action's document
     */
    protected static int seqOf(IndexingAction action) {
        JsonNode seq = action.payload().get("seq");
        return seq == null ? -1 : seq.asInt();
    }

    /**
     * Sleeps for the specified duration. Used for timing-sensitive tests.
     *
     * @param millis milliseconds to sleep
     */
    protected void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Sleep interrupted", e);
        }
    }
}
