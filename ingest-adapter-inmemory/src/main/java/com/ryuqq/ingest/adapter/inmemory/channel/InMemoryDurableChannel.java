package com.ryuqq.ingest.adapter.inmemory.channel;

import com.ryuqq.ingest.core.codec.ActionCodec;
import com.ryuqq.ingest.core.exception.ChannelException;
import com.ryuqq.ingest.core.exception.MalformedDocumentException;
import com.ryuqq.ingest.core.exception.NoMessageAvailableException;
import com.ryuqq.ingest.core.exception.WorkerInterruptedException;
import com.ryuqq.ingest.core.model.IndexingAction;
import com.ryuqq.ingest.core.spi.ChannelConsumer;
import com.ryuqq.ingest.core.spi.ChannelMessage;
import com.ryuqq.ingest.core.spi.DurableChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of the {@link DurableChannel} SPI for testing and reference purposes.
 *
 * <p>Messages are stored as serialized JSON bodies, exactly as a broker would hold them,
 * and decoded on every delivery.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Ready Queue:</strong> LinkedBlockingDeque&lt;StoredMessage&gt; - FIFO, requeued messages go to the front</li>
 *   <li><strong>Unacked Tracking:</strong> ConcurrentHashMap&lt;deliveryTag, InFlight&gt; - owner consumer of each delivery</li>
 *   <li><strong>Producer Pool:</strong> Semaphore - bounded set of producers, released on every exit path</li>
 * </ul>
 *
 * <p><strong>Redelivery:</strong> an un-acked message is returned to the ready queue and flagged
 * redelivered when its consumer closes, when the broker connection drops
 * ({@link #disconnect()}), or when its consumer stays silent for longer than the visibility timeout.</p>
 *
 * <p><strong>Visibility:</strong> the timeout is measured from the owning consumer's last
 * pull or ack, not from the delivery of each message, the way a broker heartbeat detects a
 * dead client. A consumer that keeps pulling therefore never loses its un-acked messages and
 * is never handed one of its own deliveries a second time.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryDurableChannel channel = new InMemoryDurableChannel("elasticsearch");
 * channel.declare();
 * channel.publish(action, "elasticsearch");
 *
 * try (ChannelConsumer consumer = channel.openConsumer()) {
 *     ChannelMessage message = consumer.pull(Duration.ofSeconds(1));
 *     message.ack();
 * }
 * </pre>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public class InMemoryDurableChannel implements DurableChannel {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDurableChannel.class);

    /**
     * Default visibility timeout: 2 minutes, longer than a default bulk request may take.
     */
    public static final Duration DEFAULT_VISIBILITY_TIMEOUT = Duration.ofMinutes(2);

    /**
     * Default number of pooled producers.
     */
    public static final int DEFAULT_PRODUCER_POOL_SIZE = 10;

    /**
     * Upper bound on a single blocking wait, so visibility timeouts are noticed while a pull blocks.
     */
    private static final long MAX_WAIT_SLICE_MS = 50;

    private final String name;
    private final ActionCodec codec;
    private final long visibilityTimeoutMs;
    private final long waitSliceMs;
    private final Semaphore producers;

    private final LinkedBlockingDeque<StoredMessage> ready = new LinkedBlockingDeque<>();
    private final ConcurrentHashMap<Long, InFlight> unacked = new ConcurrentHashMap<>();

    private final AtomicBoolean declared = new AtomicBoolean(false);
    private final AtomicInteger declarations = new AtomicInteger();
    private final AtomicReference<RuntimeException> nextDeclareFailure = new AtomicReference<>();
    private volatile boolean connected = true;

    private final AtomicLong messageSequence = new AtomicLong();
    private final AtomicLong deliverySequence = new AtomicLong();
    private final AtomicLong consumerSequence = new AtomicLong();
    private final AtomicInteger openConsumers = new AtomicInteger();
    private final AtomicInteger droppedMessages = new AtomicInteger();

    /**
     * Creates a channel with default visibility timeout and producer pool size.
     *
     * @param name channel name
     */
    public InMemoryDurableChannel(String name) {
        this(name, new ActionCodec(), DEFAULT_VISIBILITY_TIMEOUT, DEFAULT_PRODUCER_POOL_SIZE);
    }

    /**
     * @param name channel name, also its only routing key
     * @param codec JSON codec for message bodies
     * @param visibilityTimeout how long a consumer may stay silent before its un-acked messages are redelivered
     * @param producerPoolSize number of pooled producers
     * @throws IllegalArgumentException if any argument is invalid
     */
    public InMemoryDurableChannel(String name, ActionCodec codec, Duration visibilityTimeout, int producerPoolSize) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (visibilityTimeout == null || visibilityTimeout.isNegative() || visibilityTimeout.isZero()) {
            throw new IllegalArgumentException("visibilityTimeout must be positive, but was: " + visibilityTimeout);
        }
        if (producerPoolSize <= 0) {
            throw new IllegalArgumentException("producerPoolSize must be positive, but was: " + producerPoolSize);
        }
        this.name = name;
        this.codec = codec;
        this.visibilityTimeoutMs = visibilityTimeout.toMillis();
        // a blocked consumer refreshes its activity well within one timeout
        this.waitSliceMs = Math.max(1, Math.min(MAX_WAIT_SLICE_MS, visibilityTimeoutMs / 4));
        this.producers = new Semaphore(producerPoolSize, true);
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Only the first successful call creates the channel; later calls are no-ops</li>
     *   <li>A failure injected with {@link #failNextDeclare(RuntimeException)} is thrown once</li>
     * </ul>
     */
    @Override
    public void declare() {
        ensureConnected();
        RuntimeException failure = nextDeclareFailure.getAndSet(null);
        if (failure != null) {
            throw failure;
        }
        if (declared.compareAndSet(false, true)) {
            declarations.incrementAndGet();
            log.info("Declared durable channel '{}' (direct, routing key '{}')", name, name);
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Acquires a producer permit, blocking while the pool is exhausted</li>
     *   <li>The body is encoded once; consumers decode it on delivery</li>
     * </ul>
     */
    @Override
    public void publish(IndexingAction action, String routingKey) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (routingKey == null) {
            throw new IllegalArgumentException("routingKey cannot be null");
        }

        acquireProducer();
        try {
            ensureConnected();
            ensureDeclared();
            if (!name.equals(routingKey)) {
                throw new ChannelException("Unroutable message: routing key '" + routingKey
                    + "' is not bound to channel '" + name + "'");
            }
            byte[] body = codec.encode(action);
            ready.addLast(new StoredMessage(messageSequence.incrementAndGet(), body, ActionCodec.CONTENT_TYPE, 0));
        } finally {
            producers.release();
        }
    }

    /**
     * Places a body on the channel without encoding it, as a foreign producer would.
     *
     * <p>Bodies that are not {@link ActionCodec#CONTENT_TYPE} or do not decode are dropped on
     * delivery and counted in {@link #droppedMessages()}.</p>
     *
     * @param body raw message body
     * @param contentType content type the producer declared
     */
    public void publishRaw(byte[] body, String contentType) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        if (contentType == null || contentType.isBlank()) {
            throw new IllegalArgumentException("contentType cannot be null or blank");
        }
        ensureConnected();
        ensureDeclared();
        ready.addLast(new StoredMessage(messageSequence.incrementAndGet(), body.clone(), contentType, 0));
    }

    @Override
    public ChannelConsumer openConsumer() {
        ensureConnected();
        ensureDeclared();
        return new InMemoryConsumer(consumerSequence.incrementAndGet());
    }

    /**
     * Returns in-flight messages of consumers silent for longer than the visibility timeout
     * to the ready queue.
     *
     * <p>Called on every pull; may also be called manually in tests.</p>
     *
     * @return number of messages returned to the queue
     */
    public int processVisibilityTimeouts() {
        long now = System.currentTimeMillis();
        List<Long> expired = new ArrayList<>();
        for (Map.Entry<Long, InFlight> entry : unacked.entrySet()) {
            if (now - entry.getValue().owner.lastActivity >= visibilityTimeoutMs) {
                expired.add(entry.getKey());
            }
        }
        return requeue(expired);
    }

    /**
     * Simulates a broker connection drop: every un-acked message is requeued, consumers
     * opened before the drop fail on their next pull, and publish fails until {@link #reconnect()}.
     */
    public void disconnect() {
        connected = false;
        int requeued = requeue(new ArrayList<>(unacked.keySet()));
        log.warn("Channel '{}' disconnected, {} un-acked message(s) requeued", name, requeued);
    }

    /**
     * Restores the broker connection after {@link #disconnect()}.
     */
    public void reconnect() {
        connected = true;
        log.info("Channel '{}' reconnected", name);
    }

    /**
     * Makes the next {@link #declare()} call throw the given failure.
     *
     * @param failure failure to throw
     */
    public void failNextDeclare(RuntimeException failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        nextDeclareFailure.set(failure);
    }

    /**
     * Clears all messages. Used for test cleanup.
     */
    public void clear() {
        ready.clear();
        unacked.clear();
    }

    /**
     * @return ready plus un-acked messages, i.e. everything not yet acknowledged
     */
    public int messageCount() {
        return ready.size() + unacked.size();
    }

    public int readyCount() {
        return ready.size();
    }

    public int unackedCount() {
        return unacked.size();
    }

    /**
     * @return number of times the channel was actually created
     */
    public int declarations() {
        return declarations.get();
    }

    public boolean isDeclared() {
        return declared.get();
    }

    public int openConsumers() {
        return openConsumers.get();
    }

    /**
     * @return number of undecodable messages dropped on delivery
     */
    public int droppedMessages() {
        return droppedMessages.get();
    }

    /**
     * @return decoded snapshot of the ready queue, in delivery order
     */
    public List<IndexingAction> readySnapshot() {
        List<IndexingAction> snapshot = new ArrayList<>();
        for (StoredMessage message : ready) {
            snapshot.add(codec.decode(message.body));
        }
        return snapshot;
    }

    private void acquireProducer() {
        try {
            producers.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerInterruptedException("Interrupted while acquiring a producer for '" + name + "'", e);
        }
    }

    private void ensureConnected() {
        if (!connected) {
            throw new ChannelException("Broker connection to channel '" + name + "' is unavailable");
        }
    }

    private void ensureDeclared() {
        if (!declared.get()) {
            throw new ChannelException("Channel '" + name + "' has not been declared");
        }
    }

    private int requeue(List<Long> deliveryTags) {
        List<InFlight> removed = new ArrayList<>();
        for (Long tag : deliveryTags) {
            InFlight inFlight = unacked.remove(tag);
            if (inFlight != null) {
                removed.add(inFlight);
            }
        }
        // front of the queue, oldest first
        removed.sort(Comparator.comparingLong((InFlight f) -> f.message.sequence).reversed());
        for (InFlight inFlight : removed) {
            ready.addFirst(inFlight.message);
        }
        return removed.size();
    }

    private static final class StoredMessage {
        private final long sequence;
        private final byte[] body;
        private final String contentType;
        private final int deliveries;

        StoredMessage(long sequence, byte[] body, String contentType, int deliveries) {
            this.sequence = sequence;
            this.body = body;
            this.contentType = contentType;
            this.deliveries = deliveries;
        }

        StoredMessage delivered() {
            return new StoredMessage(sequence, body, contentType, deliveries + 1);
        }
    }

    private static final class InFlight {
        private final StoredMessage message;
        private final InMemoryConsumer owner;

        InFlight(StoredMessage message, InMemoryConsumer owner) {
            this.message = message;
            this.owner = owner;
        }
    }

    private final class InMemoryConsumer implements ChannelConsumer {

        private final long id;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private volatile boolean stale;
        private volatile long lastActivity = System.currentTimeMillis();

        InMemoryConsumer(long id) {
            this.id = id;
            openConsumers.incrementAndGet();
        }

        void touch() {
            lastActivity = System.currentTimeMillis();
        }

        @Override
        public ChannelMessage pull(Duration timeout) {
            if (timeout == null || timeout.isNegative()) {
                throw new IllegalArgumentException("timeout must be non-negative, but was: " + timeout);
            }
            long deadline = System.nanoTime() + timeout.toNanos();

            while (true) {
                checkUsable();
                touch();
                processVisibilityTimeouts();

                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                StoredMessage stored;
                try {
                    stored = ready.pollFirst(Math.max(0, Math.min(remainingMs, waitSliceMs)), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new WorkerInterruptedException("Interrupted while pulling from '" + name + "'", e);
                }
                touch();

                if (stored != null) {
                    if (!connected) {
                        ready.addFirst(stored);
                        continue;
                    }
                    ChannelMessage message = deliver(stored);
                    if (message != null) {
                        return message;
                    }
                } else if (System.nanoTime() - deadline >= 0) {
                    throw new NoMessageAvailableException(name, timeout);
                }
            }
        }

        private ChannelMessage deliver(StoredMessage stored) {
            long tag = deliverySequence.incrementAndGet();
            StoredMessage delivered = stored.delivered();
            if (!ActionCodec.CONTENT_TYPE.equals(stored.contentType)) {
                droppedMessages.incrementAndGet();
                log.error("Dropping message #{} from channel '{}': unsupported content type '{}'",
                    stored.sequence, name, stored.contentType);
                return null;
            }
            unacked.put(tag, new InFlight(delivered, this));
            try {
                return new InMemoryMessage(tag, this, codec.decode(stored.body), stored.contentType, stored.deliveries > 0);
            } catch (MalformedDocumentException e) {
                unacked.remove(tag);
                droppedMessages.incrementAndGet();
                log.error("Dropping undecodable message #{} from channel '{}'", stored.sequence, name, e);
                return null;
            }
        }

        private void checkUsable() {
            if (closed.get()) {
                throw new ChannelException("Consumer " + id + " on channel '" + name + "' is closed");
            }
            if (!connected) {
                stale = true;
            }
            if (stale) {
                throw new ChannelException("Consumer " + id + " lost its connection to channel '" + name + "'");
            }
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            openConsumers.decrementAndGet();
            List<Long> owned = new ArrayList<>();
            for (Map.Entry<Long, InFlight> entry : unacked.entrySet()) {
                if (entry.getValue().owner == this) {
                    owned.add(entry.getKey());
                }
            }
            int requeued = requeue(owned);
            if (requeued > 0) {
                log.debug("Consumer {} closed, {} un-acked message(s) requeued on '{}'", id, requeued, name);
            }
        }
    }

    private final class InMemoryMessage implements ChannelMessage {

        private final long deliveryTag;
        private final InMemoryConsumer consumer;
        private final IndexingAction action;
        private final String contentType;
        private final boolean redelivered;

        InMemoryMessage(long deliveryTag, InMemoryConsumer consumer, IndexingAction action,
                        String contentType, boolean redelivered) {
            this.deliveryTag = deliveryTag;
            this.consumer = consumer;
            this.action = action;
            this.contentType = contentType;
            this.redelivered = redelivered;
        }

        @Override
        public IndexingAction action() {
            return action;
        }

        @Override
        public long deliveryTag() {
            return deliveryTag;
        }

        @Override
        public String contentType() {
            return contentType;
        }

        @Override
        public boolean redelivered() {
            return redelivered;
        }

        @Override
        public void ack() {
            ensureConnected();
            consumer.touch();
            unacked.remove(deliveryTag);
        }

        @Override
        public String toString() {
            return "InMemoryMessage{tag=" + deliveryTag + ", actionId=" + action.actionId().asString()
                + ", redelivered=" + redelivered + '}';
        }
    }
}
