package com.ryuqq.ingest.adapter.inmemory.backend;

import com.ryuqq.ingest.core.exception.BackendException;
import com.ryuqq.ingest.core.model.ActionId;
import com.ryuqq.ingest.core.model.IndexingAction;
import com.ryuqq.ingest.core.spi.BackendConnection;
import com.ryuqq.ingest.core.spi.BulkItemResult;
import com.ryuqq.ingest.core.spi.SearchBackend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * In-memory implementation of the {@link SearchBackend} SPI for testing and reference purposes.
 *
 * <p>Indexes documents into a map keyed by {@link ActionId}. Behaviour is scriptable:</p>
 * <ul>
 *   <li>{@link #rejectWhen(Predicate, int, String)} - per-document rejection (partial batch failure)</li>
 *   <li>{@link #failNextSubmissions(int)} - whole-request failures (connection drop)</li>
 *   <li>{@link #failNextConnections(int)} - connect failures (backend down)</li>
 * </ul>
 *
 * <p>Re-indexing an existing ActionId overwrites it, like a bulk {@code index} operation.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public class InMemorySearchBackend implements SearchBackend {

    private final Map<ActionId, IndexingAction> indexed = new ConcurrentHashMap<>();
    private final List<List<IndexingAction>> submittedBatches = new CopyOnWriteArrayList<>();
    private final AtomicInteger connections = new AtomicInteger();
    private final AtomicInteger openConnections = new AtomicInteger();
    private final AtomicInteger pendingSubmitFailures = new AtomicInteger();
    private final AtomicInteger pendingConnectFailures = new AtomicInteger();

    private volatile Predicate<IndexingAction> rejection = action -> false;
    private volatile int rejectionStatus = 400;
    private volatile String rejectionError = "mapper_parsing_exception";

    @Override
    public BackendConnection connect() {
        if (consume(pendingConnectFailures)) {
            throw new BackendException("Connection refused (simulated)");
        }
        connections.incrementAndGet();
        openConnections.incrementAndGet();
        return new InMemoryConnection();
    }

    /**
     * Rejects every document matching the predicate with the given status and error.
     *
     * @param predicate documents to reject
     * @param status backend status code reported for rejected documents
     * @param error error detail reported for rejected documents
     */
    public void rejectWhen(Predicate<IndexingAction> predicate, int status, String error) {
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("error cannot be null or blank");
        }
        this.rejectionStatus = status;
        this.rejectionError = error;
        this.rejection = predicate;
    }

    /**
     * Stops rejecting documents.
     */
    public void acceptAll() {
        this.rejection = action -> false;
    }

    /**
     * The next {@code count} bulk submissions fail as a whole with {@link BackendException}.
     *
     * @param count number of failing submissions
     */
    public void failNextSubmissions(int count) {
        pendingSubmitFailures.set(count);
    }

    /**
     * The next {@code count} connection attempts fail with {@link BackendException}.
     *
     * @param count number of failing connects
     */
    public void failNextConnections(int count) {
        pendingConnectFailures.set(count);
    }

    public List<IndexingAction> indexedDocuments() {
        return new ArrayList<>(indexed.values());
    }

    public boolean isIndexed(ActionId actionId) {
        return indexed.containsKey(actionId);
    }

    public int indexedCount() {
        return indexed.size();
    }

    /**
     * @return every submitted batch, in submission order, including failed ones
     */
    public List<List<IndexingAction>> submittedBatches() {
        return Collections.unmodifiableList(new ArrayList<>(submittedBatches));
    }

    public int connectionCount() {
        return connections.get();
    }

    public int openConnectionCount() {
        return openConnections.get();
    }

    public void clear() {
        indexed.clear();
        submittedBatches.clear();
        acceptAll();
        pendingSubmitFailures.set(0);
        pendingConnectFailures.set(0);
    }

    private static boolean consume(AtomicInteger counter) {
        while (true) {
            int current = counter.get();
            if (current <= 0) {
                return false;
            }
            if (counter.compareAndSet(current, current - 1)) {
                return true;
            }
        }
    }

    private final class InMemoryConnection implements BackendConnection {

        private final AtomicBoolean closed = new AtomicBoolean(false);

        @Override
        public List<BulkItemResult> submit(List<IndexingAction> batch) {
            if (batch == null || batch.isEmpty()) {
                throw new IllegalArgumentException("batch cannot be null or empty");
            }
            if (closed.get()) {
                throw new BackendException("Connection is closed");
            }
            submittedBatches.add(List.copyOf(batch));
            if (consume(pendingSubmitFailures)) {
                throw new BackendException("Connection reset during bulk request (simulated)");
            }

            Predicate<IndexingAction> reject = rejection;
            List<BulkItemResult> results = new ArrayList<>(batch.size());
            for (IndexingAction action : batch) {
                if (reject.test(action)) {
                    results.add(BulkItemResult.failed(action.actionId(), rejectionStatus, rejectionError));
                } else {
                    boolean created = indexed.put(action.actionId(), action) == null;
                    results.add(BulkItemResult.ok(action.actionId(), created ? 201 : 200));
                }
            }
            return results;
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                openConnections.decrementAndGet();
            }
        }
    }
}
