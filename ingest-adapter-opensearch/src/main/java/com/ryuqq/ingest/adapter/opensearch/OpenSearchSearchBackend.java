package com.ryuqq.ingest.adapter.opensearch;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.ingest.core.codec.ActionCodec;
import com.ryuqq.ingest.core.exception.BackendException;
import com.ryuqq.ingest.core.model.ActionId;
import com.ryuqq.ingest.core.model.IndexingAction;
import com.ryuqq.ingest.core.spi.BackendConnection;
import com.ryuqq.ingest.core.spi.BulkItemResult;
import com.ryuqq.ingest.core.spi.SearchBackend;
import com.typesafe.config.Config;
import org.opensearch.client.opensearch.OpenSearchClient;
import org.opensearch.client.opensearch._types.ErrorCause;
import org.opensearch.client.opensearch._types.OpenSearchException;
import org.opensearch.client.opensearch.core.BulkRequest;
import org.opensearch.client.opensearch.core.BulkResponse;
import org.opensearch.client.opensearch.core.bulk.BulkOperation;
import org.opensearch.client.opensearch.core.bulk.BulkResponseItem;
import org.opensearch.client.opensearch.core.bulk.IndexOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link SearchBackend} on an OpenSearch cluster.
 *
 * <p><strong>Mapping:</strong></p>
 * <ul>
 *   <li>{@code _index} → bulk {@code index} operation target</li>
 *   <li>{@code _id} → document id, so a redelivered action overwrites its earlier copy</li>
 *   <li>{@code _source} → document body</li>
 *   <li>{@code _type} and {@code _ttl} are not sent: OpenSearch has neither mapping types nor TTL</li>
 * </ul>
 *
 * <p>The client is thread-safe and shared; a connection is a cheap handle over it that
 * checks cluster reachability when opened.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public class OpenSearchSearchBackend implements SearchBackend {

    private static final Logger log = LoggerFactory.getLogger(OpenSearchSearchBackend.class);

    private final OpenSearchClient client;

    public OpenSearchSearchBackend(OpenSearchClient client) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        this.client = client;
    }

    /**
     * Builds a backend whose client serializes documents with the codec's mapper.
     *
     * @param config connection settings
     * @param codec codec the channel uses
     * @return a backend owning a new client
     */
    public static OpenSearchSearchBackend create(OpenSearchConfig config, ActionCodec codec) {
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        return new OpenSearchSearchBackend(OpenSearchClientFactory.create(config, codec.getObjectMapper()));
    }

    /**
     * {@code ingest.opensearch} 설정으로 생성합니다.
     */
    public static OpenSearchSearchBackend fromConfig(Config config, ActionCodec codec) {
        return create(OpenSearchConfig.fromConfig(config), codec);
    }

    OpenSearchClient client() {
        return client;
    }

    @Override
    public BackendConnection connect() {
        boolean reachable;
        try {
            reachable = client.ping().value();
        } catch (IOException | OpenSearchException e) {
            throw new BackendException("OpenSearch cluster is unreachable", e);
        }
        if (!reachable) {
            throw new BackendException("OpenSearch cluster did not answer ping");
        }
        return new OpenSearchConnection();
    }

    /**
     * Closes the underlying transport.
     *
     * @throws BackendException if the transport fails to close
     */
    public void shutdown() {
        try {
            client._transport().close();
        } catch (IOException e) {
            throw new BackendException("Failed to close OpenSearch transport", e);
        }
    }

    static BulkRequest toBulkRequest(List<IndexingAction> batch) {
        List<BulkOperation> operations = new ArrayList<>(batch.size());
        for (IndexingAction action : batch) {
            IndexOperation<JsonNode> index = new IndexOperation.Builder<JsonNode>()
                .index(action.targetIndex())
                .id(action.actionId().asString())
                .document(action.payload())
                .build();
            operations.add(new BulkOperation.Builder().index(index).build());
        }
        return new BulkRequest.Builder().operations(operations).build();
    }

    static List<BulkItemResult> toResults(List<IndexingAction> batch, BulkResponse response) {
        List<BulkResponseItem> items = response.items();
        List<BulkItemResult> results = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            BulkResponseItem item = items.get(i);
            ActionId actionId = resolveId(item, i < batch.size() ? batch.get(i) : null);
            ErrorCause error = item.error();
            if (error == null && item.status() >= 200 && item.status() < 300) {
                results.add(BulkItemResult.ok(actionId, item.status()));
            } else {
                results.add(BulkItemResult.failed(actionId, item.status(), describe(error, item.status())));
            }
        }
        return results;
    }

    private static ActionId resolveId(BulkResponseItem item, IndexingAction submitted) {
        if (item.id() == null) {
            if (submitted == null) {
                throw new BackendException("Bulk response item without id at a position beyond the batch");
            }
            return submitted.actionId();
        }
        try {
            return ActionId.of(item.id());
        } catch (IllegalArgumentException e) {
            throw new BackendException("Bulk response item has a foreign id '" + item.id() + "'", e);
        }
    }

    private static String describe(ErrorCause error, int status) {
        if (error == null) {
            return "status " + status;
        }
        return error.reason() == null ? error.type() : error.type() + ": " + error.reason();
    }

    private final class OpenSearchConnection implements BackendConnection {

        private final AtomicBoolean closed = new AtomicBoolean(false);

        @Override
        public List<BulkItemResult> submit(List<IndexingAction> batch) {
            if (batch == null || batch.isEmpty()) {
                throw new IllegalArgumentException("batch cannot be null or empty");
            }
            if (closed.get()) {
                throw new BackendException("Connection is closed");
            }

            BulkResponse response;
            try {
                response = client.bulk(toBulkRequest(batch));
            } catch (IOException | OpenSearchException e) {
                throw new BackendException("Bulk request of " + batch.size() + " documents failed", e);
            }
            if (response.errors()) {
                log.debug("Bulk request of {} documents completed with item errors", batch.size());
            }
            return toResults(batch, response);
        }

        @Override
        public void close() {
            closed.set(true);
        }
    }
}
