package com.ryuqq.ingest.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The envelope placed on the durable channel for one document.
 *
 * <p>Serialized as a bulk-action shaped JSON object:</p>
 * <pre>
 * {
 *   "_index":  "acme",
 *   "_type":   "login",
 *   "_id":     "5b0e...-uuid",
 *   "_ttl":    86400000,
 *   "_source": { ...original document... }
 * }
 * </pre>
 *
 * <p><strong>Invariants:</strong></p>
 * <ul>
 *   <li>targetIndex and documentKind are non-blank</li>
 *   <li>actionId is generated at publish time, never at flush time</li>
 *   <li>timeToLive is absent or positive; omitted from JSON when absent</li>
 *   <li>payload is copied on creation and on every access, so the stored tree is never mutated</li>
 * </ul>
 *
 * @param targetIndex logical partition of the search backend, derived from the tenant
 * @param documentKind schema/category of the document, derived from the correlation pattern
 * @param actionId unique id used by the backend as document id
 * @param timeToLive optional lifetime hint in milliseconds (null if none)
 * @param payload the original document, stored verbatim
 *
 * @author Ingest Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IndexingAction(
    @JsonProperty("_index") String targetIndex,
    @JsonProperty("_type") String documentKind,
    @JsonProperty("_id") ActionId actionId,
    @JsonProperty("_ttl") Long timeToLive,
    @JsonProperty("_source") JsonNode payload
) {

    public IndexingAction {
        if (targetIndex == null || targetIndex.isBlank()) {
            throw new IllegalArgumentException("targetIndex cannot be null or blank");
        }
        if (documentKind == null || documentKind.isBlank()) {
            throw new IllegalArgumentException("documentKind cannot be null or blank");
        }
        if (actionId == null) {
            throw new IllegalArgumentException("actionId cannot be null");
        }
        if (timeToLive != null && timeToLive <= 0) {
            throw new IllegalArgumentException("timeToLive must be positive (current: " + timeToLive + ")");
        }
        if (payload == null || payload.isMissingNode() || payload.isNull()) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        payload = payload.deepCopy();
    }

    /**
     * @return a copy of the document; changes to it do not affect this action
     */
    @Override
    @JsonProperty("_source")
    public JsonNode payload() {
        return payload.deepCopy();
    }

    /**
     * Builds a new action with a freshly generated {@link ActionId}.
     *
     * @param targetIndex target index
     * @param documentKind document kind
     * @param timeToLive optional lifetime hint (null for none)
     * @param payload the document
     * @return a new action
     */
    public static IndexingAction create(String targetIndex, String documentKind, Long timeToLive, JsonNode payload) {
        return new IndexingAction(targetIndex, documentKind, ActionId.generate(), timeToLive, payload);
    }
}
