package com.ryuqq.ingest.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.ingest.core.exception.MalformedDocumentException;
import com.ryuqq.ingest.core.model.IndexingAction;

import java.io.IOException;

/**
 * JSON codec for {@link IndexingAction} envelopes and raw documents.
 *
 * <p>Thread-safe once constructed; the wrapped {@link ObjectMapper} must not be
 * reconfigured afterwards.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public final class ActionCodec {

    /**
     * Content type of every message placed on the durable channel.
     */
    public static final String CONTENT_TYPE = "application/json";

    private final ObjectMapper objectMapper;

    public ActionCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public ActionCodec(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * @param action the action
     * @return UTF-8 JSON bytes
     * @throws MalformedDocumentException if the action cannot be serialized
     */
    public byte[] encode(IndexingAction action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        try {
            return objectMapper.writeValueAsBytes(action);
        } catch (JsonProcessingException e) {
            throw new MalformedDocumentException("Failed to serialize action " + action.actionId(), e);
        }
    }

    /**
     * @param body UTF-8 JSON bytes
     * @return the decoded action
     * @throws MalformedDocumentException if the body is not a valid action envelope
     */
    public IndexingAction decode(byte[] body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        try {
            return objectMapper.readValue(body, IndexingAction.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new MalformedDocumentException("Failed to decode action envelope (" + body.length + " bytes)", e);
        }
    }

    /**
     * Converts an arbitrary document (Map, POJO, JsonNode, JSON string) into a JSON tree.
     *
     * <p>A {@link String} is parsed as JSON text.</p>
     *
     * @param document the document
     * @return the document as a JSON object tree
     * @throws MalformedDocumentException if the document is null, not serializable, or not a JSON object
     */
    public JsonNode toTree(Object document) {
        if (document == null) {
            throw new MalformedDocumentException("document cannot be null");
        }
        JsonNode tree;
        try {
            if (document instanceof JsonNode) {
                tree = (JsonNode) document;
            } else if (document instanceof String) {
                tree = objectMapper.readTree((String) document);
            } else {
                tree = objectMapper.valueToTree(document);
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedDocumentException("document is not JSON-serializable: " + document.getClass().getName(), e);
        }
        if (tree == null || !tree.isObject()) {
            throw new MalformedDocumentException("document must be a JSON object");
        }
        return tree;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
