package com.ryuqq.ingest.core.model;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.ingest.core.exception.MalformedDocumentException;

/**
 * Locates the routing metadata a document declares about itself.
 *
 * <p>Documents are self-describing: the target index comes from the tenant
 * found at {@code tenantPointer}, the document kind from the correlation
 * pattern found at {@code patternPointer}. Both are JSON Pointers (RFC 6901).</p>
 *
 * <pre>
 * {
 *   "routing": {
 *     "tenant": "acme",
 *     "correlation": { "pattern": "login" }
 *   },
 *   ...
 * }
 * </pre>
 *
 * @param tenantPointer JSON Pointer of the tenant value
 * @param patternPointer JSON Pointer of the correlation pattern value
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public record DocumentRouting(String tenantPointer, String patternPointer) {

    public static final DocumentRouting DEFAULT =
        new DocumentRouting("/routing/tenant", "/routing/correlation/pattern");

    public DocumentRouting {
        requireValidPointer(tenantPointer, "tenantPointer");
        requireValidPointer(patternPointer, "patternPointer");
    }

    /**
     * @param document the document
     * @return the tenant the document declares
     * @throws MalformedDocumentException if missing, not a string, or blank
     */
    public String tenantOf(JsonNode document) {
        return requireText(document, tenantPointer, "tenant");
    }

    /**
     * @param document the document
     * @return the correlation pattern the document declares
     * @throws MalformedDocumentException if missing, not a string, or blank
     */
    public String patternOf(JsonNode document) {
        return requireText(document, patternPointer, "pattern");
    }

    private static String requireText(JsonNode document, String pointer, String name) {
        if (document == null) {
            throw new MalformedDocumentException("document cannot be null");
        }
        JsonNode node = document.at(pointer);
        if (!node.isTextual() || node.asText().isBlank()) {
            throw new MalformedDocumentException(
                "document is missing routing metadata '" + name + "' at " + pointer
            );
        }
        return node.asText();
    }

    private static void requireValidPointer(String pointer, String name) {
        if (pointer == null || pointer.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
        JsonPointer.compile(pointer);
    }
}
