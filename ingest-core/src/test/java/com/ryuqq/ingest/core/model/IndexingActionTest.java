package com.ryuqq.ingest.core.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IndexingAction 테스트.
 *
 * @author Ingest Team
 * @since 1.0.0
 */
class IndexingActionTest {

    private ObjectNode document() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("message", "user logged in");
        return node;
    }

    @Test
    void create_GeneratesFreshActionIdEachTime() {
        // Given
        ObjectNode document = document();

        // When
        IndexingAction first = IndexingAction.create("acme", "login", null, document);
        IndexingAction second = IndexingAction.create("acme", "login", null, document);

        // Then
        assertNotEquals(first.actionId(), second.actionId());
        assertEquals(first.payload(), second.payload());
    }

    @Test
    void create_CopiesPayloadDefensively() {
        // Given
        ObjectNode document = document();
        IndexingAction action = IndexingAction.create("acme", "login", 1000L, document);

        // When
        document.put("message", "mutated");

        // Then
        assertEquals("user logged in", action.payload().get("message").asText());
    }

    @Test
    void payload_MutatingReturnedTree_DoesNotChangeAction() {
        // Given
        IndexingAction action = IndexingAction.create("acme", "login", null, document());
        IndexingAction same = new IndexingAction("acme", "login", action.actionId(), null, document());

        // When
        ((ObjectNode) action.payload()).put("message", "mutated");

        // Then
        assertEquals("user logged in", action.payload().get("message").asText());
        assertEquals(same, action);
    }

    @Test
    void constructor_BlankTargetIndex_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> IndexingAction.create(" ", "login", null, document())
        );
        assertTrue(exception.getMessage().contains("targetIndex"));
    }

    @Test
    void constructor_NullDocumentKind_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> IndexingAction.create("acme", null, null, document())
        );
        assertTrue(exception.getMessage().contains("documentKind"));
    }

    @Test
    void constructor_NonPositiveTtl_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> IndexingAction.create("acme", "login", 0L, document()));
    }

    @Test
    void constructor_NullPayload_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> IndexingAction.create("acme", "login", null, NullNode.getInstance()));
    }

    @Test
    void constructor_NullActionId_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new IndexingAction("acme", "login", null, null, document()));
    }
}
