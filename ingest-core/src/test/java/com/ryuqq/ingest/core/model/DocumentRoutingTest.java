package com.ryuqq.ingest.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.ingest.core.exception.MalformedDocumentException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DocumentRouting 테스트.
 *
 * @author Ingest Team
 * @since 1.0.0
 */
class DocumentRoutingTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void default_ReadsTenantAndPatternFromDocument() throws Exception {
        // Given
        JsonNode document = mapper.readTree(
            "{\"routing\":{\"tenant\":\"acme\",\"correlation\":{\"pattern\":\"login\"}},\"msg\":\"hi\"}"
        );

        // When & Then
        assertThat(DocumentRouting.DEFAULT.tenantOf(document)).isEqualTo("acme");
        assertThat(DocumentRouting.DEFAULT.patternOf(document)).isEqualTo("login");
    }

    @Test
    void custom_PointersAreHonoured() throws Exception {
        // Given
        DocumentRouting routing = new DocumentRouting("/meta/owner", "/meta/kind");
        JsonNode document = mapper.readTree("{\"meta\":{\"owner\":\"globex\",\"kind\":\"audit\"}}");

        // When & Then
        assertThat(routing.tenantOf(document)).isEqualTo("globex");
        assertThat(routing.patternOf(document)).isEqualTo("audit");
    }

    @Test
    void tenantOf_MissingMetadata_ThrowsMalformedDocument() throws Exception {
        JsonNode document = mapper.readTree("{\"routing\":{\"correlation\":{\"pattern\":\"login\"}}}");

        assertThatThrownBy(() -> DocumentRouting.DEFAULT.tenantOf(document))
            .isInstanceOf(MalformedDocumentException.class)
            .hasMessageContaining("tenant");
    }

    @Test
    void patternOf_NonTextualValue_ThrowsMalformedDocument() throws Exception {
        JsonNode document = mapper.readTree("{\"routing\":{\"tenant\":\"acme\",\"correlation\":{\"pattern\":42}}}");

        assertThatThrownBy(() -> DocumentRouting.DEFAULT.patternOf(document))
            .isInstanceOf(MalformedDocumentException.class)
            .hasMessageContaining("pattern");
    }

    @Test
    void constructor_InvalidPointer_ThrowsException() {
        assertThatThrownBy(() -> new DocumentRouting("routing/tenant", "/p"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
