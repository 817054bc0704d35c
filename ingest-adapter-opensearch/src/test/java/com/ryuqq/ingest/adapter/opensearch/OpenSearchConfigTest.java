package com.ryuqq.ingest.adapter.opensearch;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link OpenSearchConfig}.
 *
 * @author Ingest Team
 * @since 1.0.0
 */
class OpenSearchConfigTest {

    @Test
    void fromConfig_ReferenceDefaults() {
        // Given
        Config config = ConfigFactory.defaultReference();

        // When
        OpenSearchConfig openSearch = OpenSearchConfig.fromConfig(config);

        // Then
        assertThat(openSearch.port()).isEqualTo(9200);
        assertThat(openSearch.requestTimeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void fromConfig_Overrides() {
        // Given
        Config config = ConfigFactory.parseString(
            "ingest.opensearch { host = search.internal, port = 443, scheme = https,"
                + " username = ingest, password = secret, request-timeout = 5s }"
        );

        // When
        OpenSearchConfig openSearch = OpenSearchConfig.fromConfig(config);

        // Then
        assertThat(openSearch).isEqualTo(new OpenSearchConfig(
            "search.internal", 443, "https", "ingest", "secret", Duration.ofSeconds(5)));
        assertThat(openSearch.hasCredentials()).isTrue();
    }

    @Test
    void toString_DoesNotExposePassword() {
        OpenSearchConfig config = new OpenSearchConfig().withCredentials("ingest", "secret");

        assertThat(config.toString()).doesNotContain("secret");
    }

    @Test
    void constructor_InvalidScheme_ThrowsException() {
        assertThatThrownBy(() -> new OpenSearchConfig().withEndpoint("ftp", "localhost", 9200))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("scheme");
    }

    @Test
    void constructor_InvalidPort_ThrowsException() {
        assertThatThrownBy(() -> new OpenSearchConfig().withEndpoint("http", "localhost", 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("port");
    }
}
