package com.ryuqq.ingest.application.config;

import com.ryuqq.ingest.application.bootstrap.DeclarationFailurePolicy;
import com.ryuqq.ingest.core.model.DocumentRouting;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * IngestConfigLoader 및 설정 record 테스트.
 *
 * @author Ingest Team
 * @since 1.0.0
 */
class IngestConfigLoaderTest {

    @Test
    void load_Defaults_MatchReferenceConf() {
        // When
        Config config = IngestConfigLoader.load(ConfigFactory.empty());

        // Then
        ChannelConfig channel = ChannelConfig.fromConfig(config);
        assertThat(channel.name()).isEqualTo("elasticsearch");
        assertThat(channel.declarationFailurePolicy()).isEqualTo(DeclarationFailurePolicy.DEGRADE);

        PublisherConfig publisher = PublisherConfig.fromConfig(config);
        assertThat(publisher.defaultTtl()).isNull();
        assertThat(publisher.routing()).isEqualTo(DocumentRouting.DEFAULT);
        assertThat(config.getInt("ingest.bulk-size")).isEqualTo(500);
    }

    @Test
    void load_OverridesTakePrecedence() {
        // Given
        Config overrides = ConfigFactory.parseString(
            "ingest.channel.name = logs\n"
                + "ingest.channel.declare-on-failure = FAIL_FAST\n"
                + "ingest.ttl = 2d\n"
                + "ingest.routing.tenant-pointer = \"/meta/tenant\"\n"
        );

        // When
        Config config = IngestConfigLoader.load(overrides);

        // Then
        assertThat(ChannelConfig.fromConfig(config))
            .isEqualTo(new ChannelConfig("logs", DeclarationFailurePolicy.FAIL_FAST));
        PublisherConfig publisher = PublisherConfig.fromConfig(config);
        assertThat(publisher.defaultTtl()).isEqualTo(Duration.ofDays(2));
        assertThat(publisher.defaultTtlMillis()).isEqualTo(Duration.ofDays(2).toMillis());
        assertThat(publisher.routing().tenantPointer()).isEqualTo("/meta/tenant");
    }

    @Test
    void load_SystemPropertiesOverrideOverrides() {
        // Given
        Config overrides = ConfigFactory.parseString("ingest.bulk-size = 7\ningest.wait-timeout = 5s");
        System.setProperty("ingest.bulk-size", "42");

        try {
            // When
            Config config = IngestConfigLoader.load(overrides);

            // Then
            assertThat(config.getInt("ingest.bulk-size")).isEqualTo(42);
            assertThat(config.getDuration("ingest.wait-timeout")).isEqualTo(Duration.ofSeconds(5));
        } finally {
            System.clearProperty("ingest.bulk-size");
            ConfigFactory.invalidateCaches();
        }
    }

    @Test
    void channelConfig_BlankName_ThrowsException() {
        assertThatThrownBy(() -> new ChannelConfig().withName(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("name");
    }

    @Test
    void publisherConfig_ZeroTtl_ThrowsException() {
        assertThatThrownBy(() -> new PublisherConfig().withDefaultTtl(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
