package com.ryuqq.ingest.adapter.opensearch;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.auth.AuthScope;
import org.apache.hc.client5.http.auth.UsernamePasswordCredentials;
import org.apache.hc.client5.http.impl.auth.BasicCredentialsProvider;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.util.Timeout;
import org.opensearch.client.json.jackson.JacksonJsonpMapper;
import org.opensearch.client.opensearch.OpenSearchClient;
import org.opensearch.client.transport.OpenSearchTransport;
import org.opensearch.client.transport.httpclient5.ApacheHttpClient5TransportBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds an {@link OpenSearchClient} on the Apache HttpClient 5 transport.
 *
 * <p>Documents are serialized with the same Jackson {@link ObjectMapper} the action codec uses,
 * so a payload reaches the cluster exactly as it was queued.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public final class OpenSearchClientFactory {

    private static final Logger log = LoggerFactory.getLogger(OpenSearchClientFactory.class);

    private OpenSearchClientFactory() {
    }

    /**
     * @param config connection settings
     * @param objectMapper mapper for document serialization
     * @return a client owning its transport; close the transport to release connections
     */
    public static OpenSearchClient create(OpenSearchConfig config, ObjectMapper objectMapper) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        log.info("Creating OpenSearch client for {}", config);

        HttpHost host = new HttpHost(config.scheme(), config.host(), config.port());
        ApacheHttpClient5TransportBuilder builder = ApacheHttpClient5TransportBuilder.builder(host)
            .setMapper(new JacksonJsonpMapper(objectMapper))
            .setRequestConfigCallback(requestConfig -> requestConfig
                .setResponseTimeout(Timeout.ofMilliseconds(config.requestTimeout().toMillis())));

        if (config.hasCredentials()) {
            BasicCredentialsProvider credentialsProvider = new BasicCredentialsProvider();
            credentialsProvider.setCredentials(
                new AuthScope(host),
                new UsernamePasswordCredentials(config.username(), config.password().toCharArray())
            );
            builder.setHttpClientConfigCallback(httpClient -> httpClient
                .setDefaultCredentialsProvider(credentialsProvider));
        }

        OpenSearchTransport transport = builder.build();
        return new OpenSearchClient(transport);
    }
}
