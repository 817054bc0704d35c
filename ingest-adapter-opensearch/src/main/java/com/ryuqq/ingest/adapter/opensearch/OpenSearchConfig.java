package com.ryuqq.ingest.adapter.opensearch;

import com.typesafe.config.Config;

import java.time.Duration;

/**
 * OpenSearch connection settings (immutable record).
 *
 * <ul>
 *   <li>host / port / scheme: cluster endpoint (default http://localhost:9200)</li>
 *   <li>username / password: basic auth, both empty to disable</li>
 *   <li>requestTimeout: response timeout of one bulk call (default 30s)</li>
 * </ul>
 *
 * @param host cluster host
 * @param port cluster port
 * @param scheme http or https
 * @param username basic auth user, empty for none
 * @param password basic auth password, empty for none
 * @param requestTimeout response timeout per request
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public record OpenSearchConfig(
    String host,
    int port,
    String scheme,
    String username,
    String password,
    Duration requestTimeout
) {

    public OpenSearchConfig() {
        this("localhost", 9200, "http", "", "", Duration.ofSeconds(30));
    }

    public OpenSearchConfig {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host cannot be null or blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535 (current: " + port + ")");
        }
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new IllegalArgumentException("scheme must be http or https (current: " + scheme + ")");
        }
        if (username == null) {
            throw new IllegalArgumentException("username cannot be null");
        }
        if (password == null) {
            throw new IllegalArgumentException("password cannot be null");
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive (current: " + requestTimeout + ")");
        }
    }

    /**
     * Reads {@code ingest.opensearch.*}.
     *
     * @param config resolved configuration
     * @return connection settings
     */
    public static OpenSearchConfig fromConfig(Config config) {
        Config opensearch = config.getConfig("ingest.opensearch");
        return new OpenSearchConfig(
            opensearch.getString("host"),
            opensearch.getInt("port"),
            opensearch.getString("scheme"),
            opensearch.getString("username"),
            opensearch.getString("password"),
            opensearch.getDuration("request-timeout")
        );
    }

    /**
     * @return true if both username and password are set
     */
    public boolean hasCredentials() {
        return !username.isEmpty() && !password.isEmpty();
    }

    public OpenSearchConfig withEndpoint(String scheme, String host, int port) {
        return new OpenSearchConfig(host, port, scheme, username, password, requestTimeout);
    }

    public OpenSearchConfig withCredentials(String username, String password) {
        return new OpenSearchConfig(host, port, scheme, username, password, requestTimeout);
    }

    public OpenSearchConfig withRequestTimeout(Duration requestTimeout) {
        return new OpenSearchConfig(host, port, scheme, username, password, requestTimeout);
    }

    @Override
    public String toString() {
        return "OpenSearchConfig[" + scheme + "://" + host + ":" + port
            + ", auth=" + hasCredentials() + ", requestTimeout=" + requestTimeout + "]";
    }
}
