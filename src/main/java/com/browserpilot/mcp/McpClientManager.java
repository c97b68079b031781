package com.browserpilot.mcp;

import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Owns the MCP sync client for the browser automation server.
 * <p>
 * The client is created on first use and reused afterwards. A failed connection is
 * retried on the next call.
 */
@Component
public class McpClientManager {

    private static final Logger log = LoggerFactory.getLogger(McpClientManager.class);

    private final McpProperties props;
    private volatile McpSyncClient client;

    public McpClientManager(McpProperties props) {
        this.props = props;
    }

    /**
     * @return the connected client, or empty when MCP is not configured
     * @throws IllegalStateException if the server cannot be reached
     */
    public synchronized Optional<McpSyncClient> client() {
        if (!props.isConfigured()) {
            return Optional.empty();
        }
        if (client == null) {
            client = connect();
        }
        return Optional.of(client);
    }

    private McpSyncClient connect() {
        String url = props.getUrl();
        try {
            var transportBuilder = HttpClientStreamableHttpTransport.builder(url);
            String token = props.getToken();
            if (token != null && !token.isBlank()) {
                transportBuilder.customizeRequest(req -> req.header("Authorization", "Bearer " + token));
            }
            var created = McpClient.sync(transportBuilder.build())
                    .requestTimeout(Duration.ofSeconds(props.getRequestTimeoutSeconds()))
                    .build();
            created.initialize();
            log.info("MCP client connected to {}", url);
            return created;
        } catch (RuntimeException e) {
            throw new IllegalStateException("MCP connection to " + url + " failed: " + e.getMessage(), e);
        }
    }

    public boolean isConfigured() {
        return props.isConfigured();
    }

    @PreDestroy
    synchronized void shutdown() {
        if (client != null) {
            try {
                client.close();
                log.info("MCP client disconnected");
            } catch (RuntimeException e) {
                log.debug("Error closing MCP client: {}", e.getMessage());
            }
            client = null;
        }
    }
}
