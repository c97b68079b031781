package com.browserpilot.mcp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection settings for the browser automation MCP server.
 *
 * <pre>
 * browserpilot:
 *   mcp:
 *     enabled: true
 *     url: http://localhost:8931/mcp
 *     token: optional-bearer-token
 *     request-timeout-seconds: 60
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "browserpilot.mcp")
public class McpProperties {

    private boolean enabled = false;
    private String url = "";
    private String token = "";
    private int requestTimeoutSeconds = 60;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }
    public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }

    /**
     * Returns {@code true} when MCP is enabled and a server URL is set.
     */
    public boolean isConfigured() {
        return enabled && url != null && !url.isBlank();
    }
}
