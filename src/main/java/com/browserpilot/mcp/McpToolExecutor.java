package com.browserpilot.mcp;

import com.browserpilot.core.model.ActionSpec;
import com.browserpilot.core.model.ErrorType;
import com.browserpilot.core.model.ToolResult;
import com.browserpilot.core.tools.ToolExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs browser actions as tools on the configured MCP server.
 * <p>
 * A tool reply flagged {@code isError}, or a JSON body of the form
 * {@code {"success": false, "error": "..."}}, becomes an error result. An
 * {@code "error_type"} field in such a body is passed on as the structured kind.
 */
@Component
public class McpToolExecutor implements ToolExecutor {

    private static final Logger log = LoggerFactory.getLogger(McpToolExecutor.class);

    private final McpClientManager clientManager;
    private final ObjectMapper objectMapper;
    private volatile List<ActionSpec> cachedActions;

    public McpToolExecutor(McpClientManager clientManager, ObjectMapper objectMapper) {
        this.clientManager = clientManager;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ActionSpec> availableActions() {
        List<ActionSpec> actions = cachedActions;
        if (actions != null) {
            return actions;
        }
        try {
            var client = clientManager.client();
            if (client.isEmpty()) {
                log.warn("No MCP server configured; no browser actions available");
                return List.of();
            }
            var tools = client.get().listTools().tools();
            actions = tools == null ? List.of() : tools.stream()
                    .map(t -> new ActionSpec(t.name(), t.description(), schemaJson(t.inputSchema())))
                    .toList();
            log.info("{} browser action(s) available", actions.size());
            cachedActions = actions;
            return actions;
        } catch (RuntimeException e) {
            log.warn("Could not list browser actions: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public ToolResult execute(String actionName, Map<String, Object> args) {
        var client = clientManager.client();
        if (client.isEmpty()) {
            return ToolResult.error("No browser automation server configured (browserpilot.mcp.url)");
        }
        log.debug("Calling MCP tool {} with {}", actionName, args);
        McpSchema.CallToolResult result = client.get().callTool(new McpSchema.CallToolRequest(actionName, args));
        String text = result.content() == null ? "" : result.content().stream()
                .filter(c -> c instanceof McpSchema.TextContent)
                .map(c -> ((McpSchema.TextContent) c).text())
                .collect(Collectors.joining("\n"));

        if (Boolean.TRUE.equals(result.isError())) {
            return ToolResult.error(text.isBlank() ? "Action " + actionName + " failed" : text);
        }
        return interpretBody(text);
    }

    /**
     * Browser tools report their own failures inside a successful MCP reply.
     */
    ToolResult interpretBody(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("{")) {
            return ToolResult.ok(text);
        }
        try {
            JsonNode body = objectMapper.readTree(trimmed);
            JsonNode success = body.get("success");
            if (success != null && success.isBoolean() && !success.asBoolean()) {
                String error = body.hasNonNull("error") ? body.get("error").asText() : text;
                ErrorType kind = body.hasNonNull("error_type")
                        ? ErrorType.fromWireName(body.get("error_type").asText())
                        : null;
                return ToolResult.error(error, kind);
            }
        } catch (Exception e) {
            log.debug("Tool reply is not JSON, passing through: {}", e.getMessage());
        }
        return ToolResult.ok(text);
    }

    private String schemaJson(Object schema) {
        if (schema == null) return null;
        try {
            return objectMapper.writeValueAsString(schema);
        } catch (Exception e) {
            log.debug("Could not render input schema: {}", e.getMessage());
            return null;
        }
    }
}
