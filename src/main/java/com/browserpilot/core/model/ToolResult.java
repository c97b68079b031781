package com.browserpilot.core.model;

import java.io.Serializable;

/**
 * Outcome of one browser action.
 * <p>
 * Errors are data, not exceptions. {@code errorKind} is set when the tool server
 * reports a structured failure kind; otherwise it is {@code null} and the text is
 * classified.
 */
public record ToolResult(
        String actionId,
        String actionName,
        boolean ok,
        String content,
        ErrorType errorKind
) implements Serializable {

    public static ToolResult ok(String content) {
        return new ToolResult(null, null, true, content, null);
    }

    public static ToolResult error(String text) {
        return new ToolResult(null, null, false, text, null);
    }

    public static ToolResult error(String text, ErrorType kind) {
        return new ToolResult(null, null, false, text, kind);
    }

    /** Binds this result to the request that produced it. */
    public ToolResult forRequest(ActionRequest request) {
        return new ToolResult(request.id(), request.name(), ok, content, errorKind);
    }
}
