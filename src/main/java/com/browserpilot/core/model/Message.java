package com.browserpilot.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One entry in a task's conversational history.
 *
 * @param role           who produced the message
 * @param content        text content
 * @param actionRequests actions requested by an ASSISTANT message, empty otherwise
 * @param actionId       for TOOL messages, the request this result answers
 * @param actionName     for TOOL messages, the action that ran
 * @param ok             for TOOL messages, whether the action succeeded
 */
public record Message(
        MessageRole role,
        String content,
        List<ActionRequest> actionRequests,
        String actionId,
        String actionName,
        Boolean ok
) implements Serializable {

    public Message {
        content = content != null ? content : "";
        actionRequests = actionRequests != null ? List.copyOf(actionRequests) : List.of();
    }

    public static Message system(String content) {
        return new Message(MessageRole.SYSTEM, content, List.of(), null, null, null);
    }

    public static Message user(String content) {
        return new Message(MessageRole.USER, content, List.of(), null, null, null);
    }

    public static Message assistant(String content) {
        return new Message(MessageRole.ASSISTANT, content, List.of(), null, null, null);
    }

    public static Message assistant(String content, List<ActionRequest> requests) {
        return new Message(MessageRole.ASSISTANT, content, requests, null, null, null);
    }

    public static Message feedback(String content) {
        return new Message(MessageRole.FEEDBACK, content, List.of(), null, null, null);
    }

    public static Message tool(ToolResult result) {
        String text = result.ok() ? result.content() : "Error: " + result.content();
        return new Message(MessageRole.TOOL, text, List.of(), result.actionId(), result.actionName(), result.ok());
    }

    public boolean isSuccessfulToolResult() {
        return role == MessageRole.TOOL && Boolean.TRUE.equals(ok);
    }

    public boolean isFailedToolResult() {
        return role == MessageRole.TOOL && Boolean.FALSE.equals(ok);
    }

    public boolean hasActionRequests() {
        return !actionRequests.isEmpty();
    }
}
