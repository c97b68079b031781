package com.browserpilot.core.llm;

import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.SummaryContext;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders history as plain text for model prompts.
 */
public final class Transcripts {

    private Transcripts() {}

    public static String render(List<Message> messages) {
        var sb = new StringBuilder();
        for (Message message : messages) {
            switch (message.role()) {
                case SYSTEM -> { }
                case USER -> sb.append("USER: ").append(message.content()).append('\n');
                case FEEDBACK -> sb.append("FEEDBACK: ").append(message.content()).append('\n');
                case ASSISTANT -> {
                    sb.append("ASSISTANT: ").append(message.content()).append('\n');
                    if (message.hasActionRequests()) {
                        sb.append("  requested: ").append(message.actionRequests().stream()
                                .map(a -> a.describe())
                                .collect(Collectors.joining("; "))).append('\n');
                    }
                }
                case TOOL -> sb.append("RESULT ")
                        .append(message.actionName() != null ? message.actionName() : "action")
                        .append(": ").append(message.content()).append('\n');
            }
        }
        return sb.toString();
    }

    public static String render(String task, SummaryContext summary, List<Message> history) {
        var sb = new StringBuilder("TASK: ").append(task).append("\n\n");
        if (summary != null) {
            sb.append(summary.summary()).append("\n\n");
        }
        return sb.append(render(history)).toString();
    }
}
