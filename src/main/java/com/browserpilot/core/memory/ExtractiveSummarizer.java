package com.browserpilot.core.memory;

import com.browserpilot.core.model.Message;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the running summary from one line per compacted message, without a model call.
 * When over budget, the oldest lines go first.
 */
public class ExtractiveSummarizer implements Summarizer {

    static final String HEADER = "Summary of earlier progress:";
    private static final int CONTENT_CHARS = 160;

    private final TokenEstimator estimator;

    public ExtractiveSummarizer(TokenEstimator estimator) {
        this.estimator = estimator;
    }

    @Override
    public String summarize(String previousSummary, List<Message> compacted, int maxTokens) {
        var lines = new ArrayList<String>();
        if (previousSummary != null && !previousSummary.isBlank()) {
            previousSummary.lines()
                    .filter(l -> !l.isBlank() && !l.equals(HEADER))
                    .forEach(lines::add);
        }
        for (Message message : compacted) {
            String line = lineFor(message);
            if (line != null) {
                lines.add(line);
            }
        }

        while (!lines.isEmpty() && estimator.estimate(render(lines)) > maxTokens) {
            lines.remove(0);
        }
        return render(lines);
    }

    private static String render(List<String> lines) {
        return lines.isEmpty() ? HEADER : HEADER + "\n" + String.join("\n", lines);
    }

    private static String lineFor(Message message) {
        return switch (message.role()) {
            case SYSTEM -> null;
            case USER -> "- user: " + abbreviate(message.content());
            case FEEDBACK -> "- note: " + abbreviate(message.content());
            case ASSISTANT -> message.hasActionRequests()
                    ? "- requested: " + message.actionRequests().stream()
                            .map(a -> a.describe())
                            .collect(Collectors.joining(", "))
                    : "- assistant: " + abbreviate(message.content());
            case TOOL -> "- " + (message.actionName() != null ? message.actionName() : "action")
                    + (Boolean.TRUE.equals(message.ok()) ? " ok: " : " failed: ")
                    + abbreviate(message.content());
        };
    }

    private static String abbreviate(String text) {
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= CONTENT_CHARS ? flat : flat.substring(0, CONTENT_CHARS - 3) + "...";
    }
}
