package com.browserpilot.core.reflection;

import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.MessageRole;
import com.browserpilot.core.state.TaskState;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Scores how far a task has come, from the recent ratio of successful actions, the
 * amount of work done, the error count and the last quality verdict.
 */
@Component
public class ProgressEstimator {

    static final int RECENT_WINDOW = 20;

    public double estimate(TaskState state) {
        List<Message> history = state.history();
        List<Message> recent = history.subList(Math.max(0, history.size() - RECENT_WINDOW), history.size());

        long toolResults = recent.stream().filter(m -> m.role() == MessageRole.TOOL).count();
        long successes = recent.stream().filter(Message::isSuccessfulToolResult).count();
        double successRate = toolResults == 0 ? 0.0 : (double) successes / toolResults;

        int totalMessages = history.size() + state.summaryContext().map(s -> s.boundary()).orElse(0);

        double score = successRate * 0.5
                + Math.min(totalMessages / 40.0, 0.5)
                - Math.min(state.errorCount() * 0.1, 0.4)
                + state.qualityScore().orElse(0.5) * 0.2;
        return Math.max(0.0, Math.min(1.0, score));
    }

    public static String status(double score) {
        if (score >= 0.9) return "Near completion";
        if (score >= 0.6) return "Making progress";
        if (score >= 0.3) return "Working";
        return "Starting";
    }
}
