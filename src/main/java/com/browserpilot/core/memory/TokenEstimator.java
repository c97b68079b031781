package com.browserpilot.core.memory;

import com.browserpilot.core.model.ActionRequest;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.SummaryContext;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Approximate token counts: four characters per token plus a fixed per-message overhead.
 */
@Component
public class TokenEstimator {

    static final int CHARS_PER_TOKEN = 4;
    static final int MESSAGE_OVERHEAD = 4;

    public int estimate(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    public int estimate(Message message) {
        int tokens = MESSAGE_OVERHEAD + estimate(message.content());
        for (ActionRequest request : message.actionRequests()) {
            tokens += estimate(request.describe());
        }
        return tokens;
    }

    public int estimate(List<Message> messages) {
        int total = 0;
        for (Message message : messages) {
            total += estimate(message);
        }
        return total;
    }

    /** Size metric of what reasoning sees: retained history plus the running summary. */
    public int estimate(List<Message> history, SummaryContext summary) {
        int total = estimate(history);
        if (summary != null) {
            total += MESSAGE_OVERHEAD + estimate(summary.summary());
        }
        return total;
    }
}
