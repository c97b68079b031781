package com.browserpilot.core.memory;

import com.browserpilot.core.llm.LlmService;
import com.browserpilot.core.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Asks the model to fold compacted messages into the running summary. Falls back to
 * the extractive summary when the model call fails.
 */
public class LlmSummarizer implements Summarizer {

    private static final Logger log = LoggerFactory.getLogger(LlmSummarizer.class);

    private static final String SYSTEM_PROMPT = """
            You condense the history of a browser automation session.
            Keep: pages visited, data extracted, actions that succeeded or failed, and anything
            the user decided. Drop: raw page dumps and repeated attempts.
            Reply with plain text bullet points only.
            """;

    private final LlmService llm;
    private final ExtractiveSummarizer fallback;
    private final TokenEstimator estimator;

    public LlmSummarizer(LlmService llm, TokenEstimator estimator) {
        this.llm = llm;
        this.estimator = estimator;
        this.fallback = new ExtractiveSummarizer(estimator);
    }

    @Override
    public String summarize(String previousSummary, List<Message> compacted, int maxTokens) {
        var prompt = new StringBuilder();
        if (previousSummary != null && !previousSummary.isBlank()) {
            prompt.append("Existing summary:\n").append(previousSummary).append("\n\n");
        }
        prompt.append("New messages to fold in:\n");
        for (Message message : compacted) {
            prompt.append('[').append(message.role().name().toLowerCase()).append("] ")
                    .append(message.content()).append('\n');
        }
        prompt.append("\nStay under ").append(maxTokens * TokenEstimator.CHARS_PER_TOKEN).append(" characters.");

        try {
            String summary = llm.textCall(SYSTEM_PROMPT, prompt.toString());
            if (estimator.estimate(summary) > maxTokens) {
                summary = summary.substring(0, maxTokens * TokenEstimator.CHARS_PER_TOKEN);
            }
            return summary;
        } catch (RuntimeException e) {
            log.warn("LLM summary failed, using extractive summary: {}", e.getMessage());
            return fallback.summarize(previousSummary, compacted, maxTokens);
        }
    }
}
