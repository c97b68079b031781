package com.browserpilot.core.memory;

import com.browserpilot.core.model.Message;

import java.util.List;

/**
 * Folds compacted messages into a running summary.
 */
public interface Summarizer {

    /**
     * @param previousSummary summary from earlier compactions, or {@code null}
     * @param compacted       messages being removed from history, oldest first
     * @param maxTokens       size budget for the returned text
     */
    String summarize(String previousSummary, List<Message> compacted, int maxTokens);
}
