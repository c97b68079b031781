package com.browserpilot.core.memory;

import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.MessageRole;
import com.browserpilot.core.model.SummaryContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Replaces all but the most recent messages with a running summary once history grows
 * past the pre-threshold.
 * <p>
 * The retained window is the last {@code keepRecent} messages, widened backwards so a
 * tool result is never kept without the assistant message that requested it. If the
 * window alone would still reach the hard limit it is narrowed from the oldest end.
 * Compacting a history with nothing left to remove returns empty.
 */
public class HistoryCompactor {

    private static final Logger log = LoggerFactory.getLogger(HistoryCompactor.class);

    private final TokenEstimator estimator;
    private final Summarizer summarizer;
    private final int preThreshold;
    private final int hardLimit;
    private final int maxSummaryTokens;
    private final int keepRecent;

    public HistoryCompactor(TokenEstimator estimator, Summarizer summarizer,
                            int preThreshold, int hardLimit, int maxSummaryTokens, int keepRecent) {
        if (preThreshold >= hardLimit) {
            throw new IllegalArgumentException("Compaction pre-threshold (" + preThreshold
                    + ") must be below the hard limit (" + hardLimit + ")");
        }
        if (keepRecent < 1) {
            throw new IllegalArgumentException("keepRecent must be >= 1, got " + keepRecent);
        }
        if (maxSummaryTokens >= hardLimit) {
            throw new IllegalArgumentException("maxSummaryTokens must be below the hard limit");
        }
        this.estimator = estimator;
        this.summarizer = summarizer;
        this.preThreshold = preThreshold;
        this.hardLimit = hardLimit;
        this.maxSummaryTokens = maxSummaryTokens;
        this.keepRecent = keepRecent;
    }

    public int size(List<Message> history, SummaryContext summary) {
        return estimator.estimate(history, summary);
    }

    /**
     * True when the size metric is past the pre-threshold and compaction would remove something.
     */
    public boolean needsCompaction(List<Message> history, SummaryContext summary) {
        return size(history, summary) > preThreshold && retainedFrom(history) > 0;
    }

    public Optional<Compaction> compact(List<Message> history, SummaryContext previous) {
        if (!needsCompaction(history, previous)) {
            return Optional.empty();
        }
        int sizeBefore = size(history, previous);
        int start = retainedFrom(history);

        int summaryBudget = TokenEstimator.MESSAGE_OVERHEAD + maxSummaryTokens;
        int wanted = start;
        while (start < history.size() - 1
                && estimator.estimate(history.subList(start, history.size())) + summaryBudget >= hardLimit) {
            start++;
        }
        if (start > wanted) {
            log.warn("Recent messages exceed the hard limit; retaining {} of {}",
                    history.size() - start, history.size() - wanted);
        }

        List<Message> removed = history.subList(0, start);
        String summaryText = summarizer.summarize(
                previous != null ? previous.summary() : null, removed, maxSummaryTokens);
        if (estimator.estimate(summaryText) > maxSummaryTokens) {
            summaryText = summaryText.substring(0, maxSummaryTokens * TokenEstimator.CHARS_PER_TOKEN);
        }

        int carriedSuccesses = (previous != null ? previous.successfulActions() : 0)
                + (int) removed.stream().filter(Message::isSuccessfulToolResult).count();
        var summary = new SummaryContext(summaryText,
                (previous != null ? previous.boundary() : 0) + start,
                (previous != null ? previous.compactions() : 0) + 1,
                carriedSuccesses);

        int sizeAfter = size(history.subList(start, history.size()), summary);
        log.info("Compacted {} messages into running summary ({} -> {} tokens)", start, sizeBefore, sizeAfter);
        return Optional.of(new Compaction(start, summary, sizeBefore, sizeAfter));
    }

    /**
     * Index of the first message kept by compaction.
     */
    int retainedFrom(List<Message> history) {
        int start = Math.max(0, history.size() - keepRecent);
        while (start > 0 && history.get(start).role() == MessageRole.TOOL) {
            start--;
        }
        return start;
    }

    public int preThreshold() {
        return preThreshold;
    }

    public int hardLimit() {
        return hardLimit;
    }
}
