package com.browserpilot.core.model;

import java.io.Serializable;

/**
 * Running summary of history that has been compacted away.
 *
 * @param summary           condensed text standing in for removed messages
 * @param boundary          total number of messages compacted so far
 * @param compactions       how many times compaction ran
 * @param successfulActions successful tool results folded into the summary
 */
public record SummaryContext(
        String summary,
        int boundary,
        int compactions,
        int successfulActions
) implements Serializable {
}
