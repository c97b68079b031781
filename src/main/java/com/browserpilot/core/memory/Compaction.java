package com.browserpilot.core.memory;

import com.browserpilot.core.model.SummaryContext;

/**
 * Result of one compaction: how many leading messages to drop and the summary replacing them.
 */
public record Compaction(int removedCount, SummaryContext summary, int sizeBefore, int sizeAfter) {
}
