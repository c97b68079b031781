package com.browserpilot.core.reflection;

/**
 * How well the final answer addresses the task.
 */
public record QualityVerdict(QualityRating rating, String feedback) {

    public double score() {
        return rating.score();
    }
}
