package com.browserpilot.core.reflection;

public enum QualityRating {
    GOOD(1.0),
    ACCEPTABLE(0.7),
    NEEDS_IMPROVEMENT(0.5);

    private final double score;

    QualityRating(double score) {
        this.score = score;
    }

    public double score() {
        return score;
    }

    /** Lenient parse of a model-produced rating; anything unrecognized needs improvement. */
    public static QualityRating parse(String value) {
        if (value == null) return NEEDS_IMPROVEMENT;
        String normalized = value.trim().toUpperCase().replace(' ', '_').replace('-', '_');
        for (QualityRating rating : values()) {
            if (rating.name().equals(normalized)) return rating;
        }
        return NEEDS_IMPROVEMENT;
    }
}
