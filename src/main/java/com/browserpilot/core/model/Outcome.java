package com.browserpilot.core.model;

import java.io.Serializable;

/**
 * Terminal result of a task.
 *
 * @param status success or failure
 * @param reason human-readable reason: success evidence, {@code step_limit_exceeded},
 *               {@code cancelled} or {@code retry_exhausted:<kind>}
 * @param detail optional extra text, e.g. the last error message
 */
public record Outcome(OutcomeStatus status, String reason, String detail) implements Serializable {

    public static final String STEP_LIMIT_EXCEEDED = "step_limit_exceeded";
    public static final String CANCELLED = "cancelled";
    public static final String RETRY_EXHAUSTED_PREFIX = "retry_exhausted:";

    public static Outcome success(String evidence) {
        return new Outcome(OutcomeStatus.SUCCESS, evidence, null);
    }

    public static Outcome failure(String reason) {
        return new Outcome(OutcomeStatus.FAILURE, reason, null);
    }

    public static Outcome failure(String reason, String detail) {
        return new Outcome(OutcomeStatus.FAILURE, reason, detail);
    }

    public static Outcome retryExhausted(ErrorType kind, String lastError) {
        return failure(RETRY_EXHAUSTED_PREFIX + kind.wireName(), lastError);
    }

    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCESS;
    }
}
