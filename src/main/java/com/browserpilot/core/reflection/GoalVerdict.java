package com.browserpilot.core.reflection;

/**
 * Whether the accumulated evidence satisfies the original task.
 *
 * @param evidence what supports the verdict, reported as the success reason
 * @param gap      what is still missing, fed back to reasoning when not achieved
 */
public record GoalVerdict(GoalStatus status, String evidence, String gap) {

    public boolean achieved() {
        return status == GoalStatus.ACHIEVED;
    }
}
