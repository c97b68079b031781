package com.browserpilot.core.reflection;

import com.browserpilot.core.state.TaskState;

/**
 * Judges a presumed completion: first the answer's quality, then whether the goal is met.
 */
public interface CompletionJudge {

    QualityVerdict assessQuality(TaskState state);

    GoalVerdict assessGoal(TaskState state);
}
