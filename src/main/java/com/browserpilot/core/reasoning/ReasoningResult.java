package com.browserpilot.core.reasoning;

import com.browserpilot.core.model.ActionRequest;

import java.util.List;

/**
 * What one reasoning step decided.
 */
public sealed interface ReasoningResult permits ReasoningResult.ActionPlan, ReasoningResult.Completion {

    /**
     * Actions to run next.
     *
     * @param thought  the model's reasoning, kept in history
     * @param parallel whether the actions are independent and may run concurrently
     */
    record ActionPlan(String thought, List<ActionRequest> actions, boolean parallel) implements ReasoningResult {
        public ActionPlan {
            thought = thought != null ? thought : "";
            actions = actions != null ? List.copyOf(actions) : List.of();
        }
    }

    /** No further action: the task is believed complete. */
    record Completion(String answer) implements ReasoningResult {
        public Completion {
            answer = answer != null ? answer : "";
        }
    }
}
