package com.browserpilot.core.reasoning;

import java.util.List;
import java.util.Map;

/**
 * Structured model reply parsed by {@link LlmReasoningEngine}.
 *
 * @param thought      short reasoning about the current situation
 * @param actions      actions to run next; empty when the task is complete
 * @param parallel     true when the actions are independent of each other
 * @param taskComplete true when no further action is needed
 * @param finalAnswer  the answer for the user when the task is complete
 */
public record ReasoningDecision(
        String thought,
        List<Call> actions,
        Boolean parallel,
        Boolean taskComplete,
        String finalAnswer
) {

    public record Call(String name, Map<String, Object> arguments) {}
}
