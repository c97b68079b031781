package com.browserpilot.core.reasoning;

import com.browserpilot.core.model.ActionSpec;
import com.browserpilot.core.model.Message;

import java.util.List;

/**
 * Decides the agent's next move from the conversation so far.
 * <p>
 * Implementations may throw unchecked exceptions on transport or parse failures; the
 * reasoning node classifies them like tool errors.
 */
public interface ReasoningEngine {

    ReasoningResult infer(List<Message> history, List<ActionSpec> availableActions);
}
