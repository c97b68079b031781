package com.browserpilot.core.reasoning;

import com.browserpilot.core.config.AgentProperties;
import com.browserpilot.core.model.Message;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Picks the system guidance for a reasoning step: the full operating guide early on,
 * a short reminder once the task is well underway.
 */
@Component
public class GuidanceSelector {

    static final String FULL_GUIDANCE = """
            You operate a real, logged-in browser session on the user's behalf.
            Work in small steps: inspect the page, act, then check the result.
            Use element references from the most recent page inspection only; references go stale
            when the page changes. Prefer reading page content over guessing.
            You may request several actions at once; mark them parallel only when none depends on another.
            Irreversible actions (submitting forms, payments, deletions) will be confirmed with the user.
            Use request_user_confirmation to ask the user to choose between two options.
            When the task is done, stop requesting actions and give the final answer with the evidence you found.
            """;

    static final String MINIMAL_GUIDANCE = """
            Continue the task. Re-inspect the page before acting on old references.
            Finish with a final answer as soon as the evidence is in hand.
            """;

    private final int minimalAfterStep;

    @Autowired
    public GuidanceSelector(AgentProperties properties) {
        this(properties.getLoop().getMinimalGuidanceAfterStep());
    }

    public GuidanceSelector(int minimalAfterStep) {
        this.minimalAfterStep = minimalAfterStep;
    }

    public Message guidanceFor(long step) {
        return Message.system(step > minimalAfterStep ? MINIMAL_GUIDANCE : FULL_GUIDANCE);
    }
}
