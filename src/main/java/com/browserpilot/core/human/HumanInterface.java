package com.browserpilot.core.human;

import java.util.List;

/**
 * Blocking question to the person supervising the agent.
 */
public interface HumanInterface {

    /**
     * @return the option the user picked, or their free-text answer
     */
    String ask(String prompt, List<String> options);
}
