package com.browserpilot.core.engine;

import com.browserpilot.core.model.InteractionMode;

/**
 * Per-task overrides. {@code null} or {@code 0} means "use the configured default".
 *
 * @param complex  force the complex-task flag on or off; {@code null} detects it from the task text
 * @param mode     interaction mode for critical actions
 * @param maxSteps iteration ceiling for this task
 */
public record TaskOptions(Boolean complex, InteractionMode mode, int maxSteps) {

    public static TaskOptions defaults() {
        return new TaskOptions(null, null, 0);
    }
}
