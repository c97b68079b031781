package com.browserpilot.core.tools;

import com.browserpilot.core.model.ActionSpec;
import com.browserpilot.core.model.ToolResult;

import java.util.List;
import java.util.Map;

/**
 * Runs browser actions. May be called concurrently for independent actions.
 * <p>
 * Failures are reported as error {@link ToolResult}s, not exceptions.
 */
public interface ToolExecutor {

    List<ActionSpec> availableActions();

    ToolResult execute(String actionName, Map<String, Object> args);
}
