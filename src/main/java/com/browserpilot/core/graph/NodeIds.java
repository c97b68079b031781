package com.browserpilot.core.graph;

/**
 * Identifiers of the routing nodes, used both for registration and routing.
 */
public final class NodeIds {

    private NodeIds() {}

    public static final String REASONING = "reasoning";
    public static final String CRITICAL_ACTION_VALIDATOR = "critical_action_validator";
    public static final String HUMAN_CONFIRMATION = "human_confirmation";
    public static final String TOOL_EXECUTION = "tool_execution";
    public static final String SELF_CORRECTOR = "self_corrector";
    public static final String PROGRESS_ANALYZER = "progress_analyzer";
    public static final String STRATEGY_ADAPTER = "strategy_adapter";
    public static final String QUALITY_EVALUATOR = "quality_evaluator";
    public static final String GOAL_VALIDATOR = "goal_validator";
    public static final String MEMORY_MANAGER = "memory_manager";
    public static final String PROGRESS_REPORTER = "progress_reporter";
}
