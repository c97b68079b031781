package com.browserpilot.core.nodes;

import com.browserpilot.core.graph.NodeIds;
import com.browserpilot.core.graph.RunContext;
import com.browserpilot.core.graph.Transition;
import com.browserpilot.core.metrics.AgentMetrics;
import com.browserpilot.core.model.ActionRequest;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.MessageRole;
import com.browserpilot.core.model.ToolResult;
import com.browserpilot.core.reflection.ProgressEstimator;
import com.browserpilot.core.reflection.StrategyPlanner;
import com.browserpilot.core.state.StateUpdate;
import com.browserpilot.core.state.TaskState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for stuck detection and the strategy change it triggers.
 */
class ProgressAnalyzerNodeTest {

    private final RunContext context = RunContext.of("BP-2026-0001");

    private static ProgressEstimator fixedScore(double score) {
        ProgressEstimator estimator = mock(ProgressEstimator.class);
        when(estimator.estimate(any())).thenReturn(score);
        return estimator;
    }

    @Test
    @DisplayName("low progress counts toward stuck and returns to reasoning")
    void lowProgress() {
        var node = new ProgressAnalyzerNode(fixedScore(0.2), 0.3, 2);
        var state = new TaskState("BP-2026-0001", "task", true);

        var next = assertInstanceOf(Transition.Continue.class, node.apply(state, context));

        assertEquals(NodeIds.REASONING, next.nextNode());
        state.apply(next.update());
        assertEquals(1, state.stuckCounter());
        assertEquals(0.2, state.progressScore(), 1e-9);
    }

    @Test
    @DisplayName("exceeding the stuck bound routes to the strategy adapter")
    void stuck() {
        var node = new ProgressAnalyzerNode(fixedScore(0.1), 0.3, 2);
        var state = new TaskState("BP-2026-0001", "task", true);
        state.apply(StateUpdate.builder().stuckCounter(2).build());

        var next = assertInstanceOf(Transition.Continue.class, node.apply(state, context));

        assertEquals(NodeIds.STRATEGY_ADAPTER, next.nextNode());
        state.apply(next.update());
        assertEquals(3, state.stuckCounter());
    }

    @Test
    @DisplayName("good progress eases the stuck counter")
    void goodProgress() {
        var node = new ProgressAnalyzerNode(fixedScore(0.8), 0.3, 2);
        var state = new TaskState("BP-2026-0001", "task", true);
        state.apply(StateUpdate.builder().stuckCounter(2).build());

        state.apply(node.apply(state, context).update());

        assertEquals(1, state.stuckCounter());
    }

    @Test
    @DisplayName("strategy adapter resets the stuck counter and counts the change")
    void strategyAdapter() {
        var registry = new SimpleMeterRegistry();
        var adapter = new StrategyAdapterNode(new StrategyPlanner(), new AgentMetrics(registry));
        var state = new TaskState("BP-2026-0001", "task", true);
        var click = ActionRequest.of("browser_click", Map.of());
        state.apply(StateUpdate.builder()
                .appendMessage(Message.tool(ToolResult.error("no such element").forRequest(click)))
                .stuckCounter(3)
                .build());

        var next = assertInstanceOf(Transition.Continue.class, adapter.apply(state, context));

        assertEquals(NodeIds.REASONING, next.nextNode());
        state.apply(next.update());
        assertEquals(0, state.stuckCounter());
        assertEquals(1, state.strategyChanges());
        Message proposal = state.history().get(state.history().size() - 1);
        assertEquals(MessageRole.FEEDBACK, proposal.role());
        assertTrue(proposal.content().contains("browser_click"));
        assertEquals(1.0, registry.get("browserpilot.strategy.changes").counter().count());
    }
}
