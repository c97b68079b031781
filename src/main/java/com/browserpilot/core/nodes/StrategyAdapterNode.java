package com.browserpilot.core.nodes;

import com.browserpilot.core.graph.NodeIds;
import com.browserpilot.core.graph.RoutingNode;
import com.browserpilot.core.graph.RunContext;
import com.browserpilot.core.graph.Transition;
import com.browserpilot.core.metrics.AgentMetrics;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.reflection.StrategyPlanner;
import com.browserpilot.core.state.StateUpdate;
import com.browserpilot.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StrategyAdapterNode implements RoutingNode {

    private static final Logger log = LoggerFactory.getLogger(StrategyAdapterNode.class);

    private final StrategyPlanner planner;
    private final AgentMetrics metrics;

    public StrategyAdapterNode(StrategyPlanner planner, AgentMetrics metrics) {
        this.planner = planner;
        this.metrics = metrics;
    }

    @Override
    public String id() {
        return NodeIds.STRATEGY_ADAPTER;
    }

    @Override
    public Transition apply(TaskState state, RunContext context) {
        String proposal = planner.propose(state);
        log.info("Strategy change #{}: {}", state.strategyChanges() + 1, proposal);
        if (metrics != null) metrics.recordStrategyChange();
        return Transition.next(NodeIds.REASONING, StateUpdate.builder()
                .appendMessage(Message.feedback(proposal))
                .stuckCounter(0)
                .strategyChanges(state.strategyChanges() + 1)
                .build());
    }
}
