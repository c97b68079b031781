package com.browserpilot.core.nodes;

import com.browserpilot.core.events.AgentEvent;
import com.browserpilot.core.events.ObservabilitySink;
import com.browserpilot.core.graph.NodeIds;
import com.browserpilot.core.graph.RoutingNode;
import com.browserpilot.core.graph.RunContext;
import com.browserpilot.core.graph.Transition;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.MessageRole;
import com.browserpilot.core.reflection.ProgressEstimator;
import com.browserpilot.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Emits a progress event on the side channel. Leaves the task state untouched.
 */
@Component
public class ProgressReporterNode implements RoutingNode {

    private static final Logger log = LoggerFactory.getLogger(ProgressReporterNode.class);

    private final ObservabilitySink sink;
    private final ProgressEstimator estimator;

    public ProgressReporterNode(ObservabilitySink sink, ProgressEstimator estimator) {
        this.sink = sink;
        this.estimator = estimator;
    }

    @Override
    public String id() {
        return NodeIds.PROGRESS_REPORTER;
    }

    @Override
    public Transition apply(TaskState state, RunContext context) {
        // the analyzer only runs for complex tasks, so score afresh for the report
        double score = estimator.estimate(state);
        var payload = new LinkedHashMap<String, Object>();
        payload.put("step", state.step());
        payload.put("messages", state.history().size());
        payload.put("lastAction", lastAction(state.history()));
        payload.put("progressScore", score);
        payload.put("errorCount", state.errorCount());
        payload.put("status", ProgressEstimator.status(score));
        try {
            sink.emit(AgentEvent.of(AgentEvent.PROGRESS, state.sessionId(), id(), payload));
        } catch (RuntimeException e) {
            log.warn("Progress event dropped: {}", e.getMessage());
        }
        return Transition.next(NodeIds.REASONING);
    }

    static String lastAction(List<Message> history) {
        for (int i = history.size() - 1; i >= 0; i--) {
            Message m = history.get(i);
            if (m.role() == MessageRole.TOOL && m.actionName() != null) {
                return m.actionName();
            }
        }
        return "none";
    }
}
