package com.browserpilot.core.nodes;

import com.browserpilot.core.graph.NodeIds;
import com.browserpilot.core.graph.RoutingNode;
import com.browserpilot.core.graph.RunContext;
import com.browserpilot.core.graph.Transition;
import com.browserpilot.core.memory.Compaction;
import com.browserpilot.core.memory.HistoryCompactor;
import com.browserpilot.core.metrics.AgentMetrics;
import com.browserpilot.core.state.StateUpdate;
import com.browserpilot.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Folds old history into the running summary. A no-op when nothing needs compacting.
 */
@Component
public class MemoryManagerNode implements RoutingNode {

    private static final Logger log = LoggerFactory.getLogger(MemoryManagerNode.class);

    private final HistoryCompactor compactor;
    private final AgentMetrics metrics;

    public MemoryManagerNode(HistoryCompactor compactor, AgentMetrics metrics) {
        this.compactor = compactor;
        this.metrics = metrics;
    }

    @Override
    public String id() {
        return NodeIds.MEMORY_MANAGER;
    }

    @Override
    public Transition apply(TaskState state, RunContext context) {
        Optional<Compaction> compaction = compactor.compact(state.history(), state.summaryContext().orElse(null));
        if (compaction.isEmpty()) {
            log.debug("Nothing to compact");
            return Transition.next(NodeIds.REASONING);
        }
        Compaction c = compaction.get();
        if (metrics != null) metrics.recordCompaction(c.removedCount());
        return Transition.next(NodeIds.REASONING, StateUpdate.builder()
                .compactHistory(c.removedCount(), c.summary())
                .build());
    }
}
