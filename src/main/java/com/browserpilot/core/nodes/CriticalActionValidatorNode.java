package com.browserpilot.core.nodes;

import com.browserpilot.core.graph.NodeIds;
import com.browserpilot.core.graph.RoutingNode;
import com.browserpilot.core.graph.RunContext;
import com.browserpilot.core.graph.Transition;
import com.browserpilot.core.model.PendingAction;
import com.browserpilot.core.policy.ActionPolicy;
import com.browserpilot.core.state.StateUpdate;
import com.browserpilot.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether the pending action needs a human's go-ahead.
 */
@Component
public class CriticalActionValidatorNode implements RoutingNode {

    private static final Logger log = LoggerFactory.getLogger(CriticalActionValidatorNode.class);

    private final ActionPolicy policy;

    public CriticalActionValidatorNode(ActionPolicy policy) {
        this.policy = policy;
    }

    @Override
    public String id() {
        return NodeIds.CRITICAL_ACTION_VALIDATOR;
    }

    @Override
    public Transition apply(TaskState state, RunContext context) {
        PendingAction pending = state.pendingAction().orElse(null);
        if (pending == null) {
            log.warn("Validator reached without a pending action");
            return Transition.next(NodeIds.REASONING, StateUpdate.builder()
                    .resetValidation()
                    .clearPlannedBatch()
                    .build());
        }

        if (policy.requiresHumanApproval(pending.name(), state.interactionMode())) {
            log.info("{} requires human approval", pending.describe());
            return Transition.next(NodeIds.HUMAN_CONFIRMATION, StateUpdate.builder()
                    .requiresHumanApproval(true)
                    .validationPassed(false)
                    .build());
        }

        log.info("{} approved without confirmation ({})", pending.describe(), state.interactionMode());
        return Transition.next(NodeIds.TOOL_EXECUTION, StateUpdate.builder()
                .needsValidation(false)
                .validationPassed(true)
                .requiresHumanApproval(false)
                .build());
    }
}
