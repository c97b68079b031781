package com.browserpilot.core.nodes;

import com.browserpilot.core.graph.NodeIds;
import com.browserpilot.core.graph.RoutingNode;
import com.browserpilot.core.graph.RunContext;
import com.browserpilot.core.graph.Transition;
import com.browserpilot.core.model.ErrorType;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.reflection.CorrectionAdvisor;
import com.browserpilot.core.state.StateUpdate;
import com.browserpilot.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a recoverable failure into guidance for the next reasoning step. It never
 * retries the action itself.
 */
@Component
public class SelfCorrectorNode implements RoutingNode {

    private static final Logger log = LoggerFactory.getLogger(SelfCorrectorNode.class);

    private final CorrectionAdvisor advisor;

    public SelfCorrectorNode(CorrectionAdvisor advisor) {
        this.advisor = advisor;
    }

    @Override
    public String id() {
        return NodeIds.SELF_CORRECTOR;
    }

    @Override
    public Transition apply(TaskState state, RunContext context) {
        ErrorType kind = state.errorType();
        var update = StateUpdate.builder().errorType(ErrorType.NONE);
        if (kind.isError()) {
            log.info("Self-correcting after {}", kind.wireName());
            update.appendMessage(Message.feedback(advisor.guidance(kind)));
        }
        return Transition.next(NodeIds.REASONING, update.build());
    }
}
