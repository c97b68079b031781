package com.browserpilot.core.nodes;

import com.browserpilot.core.graph.NodeIds;
import com.browserpilot.core.graph.RoutingNode;
import com.browserpilot.core.graph.RunContext;
import com.browserpilot.core.graph.Transition;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.Outcome;
import com.browserpilot.core.reflection.CompletionJudge;
import com.browserpilot.core.reflection.GoalVerdict;
import com.browserpilot.core.state.StateUpdate;
import com.browserpilot.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The only node that can finish a task successfully.
 */
@Component
public class GoalValidatorNode implements RoutingNode {

    private static final Logger log = LoggerFactory.getLogger(GoalValidatorNode.class);

    private final CompletionJudge judge;

    public GoalValidatorNode(CompletionJudge judge) {
        this.judge = judge;
    }

    @Override
    public String id() {
        return NodeIds.GOAL_VALIDATOR;
    }

    @Override
    public Transition apply(TaskState state, RunContext context) {
        GoalVerdict verdict = judge.assessGoal(state);
        if (verdict.achieved()) {
            log.info("Goal achieved: {}", verdict.evidence());
            return Transition.terminal(Outcome.success(verdict.evidence()),
                    StateUpdate.builder().goalAchieved(true).build());
        }
        log.info("Goal {}: {}", verdict.status(), verdict.gap());
        return Transition.next(NodeIds.REASONING, StateUpdate.builder()
                .appendMessage(Message.feedback("Goal not yet met (" + verdict.status() + "): " + verdict.gap()))
                .build());
    }
}
