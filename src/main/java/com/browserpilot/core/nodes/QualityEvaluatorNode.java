package com.browserpilot.core.nodes;

import com.browserpilot.core.config.AgentProperties;
import com.browserpilot.core.graph.NodeIds;
import com.browserpilot.core.graph.RoutingNode;
import com.browserpilot.core.graph.RunContext;
import com.browserpilot.core.graph.Transition;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.reflection.CompletionJudge;
import com.browserpilot.core.reflection.QualityVerdict;
import com.browserpilot.core.state.StateUpdate;
import com.browserpilot.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Scores the final answer against the task before the goal check.
 */
@Component
public class QualityEvaluatorNode implements RoutingNode {

    private static final Logger log = LoggerFactory.getLogger(QualityEvaluatorNode.class);

    private final CompletionJudge judge;
    private final double minQualityScore;

    @Autowired
    public QualityEvaluatorNode(CompletionJudge judge, AgentProperties properties) {
        this(judge, properties.getReflection().getMinQualityScore());
    }

    public QualityEvaluatorNode(CompletionJudge judge, double minQualityScore) {
        this.judge = judge;
        this.minQualityScore = minQualityScore;
    }

    @Override
    public String id() {
        return NodeIds.QUALITY_EVALUATOR;
    }

    @Override
    public Transition apply(TaskState state, RunContext context) {
        QualityVerdict verdict = judge.assessQuality(state);
        var update = StateUpdate.builder().qualityScore(verdict.score());

        if (verdict.score() < minQualityScore) {
            log.info("Answer quality {} ({}), sending back to reasoning", verdict.rating(), verdict.score());
            return Transition.next(NodeIds.REASONING, update
                    .appendMessage(Message.feedback("Quality check: " + verdict.rating() + ". " + verdict.feedback()))
                    .build());
        }
        log.info("Answer quality {} ({})", verdict.rating(), verdict.score());
        return Transition.next(NodeIds.GOAL_VALIDATOR, update.build());
    }
}
