package com.browserpilot.core.nodes;

import com.browserpilot.core.config.AgentProperties;
import com.browserpilot.core.graph.NodeIds;
import com.browserpilot.core.graph.RoutingNode;
import com.browserpilot.core.graph.RunContext;
import com.browserpilot.core.graph.Transition;
import com.browserpilot.core.reflection.ProgressEstimator;
import com.browserpilot.core.state.StateUpdate;
import com.browserpilot.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Scores progress and counts consecutive low-progress checks. Past the stuck bound the
 * task goes to the strategy adapter.
 */
@Component
public class ProgressAnalyzerNode implements RoutingNode {

    private static final Logger log = LoggerFactory.getLogger(ProgressAnalyzerNode.class);

    private final ProgressEstimator estimator;
    private final double stuckScoreThreshold;
    private final int stuckBound;

    @Autowired
    public ProgressAnalyzerNode(ProgressEstimator estimator, AgentProperties properties) {
        this(estimator, properties.getReflection().getStuckScoreThreshold(), properties.getReflection().getStuckBound());
    }

    public ProgressAnalyzerNode(ProgressEstimator estimator, double stuckScoreThreshold, int stuckBound) {
        this.estimator = estimator;
        this.stuckScoreThreshold = stuckScoreThreshold;
        this.stuckBound = stuckBound;
    }

    @Override
    public String id() {
        return NodeIds.PROGRESS_ANALYZER;
    }

    @Override
    public Transition apply(TaskState state, RunContext context) {
        double score = estimator.estimate(state);
        var update = StateUpdate.builder().progressScore(score);

        if (score < stuckScoreThreshold) {
            int stuck = state.stuckCounter() + 1;
            update.stuckCounter(stuck);
            if (stuck > stuckBound) {
                log.warn("Progress {} below {} for {} checks, adapting strategy",
                        String.format("%.2f", score), stuckScoreThreshold, stuck);
                return Transition.next(NodeIds.STRATEGY_ADAPTER, update.build());
            }
            log.info("Low progress {} (stuck {}/{})", String.format("%.2f", score), stuck, stuckBound);
            return Transition.next(NodeIds.REASONING, update.build());
        }

        update.stuckCounter(Math.max(0, state.stuckCounter() - 1));
        log.debug("Progress {}", String.format("%.2f", score));
        return Transition.next(NodeIds.REASONING, update.build());
    }
}
