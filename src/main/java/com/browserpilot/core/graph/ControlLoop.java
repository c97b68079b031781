package com.browserpilot.core.graph;

import com.browserpilot.core.config.AgentProperties;
import com.browserpilot.core.logging.MdcContext;
import com.browserpilot.core.metrics.AgentMetrics;
import com.browserpilot.core.model.ActionBatch;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.Outcome;
import com.browserpilot.core.model.PendingAction;
import com.browserpilot.core.state.StateUpdate;
import com.browserpilot.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drives a task through the routing nodes.
 * <p>
 * Each iteration invokes one node, applies its delta, then follows the node's own
 * routing decision. The loop stops on a terminal outcome, on a suspension, on
 * cancellation, or when the iteration ceiling is reached. {@code step} advances once
 * for every iteration that does not suspend.
 */
@Component
public class ControlLoop {

    private static final Logger log = LoggerFactory.getLogger(ControlLoop.class);

    /** Nodes allowed to observe a pending action. */
    private static final Set<String> PENDING_ACTION_PATH = Set.of(
            NodeIds.CRITICAL_ACTION_VALIDATOR, NodeIds.HUMAN_CONFIRMATION, NodeIds.TOOL_EXECUTION);

    private final NodeRegistry registry;
    private final int maxSteps;
    private final AgentMetrics metrics;

    @Autowired
    public ControlLoop(NodeRegistry registry, AgentProperties properties, AgentMetrics metrics) {
        this(registry, properties.getLoop().getMaxSteps(), metrics);
    }

    public ControlLoop(NodeRegistry registry, int maxSteps, AgentMetrics metrics) {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive, got " + maxSteps);
        }
        this.registry = registry;
        this.maxSteps = maxSteps;
        this.metrics = metrics;
    }

    public int maxSteps() {
        return maxSteps;
    }

    /**
     * Runs the loop from {@code entryNode} until it finishes or suspends.
     */
    public LoopResult run(TaskState state, String entryNode, RunContext context) {
        return drive(state, entryNode, context);
    }

    /**
     * Continues a suspended task with the caller's answer. The resume invocation counts
     * as one iteration.
     */
    public LoopResult resume(TaskState state, Continuation continuation, String response, RunContext context) {
        if (!continuation.sessionId().equals(state.sessionId())) {
            throw new IllegalArgumentException("Continuation for session " + continuation.sessionId()
                    + " cannot resume session " + state.sessionId());
        }
        LoopResult stop = checkBoundary(state, context);
        if (stop != null) {
            return stop;
        }

        String nodeId = continuation.resumeNode();
        ResumableNode node = registry.resumable(nodeId);
        log.info("Resuming session {} at {} with response '{}'", state.sessionId(), nodeId, response);
        Transition transition = invoke(state, nodeId, () -> node.resume(state, continuation.interrupt(), response, context));
        return settle(state, nodeId, transition, context);
    }

    private LoopResult drive(TaskState state, String entryNode, RunContext context) {
        String current = entryNode;
        while (true) {
            LoopResult stop = checkBoundary(state, context);
            if (stop != null) {
                return stop;
            }

            RoutingNode node = registry.get(current);
            String nodeId = current;
            Transition transition = invoke(state, nodeId, () -> node.apply(state, context));

            if (transition instanceof Transition.Continue next) {
                state.apply(next.update());
                state.advanceStep();
                checkInvariants(state, nodeId, next.nextNode());
                if (!NodeIds.REASONING.equals(next.nextNode())) {
                    log.info("Step {}: {} -> {}", state.step(), nodeId, next.nextNode());
                } else {
                    log.debug("Step {}: {} -> {}", state.step(), nodeId, next.nextNode());
                }
                current = next.nextNode();
            } else {
                return settle(state, nodeId, transition, context);
            }
        }
    }

    /**
     * Applies a transition coming out of a resume or a non-continue transition from the drive loop.
     */
    private LoopResult settle(TaskState state, String nodeId, Transition transition, RunContext context) {
        if (transition instanceof Transition.Suspend suspend) {
            state.apply(suspend.update());
            var continuation = new Continuation(state.sessionId(), suspend.resumeNode(),
                    suspend.interrupt(), state.step(), Instant.now());
            log.info("Step {}: {} suspended awaiting {} ({})", state.step(), nodeId,
                    suspend.interrupt().kind(), suspend.interrupt().message());
            if (metrics != null) metrics.recordSuspension(suspend.interrupt().kind());
            return new LoopResult.Suspended(continuation);
        }
        if (transition instanceof Transition.Terminal terminal) {
            if (terminal.outcome().isSuccess() && !NodeIds.GOAL_VALIDATOR.equals(nodeId)) {
                throw new IllegalStateException("Node '" + nodeId + "' attempted to report success");
            }
            state.apply(terminal.update());
            state.advanceStep();
            return finish(state, terminal.outcome());
        }
        var next = (Transition.Continue) transition;
        state.apply(next.update());
        state.advanceStep();
        checkInvariants(state, nodeId, next.nextNode());
        log.info("Step {}: {} -> {}", state.step(), nodeId, next.nextNode());
        return drive(state, next.nextNode(), context);
    }

    private Transition invoke(TaskState state, String nodeId, NodeCall call) {
        MdcContext.setNode(nodeId, state.step());
        try {
            if (metrics != null) metrics.recordNodeInvocation(nodeId);
            state.markNode(nodeId);
            Transition transition = call.invoke();
            if (transition == null) {
                throw new IllegalStateException("Node '" + nodeId + "' returned no transition");
            }
            return transition;
        } finally {
            MdcContext.clearNode();
        }
    }

    private LoopResult checkBoundary(TaskState state, RunContext context) {
        if (context.cancellation().isCancelled()) {
            state.apply(abortRecord(state, Outcome.CANCELLED));
            log.warn("Session {} cancelled at step {}", state.sessionId(), state.step());
            return finish(state, Outcome.failure(Outcome.CANCELLED));
        }
        int limit = context.stepLimit() > 0 ? context.stepLimit() : maxSteps;
        if (state.step() >= limit) {
            state.apply(abortRecord(state, Outcome.STEP_LIMIT_EXCEEDED));
            log.warn("Session {} hit the step ceiling of {}", state.sessionId(), limit);
            return finish(state, Outcome.failure(Outcome.STEP_LIMIT_EXCEEDED,
                    "No completion after " + state.step() + " steps"));
        }
        return null;
    }

    /**
     * Builds the delta that records why a pending action or planned batch will never run.
     */
    static StateUpdate abortRecord(TaskState state, String reason) {
        ActionBatch batch = state.plannedBatch();
        if (state.pendingAction().isEmpty() && batch.isEmpty()) {
            return StateUpdate.empty();
        }
        String actions = state.pendingAction().map(PendingAction::describe)
                .orElseGet(() -> batch.actions().stream()
                        .map(a -> a.describe())
                        .collect(Collectors.joining(", ")));
        return StateUpdate.builder()
                .appendMessage(Message.feedback("Aborted (" + reason + "): not executed: " + actions))
                .resetValidation()
                .clearPlannedBatch()
                .build();
    }

    private void checkInvariants(TaskState state, String from, String to) {
        if (state.goalAchieved()) {
            throw new IllegalStateException("Node '" + from + "' set goalAchieved without terminating");
        }
        if (state.pendingAction().isPresent() && !PENDING_ACTION_PATH.contains(to)) {
            throw new IllegalStateException("Node '" + from + "' routed to '" + to
                    + "' with a pending action still set");
        }
    }

    private LoopResult finish(TaskState state, Outcome outcome) {
        if (metrics != null) metrics.recordOutcome(outcome, state.step());
        if (outcome.isSuccess()) {
            log.info("Session {} succeeded after {} steps: {}", state.sessionId(), state.step(), outcome.reason());
        } else {
            log.info("Session {} failed after {} steps: {}", state.sessionId(), state.step(), outcome.reason());
        }
        return new LoopResult.Finished(outcome);
    }

    @FunctionalInterface
    private interface NodeCall {
        Transition invoke();
    }
}
