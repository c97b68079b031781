package com.browserpilot.core.nodes;

import com.browserpilot.core.config.AgentProperties;
import com.browserpilot.core.errors.ErrorClassifier;
import com.browserpilot.core.graph.NodeIds;
import com.browserpilot.core.graph.RoutingNode;
import com.browserpilot.core.graph.RunContext;
import com.browserpilot.core.graph.Transition;
import com.browserpilot.core.memory.HistoryCompactor;
import com.browserpilot.core.model.ActionBatch;
import com.browserpilot.core.model.ActionRequest;
import com.browserpilot.core.model.ErrorType;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.Outcome;
import com.browserpilot.core.model.PendingAction;
import com.browserpilot.core.policy.ActionPolicy;
import com.browserpilot.core.reasoning.GuidanceSelector;
import com.browserpilot.core.reasoning.ReasoningEngine;
import com.browserpilot.core.reasoning.ReasoningResult;
import com.browserpilot.core.state.StateUpdate;
import com.browserpilot.core.state.TaskState;
import com.browserpilot.core.tools.ToolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Asks the reasoning engine for the next move and routes on its answer.
 * <p>
 * Requested actions go to the validator when any of them needs validation, otherwise
 * straight to tool execution. A completion goes to the quality evaluator. When history
 * has outgrown the compaction pre-threshold, the memory manager runs first.
 */
@Component
public class ReasoningNode implements RoutingNode {

    private static final Logger log = LoggerFactory.getLogger(ReasoningNode.class);

    private final ReasoningEngine reasoningEngine;
    private final ToolExecutor toolExecutor;
    private final ActionPolicy policy;
    private final GuidanceSelector guidance;
    private final HistoryCompactor compactor;
    private final ErrorClassifier classifier;
    private final int maxRetries;

    @Autowired
    public ReasoningNode(ReasoningEngine reasoningEngine, ToolExecutor toolExecutor, ActionPolicy policy,
                         GuidanceSelector guidance, HistoryCompactor compactor, ErrorClassifier classifier,
                         AgentProperties properties) {
        this(reasoningEngine, toolExecutor, policy, guidance, compactor, classifier,
                properties.getLoop().getMaxRetries());
    }

    public ReasoningNode(ReasoningEngine reasoningEngine, ToolExecutor toolExecutor, ActionPolicy policy,
                         GuidanceSelector guidance, HistoryCompactor compactor, ErrorClassifier classifier,
                         int maxRetries) {
        this.reasoningEngine = reasoningEngine;
        this.toolExecutor = toolExecutor;
        this.policy = policy;
        this.guidance = guidance;
        this.compactor = compactor;
        this.classifier = classifier;
        this.maxRetries = maxRetries;
    }

    @Override
    public String id() {
        return NodeIds.REASONING;
    }

    @Override
    public Transition apply(TaskState state, RunContext context) {
        if (compactor.needsCompaction(state.history(), state.summaryContext().orElse(null))) {
            log.info("History at {} tokens, compacting before reasoning",
                    compactor.size(state.history(), state.summaryContext().orElse(null)));
            return Transition.next(NodeIds.MEMORY_MANAGER);
        }

        ReasoningResult result;
        try {
            result = reasoningEngine.infer(buildInput(state), toolExecutor.availableActions());
        } catch (RuntimeException e) {
            return onReasoningFailure(state, e);
        }

        if (result instanceof ReasoningResult.Completion completion) {
            log.info("Reasoning signalled completion");
            return Transition.next(NodeIds.QUALITY_EVALUATOR, StateUpdate.builder()
                    .appendMessage(Message.assistant(completion.answer()))
                    .build());
        }

        var plan = (ReasoningResult.ActionPlan) result;
        if (plan.actions().isEmpty()) {
            log.info("Reasoning requested no actions, treating as completion");
            return Transition.next(NodeIds.QUALITY_EVALUATOR, StateUpdate.builder()
                    .appendMessage(Message.assistant(plan.thought()))
                    .build());
        }

        var update = StateUpdate.builder()
                .appendMessage(Message.assistant(plan.thought(), plan.actions()));

        Optional<ActionRequest> gated = policy.firstRequiringValidation(plan.actions());
        if (gated.isPresent()) {
            // one confirmation per batch: later gated actions wait for a new request
            var kept = new ArrayList<ActionRequest>();
            var deferred = new ArrayList<String>();
            for (ActionRequest action : plan.actions()) {
                if (action == gated.get() || !policy.requiresValidation(action.name())) {
                    kept.add(action);
                } else {
                    deferred.add(action.describe());
                }
            }
            if (!deferred.isEmpty()) {
                update.appendMessage(Message.feedback("Deferred until " + gated.get().name()
                        + " is confirmed, request again if still needed: " + String.join(", ", deferred) + "."));
            }
            log.info("Action {} needs validation", gated.get().name());
            return Transition.next(NodeIds.CRITICAL_ACTION_VALIDATOR, update
                    .plannedBatch(new ActionBatch(kept, plan.parallel()))
                    .pendingAction(PendingAction.of(gated.get()))
                    .needsValidation(true)
                    .validationPassed(false)
                    .build());
        }

        var batch = new ActionBatch(plan.actions(), plan.parallel());
        log.debug("Dispatching {} action(s) ({})", batch.size(), batch.parallel() ? "parallel" : "sequential");
        return Transition.next(NodeIds.TOOL_EXECUTION, update.plannedBatch(batch).build());
    }

    /**
     * Guidance and the task come first, then the running summary, then the retained history.
     */
    List<Message> buildInput(TaskState state) {
        var input = new ArrayList<Message>(state.history().size() + 3);
        input.add(guidance.guidanceFor(state.step()));
        input.add(Message.user(state.originalTask()));
        state.summaryContext().ifPresent(s -> input.add(Message.feedback(s.summary())));
        input.addAll(state.history());
        return input;
    }

    private Transition onReasoningFailure(TaskState state, RuntimeException e) {
        String text = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        ErrorType kind = classifier.classifyText(text);
        int count = state.errorCount() + 1;
        var update = StateUpdate.builder()
                .errorCount(count)
                .lastError(text)
                .build();
        if (count > maxRetries) {
            log.error("Reasoning failed {} times, giving up: {}", count, text);
            return Transition.terminal(Outcome.retryExhausted(kind, text), update);
        }
        log.warn("Reasoning failed ({}), retry {}/{}: {}", kind.wireName(), count, maxRetries, text);
        return Transition.next(NodeIds.REASONING, update);
    }
}
