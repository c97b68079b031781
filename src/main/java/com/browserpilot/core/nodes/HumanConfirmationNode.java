package com.browserpilot.core.nodes;

import com.browserpilot.core.graph.NodeIds;
import com.browserpilot.core.graph.ResumableNode;
import com.browserpilot.core.graph.RunContext;
import com.browserpilot.core.graph.Transition;
import com.browserpilot.core.model.ActionRequest;
import com.browserpilot.core.model.Interrupt;
import com.browserpilot.core.model.InterruptKind;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.PendingAction;
import com.browserpilot.core.model.ToolResult;
import com.browserpilot.core.policy.ActionPolicy;
import com.browserpilot.core.state.StateUpdate;
import com.browserpilot.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Suspends the loop until the user answers.
 * <p>
 * Critical actions get a yes/no confirmation; the ask-user action gets its question with
 * the caller-supplied options. Approval continues to tool execution. Anything else drops
 * the planned batch and returns to reasoning with a single message recording the answer.
 */
@Component
public class HumanConfirmationNode implements ResumableNode {

    private static final Logger log = LoggerFactory.getLogger(HumanConfirmationNode.class);

    private static final Set<String> AFFIRMATIVE = Set.of("yes", "y");

    private final ActionPolicy policy;

    public HumanConfirmationNode(ActionPolicy policy) {
        this.policy = policy;
    }

    @Override
    public String id() {
        return NodeIds.HUMAN_CONFIRMATION;
    }

    @Override
    public Transition apply(TaskState state, RunContext context) {
        PendingAction pending = state.pendingAction().orElse(null);
        if (pending == null) {
            log.warn("Confirmation requested without a pending action");
            return Transition.next(NodeIds.REASONING, StateUpdate.builder()
                    .resetValidation()
                    .clearPlannedBatch()
                    .build());
        }

        Interrupt interrupt;
        if (policy.isUserQuestion(pending.name())) {
            String question = stringArg(pending, "question", "Please choose an option");
            List<String> options = List.of(
                    stringArg(pending, "option_y", "yes"),
                    stringArg(pending, "option_n", "no"));
            interrupt = new Interrupt(InterruptKind.QUESTION, question, options, pending.name());
        } else {
            interrupt = Interrupt.confirmation("The agent wants to run " + pending.describe()
                    + ". This action may be irreversible. Proceed?", pending.name());
        }
        return new Transition.Suspend(interrupt, id(), StateUpdate.empty());
    }

    @Override
    public Transition resume(TaskState state, Interrupt interrupt, String response, RunContext context) {
        PendingAction pending = state.pendingAction()
                .orElseThrow(() -> new IllegalStateException("Resumed confirmation without a pending action"));
        String answer = response != null ? response.trim() : "";

        if (interrupt.kind() == InterruptKind.QUESTION) {
            String choice = interrupt.options().stream()
                    .filter(o -> o.equalsIgnoreCase(answer))
                    .findFirst()
                    .orElse(answer);
            log.info("User chose '{}' for: {}", choice, interrupt.message());
            String content = "User chose: " + choice + droppedNote(state, pending);
            var request = new ActionRequest(pending.actionId(), pending.name(), pending.args());
            return Transition.next(NodeIds.REASONING, StateUpdate.builder()
                    .appendMessage(Message.tool(ToolResult.ok(content).forRequest(request)))
                    .resetValidation()
                    .clearPlannedBatch()
                    .build());
        }

        if (AFFIRMATIVE.contains(answer.toLowerCase(Locale.ROOT))) {
            log.info("User approved {}", pending.describe());
            return Transition.next(NodeIds.TOOL_EXECUTION, StateUpdate.builder()
                    .validationPassed(true)
                    .requiresHumanApproval(false)
                    .needsValidation(false)
                    .build());
        }

        log.info("User rejected {} (answer '{}')", pending.describe(), answer);
        String feedback = ("no".equalsIgnoreCase(answer) || "n".equalsIgnoreCase(answer) || answer.isEmpty()
                ? "The user declined " + pending.describe() + "."
                : "The user answered '" + answer + "' instead of approving " + pending.describe() + ".")
                + " Do not run it. Find another way or finish with what you have."
                + droppedNote(state, pending);
        return Transition.next(NodeIds.REASONING, StateUpdate.builder()
                .appendMessage(Message.feedback(feedback))
                .resetValidation()
                .clearPlannedBatch()
                .build());
    }

    private static String droppedNote(TaskState state, PendingAction pending) {
        String others = state.plannedBatch().actions().stream()
                .filter(a -> !a.id().equals(pending.actionId()))
                .map(ActionRequest::describe)
                .collect(Collectors.joining(", "));
        return others.isEmpty() ? "" : " Not executed, request again if still needed: " + others + ".";
    }

    private static String stringArg(PendingAction pending, String key, String fallback) {
        Object value = pending.args().get(key);
        return value != null && !value.toString().isBlank() ? value.toString() : fallback;
    }
}
