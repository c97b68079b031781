package com.browserpilot.core.nodes;

import com.browserpilot.core.config.AgentProperties;
import com.browserpilot.core.graph.NodeIds;
import com.browserpilot.core.graph.RunContext;
import com.browserpilot.core.graph.Transition;
import com.browserpilot.core.model.ActionBatch;
import com.browserpilot.core.model.ActionRequest;
import com.browserpilot.core.model.InteractionMode;
import com.browserpilot.core.model.InterruptKind;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.MessageRole;
import com.browserpilot.core.model.PendingAction;
import com.browserpilot.core.policy.ActionPolicy;
import com.browserpilot.core.state.StateUpdate;
import com.browserpilot.core.state.TaskState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the validator and the confirmation node, which together gate risky actions.
 */
class HumanConfirmationNodeTest {

    private final ActionPolicy policy = new ActionPolicy(new AgentProperties());
    private final RunContext context = RunContext.of("BP-2026-0001");

    private CriticalActionValidatorNode validator;
    private HumanConfirmationNode confirmation;

    @BeforeEach
    void setUp() {
        validator = new CriticalActionValidatorNode(policy);
        confirmation = new HumanConfirmationNode(policy);
    }

    private static TaskState pending(InteractionMode mode, ActionRequest gated, ActionRequest... others) {
        var state = new TaskState("BP-2026-0001", "submit the contact form", false, mode);
        var batch = new java.util.ArrayList<ActionRequest>(List.of(others));
        batch.add(gated);
        state.apply(StateUpdate.builder()
                .appendMessage(Message.assistant("plan", batch))
                .plannedBatch(new ActionBatch(batch, false))
                .pendingAction(PendingAction.of(gated))
                .needsValidation(true)
                .build());
        return state;
    }

    @Nested
    @DisplayName("validator")
    class Validator {

        @Test
        @DisplayName("critical action under confirm-critical goes to confirmation")
        void needsApproval() {
            var state = pending(InteractionMode.CONFIRM_CRITICAL, ActionRequest.of("submit_form", Map.of()));

            var next = assertInstanceOf(Transition.Continue.class, validator.apply(state, context));

            assertEquals(NodeIds.HUMAN_CONFIRMATION, next.nextNode());
            state.apply(next.update());
            assertTrue(state.requiresHumanApproval());
        }

        @Test
        @DisplayName("full-auto approves critical actions")
        void fullAuto() {
            var state = pending(InteractionMode.FULL_AUTO, ActionRequest.of("submit_form", Map.of()));

            var next = assertInstanceOf(Transition.Continue.class, validator.apply(state, context));

            assertEquals(NodeIds.TOOL_EXECUTION, next.nextNode());
            state.apply(next.update());
            assertTrue(state.validationPassed());
            assertFalse(state.needsValidation());
        }

        @Test
        @DisplayName("questions to the user are asked even in full-auto")
        void questionInFullAuto() {
            var state = pending(InteractionMode.FULL_AUTO,
                    ActionRequest.of("request_user_confirmation", Map.of("question", "Size?")));

            var next = assertInstanceOf(Transition.Continue.class, validator.apply(state, context));

            assertEquals(NodeIds.HUMAN_CONFIRMATION, next.nextNode());
        }

        @Test
        @DisplayName("without a pending action, returns to reasoning with the batch cleared")
        void noPending() {
            var state = new TaskState("BP-2026-0001", "t", false);

            var next = assertInstanceOf(Transition.Continue.class, validator.apply(state, context));

            assertEquals(NodeIds.REASONING, next.nextNode());
        }
    }

    @Nested
    @DisplayName("confirmation")
    class Confirmation {

        @Test
        @DisplayName("suspends with a yes/no confirmation describing the action")
        void suspends() {
            var state = pending(InteractionMode.CONFIRM_CRITICAL, ActionRequest.of("submit_form", Map.of("ref", "e9")));

            var suspend = assertInstanceOf(Transition.Suspend.class, confirmation.apply(state, context));

            assertEquals(InterruptKind.CONFIRMATION, suspend.interrupt().kind());
            assertEquals(List.of("yes", "no"), suspend.interrupt().options());
            assertTrue(suspend.interrupt().message().contains("submit_form(ref=e9)"));
            assertEquals(NodeIds.HUMAN_CONFIRMATION, suspend.resumeNode());
        }

        @Test
        @DisplayName("the ask-user action suspends with its own question and options")
        void question() {
            var state = pending(InteractionMode.CONFIRM_CRITICAL, ActionRequest.of("request_user_confirmation",
                    Map.of("question", "Which size?", "option_y", "M", "option_n", "L")));

            var suspend = assertInstanceOf(Transition.Suspend.class, confirmation.apply(state, context));

            assertEquals(InterruptKind.QUESTION, suspend.interrupt().kind());
            assertEquals("Which size?", suspend.interrupt().message());
            assertEquals(List.of("M", "L"), suspend.interrupt().options());
        }

        @Test
        @DisplayName("yes continues to tool execution with validation passed")
        void approve() {
            var state = pending(InteractionMode.CONFIRM_CRITICAL, ActionRequest.of("submit_form", Map.of()));
            var interrupt = ((Transition.Suspend) confirmation.apply(state, context)).interrupt();

            var next = assertInstanceOf(Transition.Continue.class, confirmation.resume(state, interrupt, "Yes", context));

            assertEquals(NodeIds.TOOL_EXECUTION, next.nextNode());
            state.apply(next.update());
            assertTrue(state.validationPassed());
            assertFalse(state.requiresHumanApproval());
            assertTrue(state.pendingAction().isPresent());
        }

        @Test
        @DisplayName("no clears the pending action and batch and appends exactly one feedback message")
        void reject() {
            var state = pending(InteractionMode.CONFIRM_CRITICAL, ActionRequest.of("submit_form", Map.of()),
                    ActionRequest.of("fill", Map.of("ref", "e1")));
            int before = state.history().size();
            var interrupt = ((Transition.Suspend) confirmation.apply(state, context)).interrupt();

            var next = assertInstanceOf(Transition.Continue.class, confirmation.resume(state, interrupt, "no", context));

            assertEquals(NodeIds.REASONING, next.nextNode());
            state.apply(next.update());
            assertEquals(before + 1, state.history().size());
            Message feedback = state.history().get(before);
            assertEquals(MessageRole.FEEDBACK, feedback.role());
            assertTrue(feedback.content().contains("declined submit_form()"));
            assertTrue(feedback.content().contains("fill(ref=e1)"));
            assertTrue(state.pendingAction().isEmpty());
            assertTrue(state.plannedBatch().isEmpty());
            assertFalse(state.requiresHumanApproval());
        }

        @Test
        @DisplayName("an unexpected answer is treated as a rejection")
        void otherAnswer() {
            var state = pending(InteractionMode.CONFIRM_CRITICAL, ActionRequest.of("submit_form", Map.of()));
            var interrupt = ((Transition.Suspend) confirmation.apply(state, context)).interrupt();

            var next = assertInstanceOf(Transition.Continue.class,
                    confirmation.resume(state, interrupt, "maybe later", context));

            assertEquals(NodeIds.REASONING, next.nextNode());
            assertTrue(next.update().appendedMessages().get(0).content().contains("'maybe later'"));
        }

        @Test
        @DisplayName("a question answer is recorded as the ask action's result")
        void questionAnswer() {
            var ask = ActionRequest.of("request_user_confirmation",
                    Map.of("question", "Which size?", "option_y", "M", "option_n", "L"));
            var state = pending(InteractionMode.CONFIRM_CRITICAL, ask);
            var interrupt = ((Transition.Suspend) confirmation.apply(state, context)).interrupt();

            var next = assertInstanceOf(Transition.Continue.class, confirmation.resume(state, interrupt, "l", context));

            assertEquals(NodeIds.REASONING, next.nextNode());
            Message result = next.update().appendedMessages().get(0);
            assertEquals(MessageRole.TOOL, result.role());
            assertEquals(ask.id(), result.actionId());
            assertEquals("User chose: L", result.content());
            assertTrue(result.isSuccessfulToolResult());
        }
    }
}
