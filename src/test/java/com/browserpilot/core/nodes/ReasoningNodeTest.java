package com.browserpilot.core.nodes;

import com.browserpilot.core.config.AgentProperties;
import com.browserpilot.core.errors.ErrorClassifier;
import com.browserpilot.core.graph.NodeIds;
import com.browserpilot.core.graph.RunContext;
import com.browserpilot.core.graph.Transition;
import com.browserpilot.core.memory.ExtractiveSummarizer;
import com.browserpilot.core.memory.HistoryCompactor;
import com.browserpilot.core.memory.TokenEstimator;
import com.browserpilot.core.model.ActionRequest;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.MessageRole;
import com.browserpilot.core.model.Outcome;
import com.browserpilot.core.model.SummaryContext;
import com.browserpilot.core.policy.ActionPolicy;
import com.browserpilot.core.reasoning.GuidanceSelector;
import com.browserpilot.core.reasoning.ReasoningEngine;
import com.browserpilot.core.reasoning.ReasoningResult;
import com.browserpilot.core.state.StateUpdate;
import com.browserpilot.core.state.TaskState;
import com.browserpilot.core.tools.ToolExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ReasoningNodeTest {

    private ReasoningEngine engine;
    private ToolExecutor toolExecutor;
    private ReasoningNode node;
    private TaskState state;
    private RunContext context;

    @BeforeEach
    void setUp() {
        engine = mock(ReasoningEngine.class);
        toolExecutor = mock(ToolExecutor.class);
        when(toolExecutor.availableActions()).thenReturn(List.of());
        var estimator = new TokenEstimator();
        var compactor = new HistoryCompactor(estimator, new ExtractiveSummarizer(estimator), 400, 600, 100, 4);
        node = new ReasoningNode(engine, toolExecutor, new ActionPolicy(new AgentProperties()),
                new GuidanceSelector(25), compactor, new ErrorClassifier(), 3);
        state = new TaskState("BP-2026-0001", "get the page title of example.com", false);
        context = RunContext.of("BP-2026-0001");
    }

    private void plan(boolean parallel, ActionRequest... actions) {
        when(engine.infer(anyList(), anyList()))
                .thenReturn(new ReasoningResult.ActionPlan("thinking", List.of(actions), parallel));
    }

    private static TaskState applied(TaskState state, Transition transition) {
        state.apply(transition.update());
        return state;
    }

    @Nested
    @DisplayName("action plans")
    class ActionPlans {

        @Test
        @DisplayName("safe actions go straight to tool execution")
        void safeActions() {
            plan(true, ActionRequest.of("navigate", Map.of("url", "https://example.com")),
                    ActionRequest.of("extract_title", Map.of()));

            var next = assertInstanceOf(Transition.Continue.class, node.apply(state, context));

            assertEquals(NodeIds.TOOL_EXECUTION, next.nextNode());
            applied(state, next);
            assertEquals(2, state.plannedBatch().size());
            assertTrue(state.plannedBatch().parallel());
            assertTrue(state.pendingAction().isEmpty());
            Message last = state.history().get(state.history().size() - 1);
            assertEquals(MessageRole.ASSISTANT, last.role());
            assertEquals(2, last.actionRequests().size());
        }

        @Test
        @DisplayName("a critical action goes to the validator with a pending action")
        void criticalAction() {
            var submit = ActionRequest.of("submit_form", Map.of("ref", "e9"));
            plan(false, ActionRequest.of("fill", Map.of("ref", "e1")), submit);

            var next = assertInstanceOf(Transition.Continue.class, node.apply(state, context));

            assertEquals(NodeIds.CRITICAL_ACTION_VALIDATOR, next.nextNode());
            applied(state, next);
            assertEquals(submit.id(), state.pendingAction().orElseThrow().actionId());
            assertTrue(state.needsValidation());
            assertFalse(state.validationPassed());
            assertEquals(2, state.plannedBatch().size());
        }

        @Test
        @DisplayName("further critical actions in the batch are deferred")
        void defersSecondCriticalAction() {
            plan(false, ActionRequest.of("submit_form", Map.of()), ActionRequest.of("confirm_payment", Map.of()));

            var next = assertInstanceOf(Transition.Continue.class, node.apply(state, context));

            applied(state, next);
            assertEquals(List.of("submit_form"),
                    state.plannedBatch().actions().stream().map(ActionRequest::name).toList());
            Message last = state.history().get(state.history().size() - 1);
            assertEquals(MessageRole.FEEDBACK, last.role());
            assertTrue(last.content().contains("confirm_payment()"));
        }

        @Test
        @DisplayName("the ask-user action takes the validator path")
        void askUser() {
            plan(false, ActionRequest.of("request_user_confirmation",
                    Map.of("question", "Which size?", "option_y", "M", "option_n", "L")));

            var next = assertInstanceOf(Transition.Continue.class, node.apply(state, context));

            assertEquals(NodeIds.CRITICAL_ACTION_VALIDATOR, next.nextNode());
        }

        @Test
        @DisplayName("an empty plan counts as completion")
        void emptyPlan() {
            plan(false);

            var next = assertInstanceOf(Transition.Continue.class, node.apply(state, context));

            assertEquals(NodeIds.QUALITY_EVALUATOR, next.nextNode());
        }
    }

    @Test
    @DisplayName("a completion goes to the quality evaluator with the answer recorded")
    void completion() {
        when(engine.infer(anyList(), anyList())).thenReturn(new ReasoningResult.Completion("Example Domain"));

        var next = assertInstanceOf(Transition.Continue.class, node.apply(state, context));

        assertEquals(NodeIds.QUALITY_EVALUATOR, next.nextNode());
        applied(state, next);
        assertEquals("Example Domain", state.history().get(0).content());
    }

    @Test
    @DisplayName("input is guidance, task, summary, then history")
    @SuppressWarnings("unchecked")
    void buildsInput() {
        state.apply(StateUpdate.builder()
                .appendMessage(Message.feedback("earlier note"))
                .compactHistory(0, new SummaryContext("Summary of earlier progress:", 3, 1, 0))
                .build());
        when(engine.infer(anyList(), anyList())).thenReturn(new ReasoningResult.Completion("x"));

        node.apply(state, context);

        ArgumentCaptor<List<Message>> input = ArgumentCaptor.forClass(List.class);
        verify(engine).infer(input.capture(), anyList());
        List<MessageRole> roles = input.getValue().stream().map(Message::role).toList();
        assertEquals(List.of(MessageRole.SYSTEM, MessageRole.USER, MessageRole.FEEDBACK, MessageRole.FEEDBACK), roles);
        assertEquals("get the page title of example.com", input.getValue().get(1).content());
        assertEquals("Summary of earlier progress:", input.getValue().get(2).content());
    }

    @Test
    @DisplayName("oversized history routes to the memory manager without calling the engine")
    void routesToMemoryManager() {
        for (int i = 0; i < 20; i++) {
            state.apply(StateUpdate.builder().appendMessage(Message.user("note " + "x".repeat(100))).build());
        }

        var next = assertInstanceOf(Transition.Continue.class, node.apply(state, context));

        assertEquals(NodeIds.MEMORY_MANAGER, next.nextNode());
        verifyNoInteractions(engine);
    }

    @Nested
    @DisplayName("engine failures")
    class Failures {

        @Test
        @DisplayName("are retried through reasoning while under the bound")
        void retries() {
            when(engine.infer(anyList(), anyList())).thenThrow(new IllegalStateException("connection refused"));

            var next = assertInstanceOf(Transition.Continue.class, node.apply(state, context));

            assertEquals(NodeIds.REASONING, next.nextNode());
            applied(state, next);
            assertEquals(1, state.errorCount());
            assertEquals("connection refused", state.lastError().orElseThrow());
        }

        @Test
        @DisplayName("end the task once the bound is exceeded")
        void exhausts() {
            state.apply(StateUpdate.builder().errorCount(3).build());
            when(engine.infer(anyList(), anyList())).thenThrow(new IllegalStateException("connection refused"));

            var terminal = assertInstanceOf(Transition.Terminal.class, node.apply(state, context));

            assertEquals(Outcome.RETRY_EXHAUSTED_PREFIX + "network", terminal.outcome().reason());
        }
    }
}
