package com.browserpilot.core.reflection;

import com.browserpilot.core.config.AgentProperties;
import com.browserpilot.core.model.ActionRequest;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.SummaryContext;
import com.browserpilot.core.model.ToolResult;
import com.browserpilot.core.policy.ActionPolicy;
import com.browserpilot.core.state.StateUpdate;
import com.browserpilot.core.state.TaskState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HeuristicCompletionJudgeTest {

    private final HeuristicCompletionJudge judge = new HeuristicCompletionJudge(new ActionPolicy(new AgentProperties()));

    private static TaskState stateWith(String task, Message... messages) {
        var state = new TaskState("BP-2026-0001", task, false);
        state.apply(StateUpdate.builder().appendMessages(List.of(messages)).build());
        return state;
    }

    private static Message[] ran(String action, String result) {
        var request = ActionRequest.of(action, Map.of());
        return new Message[]{
                Message.assistant("running " + action, List.of(request)),
                Message.tool(ToolResult.ok(result).forRequest(request))
        };
    }

    private static Message[] concat(Message[] a, Message... b) {
        var all = new Message[a.length + b.length];
        System.arraycopy(a, 0, all, 0, a.length);
        System.arraycopy(b, 0, all, a.length, b.length);
        return all;
    }

    @Nested
    @DisplayName("quality")
    class Quality {

        @Test
        @DisplayName("an answer covering the task keywords is good")
        void good() {
            var state = stateWith("get the page title of example.com",
                    concat(ran("extract_title", "Example Domain"),
                            Message.assistant("The page title of example.com is 'Example Domain'.")));

            assertEquals(QualityRating.GOOD, judge.assessQuality(state).rating());
        }

        @Test
        @DisplayName("missing final answer needs improvement")
        void noAnswer() {
            var state = stateWith("get the page title", ran("extract_title", "Example Domain"));

            QualityVerdict verdict = judge.assessQuality(state);

            assertEquals(QualityRating.NEEDS_IMPROVEMENT, verdict.rating());
            assertEquals(0.5, verdict.score(), 1e-9);
        }

        @Test
        @DisplayName("an off-topic answer lists what it misses")
        void offTopic() {
            var state = stateWith("find the cheapest flight price from Boston to Denver",
                    Message.assistant("I looked around."));

            QualityVerdict verdict = judge.assessQuality(state);

            assertEquals(QualityRating.NEEDS_IMPROVEMENT, verdict.rating());
            assertTrue(verdict.feedback().contains("cheapest"));
        }
    }

    @Nested
    @DisplayName("goal")
    class Goal {

        @Test
        @DisplayName("information task with a successful action and an answer is achieved")
        void achieved() {
            var state = stateWith("get the page title of example.com",
                    concat(ran("extract_title", "Example Domain"), Message.assistant("Example Domain")));

            GoalVerdict verdict = judge.assessGoal(state);

            assertTrue(verdict.achieved());
            assertTrue(verdict.evidence().startsWith("1 successful action(s)"));
        }

        @Test
        @DisplayName("no successful action means not achieved")
        void noSuccess() {
            var state = stateWith("get the page title", Message.assistant("Example Domain"));

            assertEquals(GoalStatus.NOT_ACHIEVED, judge.assessGoal(state).status());
        }

        @Test
        @DisplayName("successes carried in the running summary count")
        void summarySuccessesCount() {
            var state = stateWith("get the page title", Message.assistant("Example Domain"));
            state.apply(StateUpdate.builder()
                    .compactHistory(0, new SummaryContext("earlier", 4, 1, 2))
                    .build());

            assertTrue(judge.assessGoal(state).achieved());
        }

        @Test
        @DisplayName("an answer admitting failure is not achieved")
        void negativeAnswer() {
            var state = stateWith("get the page title",
                    concat(ran("navigate", "loaded"), Message.assistant("I was unable to read the title.")));

            assertEquals(GoalStatus.NOT_ACHIEVED, judge.assessGoal(state).status());
        }

        @Test
        @DisplayName("an action task without a state-changing success is only partial")
        void actionTaskNeedsMutation() {
            var state = stateWith("click the login button",
                    concat(ran("browser_snapshot", "page with login button"), Message.assistant("Done.")));

            assertEquals(GoalStatus.PARTIALLY_ACHIEVED, judge.assessGoal(state).status());
        }

        @Test
        @DisplayName("an action task with a successful click is achieved")
        void actionTaskWithClick() {
            var state = stateWith("click the login button",
                    concat(ran("browser_click", "clicked"), Message.assistant("Clicked the login button.")));

            assertTrue(judge.assessGoal(state).achieved());
        }
    }

    @Test
    @DisplayName("keywords skip stopwords and short tokens")
    void keywords() {
        assertEquals(List.of("page", "title", "example.com"),
                List.copyOf(HeuristicCompletionJudge.keywords("Get the page title of example.com")));
    }

    @Test
    @DisplayName("final answer is absent while the last assistant message requests actions")
    void finalAnswer() {
        assertTrue(HeuristicCompletionJudge.finalAnswer(List.of(ran("navigate", "ok"))).isEmpty());
        assertEquals("done", HeuristicCompletionJudge.finalAnswer(
                List.of(concat(ran("navigate", "ok"), Message.assistant("done")))).orElseThrow());
    }
}
