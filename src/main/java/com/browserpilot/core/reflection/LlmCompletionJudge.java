package com.browserpilot.core.reflection;

import com.browserpilot.core.llm.LlmService;
import com.browserpilot.core.llm.Transcripts;
import com.browserpilot.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the model to rate the answer and to check the goal against the transcript.
 * Any model failure falls back to the heuristic judge so completion is never blocked
 * by the judge itself.
 */
public class LlmCompletionJudge implements CompletionJudge {

    private static final Logger log = LoggerFactory.getLogger(LlmCompletionJudge.class);

    private static final String QUALITY_PROMPT = """
            You review the final answer of a browser automation agent.
            Rate it GOOD, ACCEPTABLE or NEEDS_IMPROVEMENT against the task.
            GOOD: answers the task completely and is backed by the browser results.
            ACCEPTABLE: answers the task with minor gaps.
            NEEDS_IMPROVEMENT: misses the point, is unsupported, or is empty.
            Give short, actionable feedback.
            """;

    private static final String GOAL_PROMPT = """
            You decide whether a browser automation task is done.
            Use only the evidence in the transcript: results returned by browser actions.
            Tasks that ask for a change (click, submit, fill, delete) need a successful action
            that performed the change. Reply ACHIEVED, PARTIALLY_ACHIEVED or NOT_ACHIEVED,
            cite the evidence, and describe what is missing otherwise.
            """;

    record QualityAssessment(String rating, String feedback) {}

    record GoalAssessment(String status, String evidence, String gap) {}

    private final LlmService llm;
    private final CompletionJudge fallback;

    public LlmCompletionJudge(LlmService llm, CompletionJudge fallback) {
        this.llm = llm;
        this.fallback = fallback;
    }

    @Override
    public QualityVerdict assessQuality(TaskState state) {
        try {
            var result = llm.structuredCall(QUALITY_PROMPT, transcript(state), QualityAssessment.class);
            return new QualityVerdict(QualityRating.parse(result.rating()),
                    result.feedback() != null ? result.feedback() : "");
        } catch (RuntimeException e) {
            log.warn("LLM quality review failed, using heuristic: {}", e.getMessage());
            return fallback.assessQuality(state);
        }
    }

    @Override
    public GoalVerdict assessGoal(TaskState state) {
        try {
            var result = llm.structuredCall(GOAL_PROMPT, transcript(state), GoalAssessment.class);
            GoalStatus status = GoalStatus.parse(result.status());
            String evidence = result.evidence() != null && !result.evidence().isBlank()
                    ? result.evidence() : "Goal confirmed by reviewer";
            return new GoalVerdict(status, status == GoalStatus.ACHIEVED ? evidence : null,
                    result.gap() != null ? result.gap() : "The goal is not met yet.");
        } catch (RuntimeException e) {
            log.warn("LLM goal check failed, using heuristic: {}", e.getMessage());
            return fallback.assessGoal(state);
        }
    }

    private static String transcript(TaskState state) {
        return Transcripts.render(state.originalTask(), state.summaryContext().orElse(null), state.history());
    }
}
