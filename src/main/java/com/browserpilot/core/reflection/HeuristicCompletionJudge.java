package com.browserpilot.core.reflection;

import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.MessageRole;
import com.browserpilot.core.policy.ActionPolicy;
import com.browserpilot.core.state.TaskState;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Judges completion from history alone.
 * <p>
 * Quality is the share of the task's keywords that show up in the answer or in what
 * the browser returned. The goal counts as achieved when the answer is affirmative,
 * at least one action succeeded, and, for tasks that ask for a change on the page, a
 * state-changing action succeeded.
 */
public class HeuristicCompletionJudge implements CompletionJudge {

    private static final Pattern ACTION_TASK = Pattern.compile(
            "\\b(click|fill|submit|type|enter|select|check|press|delete|remove|cancel|confirm|send|post"
                    + "|upload|book|buy|order|purchase|add|log ?in|sign ?in)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern NEGATIVE_ANSWER = Pattern.compile(
            "\\b(unable to|could not|couldn't|cannot|can't|failed to|did not|didn't|was not able)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^a-z0-9.\\-]+");

    private static final Set<String> STOPWORDS = Set.of(
            "the", "and", "for", "with", "from", "that", "this", "get", "find", "what", "which",
            "into", "onto", "then", "please", "tell", "show", "give", "about", "its", "their",
            "there", "have", "has", "are", "was", "were", "will", "can", "you", "your", "our");

    private static final int EVIDENCE_WINDOW = 20;
    private static final int ANSWER_PREVIEW = 200;

    private final ActionPolicy policy;

    public HeuristicCompletionJudge(ActionPolicy policy) {
        this.policy = policy;
    }

    @Override
    public QualityVerdict assessQuality(TaskState state) {
        Optional<String> answer = finalAnswer(state.history());
        if (answer.isEmpty() || answer.get().isBlank()) {
            return new QualityVerdict(QualityRating.NEEDS_IMPROVEMENT, "No final answer was produced.");
        }

        Set<String> keywords = keywords(state.originalTask());
        if (keywords.isEmpty()) {
            return new QualityVerdict(QualityRating.GOOD, "Answer present.");
        }

        var evidence = new StringBuilder(answer.get().toLowerCase(Locale.ROOT)).append(' ');
        List<Message> history = state.history();
        for (Message m : history.subList(Math.max(0, history.size() - EVIDENCE_WINDOW), history.size())) {
            if (m.isSuccessfulToolResult()) {
                evidence.append(m.content().toLowerCase(Locale.ROOT)).append(' ');
            }
        }
        state.summaryContext().ifPresent(s -> evidence.append(s.summary().toLowerCase(Locale.ROOT)));

        var missing = new LinkedHashSet<String>();
        for (String keyword : keywords) {
            if (evidence.indexOf(keyword) < 0) {
                missing.add(keyword);
            }
        }
        double coverage = 1.0 - (double) missing.size() / keywords.size();

        if (coverage >= 0.5) {
            return new QualityVerdict(QualityRating.GOOD, "Answer covers the task.");
        }
        String feedback = "The answer does not address: " + String.join(", ", missing)
                + ". Revisit the task and answer it directly.";
        if (coverage >= 0.25) {
            return new QualityVerdict(QualityRating.ACCEPTABLE, feedback);
        }
        return new QualityVerdict(QualityRating.NEEDS_IMPROVEMENT, feedback);
    }

    @Override
    public GoalVerdict assessGoal(TaskState state) {
        List<Message> history = state.history();
        Optional<String> answer = finalAnswer(history);
        if (answer.isEmpty() || answer.get().isBlank()) {
            return new GoalVerdict(GoalStatus.NOT_ACHIEVED, null, "No final answer was produced.");
        }
        if (NEGATIVE_ANSWER.matcher(answer.get()).find()) {
            return new GoalVerdict(GoalStatus.NOT_ACHIEVED, null,
                    "The answer says the task was not completed. Find another way to complete it.");
        }

        long successes = history.stream().filter(Message::isSuccessfulToolResult).count()
                + state.summaryContext().map(s -> s.successfulActions()).orElse(0);
        if (successes == 0) {
            return new GoalVerdict(GoalStatus.NOT_ACHIEVED, null,
                    "No browser action succeeded. Use the browser to gather evidence before answering.");
        }

        if (isActionTask(state.originalTask())) {
            boolean changed = history.stream()
                    .anyMatch(m -> m.isSuccessfulToolResult() && policy.isMutating(m.actionName()));
            if (!changed) {
                return new GoalVerdict(GoalStatus.PARTIALLY_ACHIEVED, null,
                        "The task asks for a change on the page, but no state-changing action succeeded.");
            }
        }

        return new GoalVerdict(GoalStatus.ACHIEVED,
                successes + " successful action(s); answer: " + preview(answer.get()), null);
    }

    static boolean isActionTask(String task) {
        return ACTION_TASK.matcher(task).find();
    }

    static Set<String> keywords(String task) {
        var keywords = new LinkedHashSet<String>();
        for (String raw : TOKEN_SPLIT.split(task.toLowerCase(Locale.ROOT))) {
            String token = raw.replaceAll("^[.\\-]+|[.\\-]+$", "");
            if (token.length() >= 3 && !STOPWORDS.contains(token)) {
                keywords.add(token);
            }
        }
        return keywords;
    }

    /** The last assistant message, if it carries no action requests. */
    static Optional<String> finalAnswer(List<Message> history) {
        for (int i = history.size() - 1; i >= 0; i--) {
            Message m = history.get(i);
            if (m.role() == MessageRole.ASSISTANT) {
                return m.hasActionRequests() ? Optional.empty() : Optional.of(m.content());
            }
        }
        return Optional.empty();
    }

    private static String preview(String text) {
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= ANSWER_PREVIEW ? flat : flat.substring(0, ANSWER_PREVIEW - 3) + "...";
    }
}
