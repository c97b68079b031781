package com.browserpilot.core.state;

import com.browserpilot.core.model.ActionBatch;
import com.browserpilot.core.model.ErrorType;
import com.browserpilot.core.model.InteractionMode;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.PendingAction;
import com.browserpilot.core.model.SummaryContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable record threaded through every routing node of a task.
 * <p>
 * Owned by the control loop: nodes read it and return a {@link StateUpdate}, the
 * loop calls {@link #apply(StateUpdate)} and {@link #advanceStep()}. History is
 * append-only apart from prefix compaction, so retained entries never change order.
 */
public class TaskState {

    private final String sessionId;
    private final String originalTask;
    private final boolean complexTask;
    private final InteractionMode interactionMode;
    private final List<Message> history;

    private long step;
    private PendingAction pendingAction;
    private ActionBatch plannedBatch;
    private boolean needsValidation;
    private boolean validationPassed;
    private boolean requiresHumanApproval;
    private double progressScore;
    private int errorCount;
    private int stuckCounter;
    private int strategyChanges;
    private ErrorType errorType = ErrorType.NONE;
    private String lastError;
    private Double qualityScore;
    private boolean goalAchieved;
    private SummaryContext summaryContext;
    private String lastNode;

    public TaskState(String sessionId, String originalTask, boolean complexTask) {
        this(sessionId, originalTask, complexTask, InteractionMode.CONFIRM_CRITICAL);
    }

    public TaskState(String sessionId, String originalTask, boolean complexTask, InteractionMode interactionMode) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.originalTask = Objects.requireNonNull(originalTask, "originalTask");
        this.complexTask = complexTask;
        this.interactionMode = interactionMode != null ? interactionMode : InteractionMode.CONFIRM_CRITICAL;
        this.history = new ArrayList<>();
    }

    // ── Accessors ────────────────────────────────────────────────────

    public String sessionId() { return sessionId; }
    public String originalTask() { return originalTask; }
    public boolean complexTask() { return complexTask; }
    public InteractionMode interactionMode() { return interactionMode; }
    public List<Message> history() { return Collections.unmodifiableList(history); }
    public long step() { return step; }
    public Optional<PendingAction> pendingAction() { return Optional.ofNullable(pendingAction); }
    public boolean needsValidation() { return needsValidation; }
    public boolean validationPassed() { return validationPassed; }
    public boolean requiresHumanApproval() { return requiresHumanApproval; }
    public double progressScore() { return progressScore; }
    public int errorCount() { return errorCount; }
    public int stuckCounter() { return stuckCounter; }
    public int strategyChanges() { return strategyChanges; }
    public ErrorType errorType() { return errorType; }
    public Optional<String> lastError() { return Optional.ofNullable(lastError); }
    public Optional<Double> qualityScore() { return Optional.ofNullable(qualityScore); }
    public boolean goalAchieved() { return goalAchieved; }
    public Optional<SummaryContext> summaryContext() { return Optional.ofNullable(summaryContext); }
    public Optional<String> lastNode() { return Optional.ofNullable(lastNode); }

    public ActionBatch plannedBatch() {
        return plannedBatch != null ? plannedBatch : new ActionBatch(List.of(), false);
    }

    // ── Mutation (control loop only) ─────────────────────────────────

    /**
     * Applies a node's delta. Compaction is applied before appends so new messages
     * always land after the retained suffix.
     */
    public void apply(StateUpdate update) {
        if (update.compactedPrefix() > 0) {
            if (update.compactedPrefix() > history.size()) {
                throw new IllegalStateException("Cannot compact " + update.compactedPrefix()
                        + " messages from a history of " + history.size());
            }
            history.subList(0, update.compactedPrefix()).clear();
        }
        history.addAll(update.appendedMessages());

        for (var entry : update.fields().entrySet()) {
            Object value = entry.getValue();
            switch (entry.getKey()) {
                case PENDING_ACTION -> pendingAction = (PendingAction) value;
                case PLANNED_BATCH -> plannedBatch = (ActionBatch) value;
                case NEEDS_VALIDATION -> needsValidation = (Boolean) value;
                case VALIDATION_PASSED -> validationPassed = (Boolean) value;
                case REQUIRES_HUMAN_APPROVAL -> requiresHumanApproval = (Boolean) value;
                case PROGRESS_SCORE -> progressScore = (Double) value;
                case ERROR_COUNT -> errorCount = (Integer) value;
                case STUCK_COUNTER -> stuckCounter = (Integer) value;
                case STRATEGY_CHANGES -> strategyChanges = (Integer) value;
                case ERROR_TYPE -> errorType = (ErrorType) value;
                case LAST_ERROR -> lastError = (String) value;
                case QUALITY_SCORE -> qualityScore = (Double) value;
                case GOAL_ACHIEVED -> goalAchieved = (Boolean) value;
                case SUMMARY_CONTEXT -> summaryContext = (SummaryContext) value;
            }
        }
    }

    public void advanceStep() {
        step++;
    }

    public void markNode(String nodeId) {
        this.lastNode = nodeId;
    }

    // ── Snapshot ─────────────────────────────────────────────────────

    public TaskSnapshot snapshot() {
        return new TaskSnapshot(sessionId, originalTask, complexTask, interactionMode, List.copyOf(history), step,
                pendingAction, plannedBatch, needsValidation, validationPassed, requiresHumanApproval,
                progressScore, errorCount, stuckCounter, strategyChanges, errorType, lastError,
                qualityScore, goalAchieved, summaryContext, lastNode);
    }

    public static TaskState restore(TaskSnapshot snapshot) {
        var state = new TaskState(snapshot.sessionId(), snapshot.originalTask(), snapshot.complexTask(),
                snapshot.interactionMode());
        state.history.addAll(snapshot.history());
        state.step = snapshot.step();
        state.pendingAction = snapshot.pendingAction();
        state.plannedBatch = snapshot.plannedBatch();
        state.needsValidation = snapshot.needsValidation();
        state.validationPassed = snapshot.validationPassed();
        state.requiresHumanApproval = snapshot.requiresHumanApproval();
        state.progressScore = snapshot.progressScore();
        state.errorCount = snapshot.errorCount();
        state.stuckCounter = snapshot.stuckCounter();
        state.strategyChanges = snapshot.strategyChanges();
        state.errorType = snapshot.errorType();
        state.lastError = snapshot.lastError();
        state.qualityScore = snapshot.qualityScore();
        state.goalAchieved = snapshot.goalAchieved();
        state.summaryContext = snapshot.summaryContext();
        state.lastNode = snapshot.lastNode();
        return state;
    }

    @Override
    public String toString() {
        return "TaskState{sessionId=" + sessionId + ", step=" + step + ", history=" + history.size()
                + ", errorType=" + errorType + ", errorCount=" + errorCount + ", stuck=" + stuckCounter + "}";
    }
}
