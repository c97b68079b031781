package com.browserpilot.core.state;

import com.browserpilot.core.model.ActionBatch;
import com.browserpilot.core.model.ErrorType;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.PendingAction;
import com.browserpilot.core.model.SummaryContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Delta a routing node returns for the control loop to apply.
 * <p>
 * Scalar fields are recorded only when set, so an update touches nothing it does
 * not name. A field set to {@code null} clears it. History changes are limited
 * to appends and a single prefix compaction, applied compaction first.
 */
public final class StateUpdate {

    enum Field {
        PENDING_ACTION,
        PLANNED_BATCH,
        NEEDS_VALIDATION,
        VALIDATION_PASSED,
        REQUIRES_HUMAN_APPROVAL,
        PROGRESS_SCORE,
        ERROR_COUNT,
        STUCK_COUNTER,
        STRATEGY_CHANGES,
        ERROR_TYPE,
        LAST_ERROR,
        QUALITY_SCORE,
        GOAL_ACHIEVED,
        SUMMARY_CONTEXT
    }

    private static final StateUpdate EMPTY = new StateUpdate(new EnumMap<>(Field.class), List.of(), 0);

    private final Map<Field, Object> fields;
    private final List<Message> appended;
    private final int compactedPrefix;

    private StateUpdate(Map<Field, Object> fields, List<Message> appended, int compactedPrefix) {
        this.fields = fields;
        this.appended = appended;
        this.compactedPrefix = compactedPrefix;
    }

    public static StateUpdate empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return fields.isEmpty() && appended.isEmpty() && compactedPrefix == 0;
    }

    public List<Message> appendedMessages() {
        return appended;
    }

    /** Number of leading history entries this update removes. */
    public int compactedPrefix() {
        return compactedPrefix;
    }

    Map<Field, Object> fields() {
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public String toString() {
        return "StateUpdate{fields=" + fields.keySet() + ", appended=" + appended.size()
                + ", compactedPrefix=" + compactedPrefix + "}";
    }

    public static final class Builder {

        private final EnumMap<Field, Object> fields = new EnumMap<>(Field.class);
        private final List<Message> appended = new ArrayList<>();
        private int compactedPrefix;

        private Builder() {
        }

        public Builder appendMessage(Message message) {
            appended.add(message);
            return this;
        }

        public Builder appendMessages(List<Message> messages) {
            appended.addAll(messages);
            return this;
        }

        /** Drops the first {@code removed} history entries and installs the new running summary. */
        public Builder compactHistory(int removed, SummaryContext summary) {
            if (removed < 0) {
                throw new IllegalArgumentException("removed must be >= 0, got " + removed);
            }
            this.compactedPrefix = removed;
            fields.put(Field.SUMMARY_CONTEXT, summary);
            return this;
        }

        public Builder pendingAction(PendingAction action) {
            fields.put(Field.PENDING_ACTION, action);
            return this;
        }

        public Builder clearPendingAction() {
            return pendingAction(null);
        }

        public Builder plannedBatch(ActionBatch batch) {
            fields.put(Field.PLANNED_BATCH, batch);
            return this;
        }

        public Builder clearPlannedBatch() {
            return plannedBatch(null);
        }

        public Builder needsValidation(boolean value) {
            fields.put(Field.NEEDS_VALIDATION, value);
            return this;
        }

        public Builder validationPassed(boolean value) {
            fields.put(Field.VALIDATION_PASSED, value);
            return this;
        }

        public Builder requiresHumanApproval(boolean value) {
            fields.put(Field.REQUIRES_HUMAN_APPROVAL, value);
            return this;
        }

        /** Clears the validator/confirmation flags together with the pending action. */
        public Builder resetValidation() {
            return clearPendingAction()
                    .needsValidation(false)
                    .validationPassed(false)
                    .requiresHumanApproval(false);
        }

        public Builder progressScore(double value) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException("progress score must be within [0,1], got " + value);
            }
            fields.put(Field.PROGRESS_SCORE, value);
            return this;
        }

        public Builder errorCount(int value) {
            fields.put(Field.ERROR_COUNT, requireNonNegative("errorCount", value));
            return this;
        }

        public Builder stuckCounter(int value) {
            fields.put(Field.STUCK_COUNTER, requireNonNegative("stuckCounter", value));
            return this;
        }

        public Builder strategyChanges(int value) {
            fields.put(Field.STRATEGY_CHANGES, requireNonNegative("strategyChanges", value));
            return this;
        }

        public Builder errorType(ErrorType type) {
            fields.put(Field.ERROR_TYPE, type != null ? type : ErrorType.NONE);
            return this;
        }

        public Builder lastError(String text) {
            fields.put(Field.LAST_ERROR, text);
            return this;
        }

        public Builder qualityScore(double score) {
            fields.put(Field.QUALITY_SCORE, score);
            return this;
        }

        public Builder goalAchieved(boolean value) {
            fields.put(Field.GOAL_ACHIEVED, value);
            return this;
        }

        public StateUpdate build() {
            if (fields.isEmpty() && appended.isEmpty() && compactedPrefix == 0) {
                return EMPTY;
            }
            return new StateUpdate(new EnumMap<>(fields), List.copyOf(appended), compactedPrefix);
        }

        private static int requireNonNegative(String name, int value) {
            if (value < 0) {
                throw new IllegalArgumentException(name + " must be >= 0, got " + value);
            }
            return value;
        }
    }
}
