package com.browserpilot.core.state;

import com.browserpilot.core.model.ActionBatch;
import com.browserpilot.core.model.ErrorType;
import com.browserpilot.core.model.InteractionMode;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.PendingAction;
import com.browserpilot.core.model.SummaryContext;

import java.io.Serializable;
import java.util.List;

/**
 * Immutable, serializable copy of a {@link TaskState}.
 */
public record TaskSnapshot(
        String sessionId,
        String originalTask,
        boolean complexTask,
        InteractionMode interactionMode,
        List<Message> history,
        long step,
        PendingAction pendingAction,
        ActionBatch plannedBatch,
        boolean needsValidation,
        boolean validationPassed,
        boolean requiresHumanApproval,
        double progressScore,
        int errorCount,
        int stuckCounter,
        int strategyChanges,
        ErrorType errorType,
        String lastError,
        Double qualityScore,
        boolean goalAchieved,
        SummaryContext summaryContext,
        String lastNode
) implements Serializable {

    public TaskSnapshot {
        history = history != null ? List.copyOf(history) : List.of();
        errorType = errorType != null ? errorType : ErrorType.NONE;
    }
}
