package com.browserpilot.core.policy;

import com.browserpilot.core.config.AgentProperties;
import com.browserpilot.core.model.ActionRequest;
import com.browserpilot.core.model.InteractionMode;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which browser actions are irreversible enough to need a human's go-ahead.
 */
@Component
public class ActionPolicy {

    private final Set<String> criticalActions;
    private final String userQuestionAction;
    private final InteractionMode mode;
    private final List<String> mutatingFragments;

    @Autowired
    public ActionPolicy(AgentProperties properties) {
        this(properties.getPolicy().getCriticalActions(),
                properties.getPolicy().getUserQuestionAction(),
                properties.getPolicy().getInteractionMode(),
                properties.getPolicy().getMutatingActionFragments());
    }

    public ActionPolicy(Collection<String> criticalActions, String userQuestionAction,
                        InteractionMode mode, Collection<String> mutatingFragments) {
        this.criticalActions = criticalActions.stream()
                .map(a -> a.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.userQuestionAction = userQuestionAction;
        this.mode = mode != null ? mode : InteractionMode.CONFIRM_CRITICAL;
        this.mutatingFragments = mutatingFragments.stream()
                .map(f -> f.toLowerCase(Locale.ROOT))
                .toList();
    }

    public boolean isCritical(String actionName) {
        return actionName != null && criticalActions.contains(actionName.toLowerCase(Locale.ROOT));
    }

    public boolean isUserQuestion(String actionName) {
        return userQuestionAction != null && userQuestionAction.equalsIgnoreCase(actionName);
    }

    /** Critical actions and questions to the user both take the validator path. */
    public boolean requiresValidation(String actionName) {
        return isCritical(actionName) || isUserQuestion(actionName);
    }

    /**
     * Whether a pending action must wait for the user. Questions always do; critical
     * actions do unless the task runs fully automatic.
     */
    public boolean requiresHumanApproval(String actionName, InteractionMode taskMode) {
        if (isUserQuestion(actionName)) return true;
        return isCritical(actionName) && taskMode != InteractionMode.FULL_AUTO;
    }

    /** First request in the batch that needs the validator, if any. */
    public Optional<ActionRequest> firstRequiringValidation(List<ActionRequest> actions) {
        return actions.stream().filter(a -> requiresValidation(a.name())).findFirst();
    }

    /** Whether the action changes page state, as opposed to reading it. */
    public boolean isMutating(String actionName) {
        if (actionName == null) return false;
        if (isCritical(actionName)) return true;
        String lower = actionName.toLowerCase(Locale.ROOT);
        return mutatingFragments.stream().anyMatch(lower::contains);
    }

    public Set<String> criticalActions() {
        return criticalActions;
    }

    /** Mode applied to tasks that do not choose one. */
    public InteractionMode defaultMode() {
        return mode;
    }
}
