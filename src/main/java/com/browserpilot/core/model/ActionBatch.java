package com.browserpilot.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Actions requested by one reasoning step.
 *
 * @param actions  requests in the order they were issued
 * @param parallel static hint from reasoning that the actions are independent
 */
public record ActionBatch(List<ActionRequest> actions, boolean parallel) implements Serializable {

    public ActionBatch {
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    public boolean isEmpty() {
        return actions.isEmpty();
    }

    public int size() {
        return actions.size();
    }
}
