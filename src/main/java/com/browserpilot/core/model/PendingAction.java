package com.browserpilot.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An action held back for validation or human confirmation.
 */
public record PendingAction(String actionId, String name, Map<String, Object> args) implements Serializable {

    public PendingAction {
        args = args != null ? Collections.unmodifiableMap(new LinkedHashMap<>(args)) : Map.of();
    }

    public static PendingAction of(ActionRequest request) {
        return new PendingAction(request.id(), request.name(), request.args());
    }

    public String describe() {
        return new ActionRequest(actionId, name, args).describe();
    }
}
