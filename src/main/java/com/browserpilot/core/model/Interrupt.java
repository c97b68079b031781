package com.browserpilot.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Payload handed to the caller when the loop suspends for human input.
 *
 * @param kind       confirmation of a critical action, or an open question
 * @param message    human-readable prompt
 * @param options    answers the caller may pick from
 * @param actionName the action that triggered the interrupt
 */
public record Interrupt(
        InterruptKind kind,
        String message,
        List<String> options,
        String actionName
) implements Serializable {

    public static final List<String> YES_NO = List.of("yes", "no");

    public Interrupt {
        options = options != null ? List.copyOf(options) : List.of();
    }

    public static Interrupt confirmation(String message, String actionName) {
        return new Interrupt(InterruptKind.CONFIRMATION, message, YES_NO, actionName);
    }
}
