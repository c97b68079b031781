package com.browserpilot.core.model;

import java.io.Serializable;

/**
 * An action the tool server publishes. {@code inputSchema} is the raw JSON schema, when known.
 */
public record ActionSpec(String name, String description, String inputSchema) implements Serializable {

    public ActionSpec(String name, String description) {
        this(name, description, null);
    }
}
