package com.browserpilot.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A single browser action the reasoning step asked for.
 *
 * @param id   correlates the request with its {@link ToolResult}
 * @param name action name as published by the tool server
 * @param args action arguments
 */
public record ActionRequest(
        String id,
        String name,
        Map<String, Object> args
) implements Serializable {

    public ActionRequest {
        id = id != null ? id : newId();
        args = args != null ? Collections.unmodifiableMap(new LinkedHashMap<>(args)) : Map.of();
    }

    public static ActionRequest of(String name, Map<String, Object> args) {
        return new ActionRequest(newId(), name, args);
    }

    private static String newId() {
        return "call-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /** Renders {@code name(key=value, ...)} for prompts and confirmation messages. */
    public String describe() {
        if (args.isEmpty()) return name + "()";
        var sb = new StringBuilder(name).append('(');
        args.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> sb.append(e.getKey()).append('=').append(e.getValue()).append(", "));
        sb.setLength(sb.length() - 2);
        return sb.append(')').toString();
    }
}
