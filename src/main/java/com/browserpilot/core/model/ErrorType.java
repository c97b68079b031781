package com.browserpilot.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Failure kinds a browser action can end with.
 * {@link #NONE} means the most recent batch ran clean.
 */
public enum ErrorType {
    NONE("none"),
    NETWORK("network"),
    ELEMENT_NOT_FOUND("element_not_found"),
    STALE_REF("stale_ref"),
    AUTH("auth"),
    RATE_LIMIT("rate_limit"),
    CAPTCHA("captcha"),
    UNKNOWN("unknown");

    private final String wireName;

    ErrorType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isError() {
        return this != NONE;
    }

    public static ErrorType fromWireName(String value) {
        if (value == null || value.isBlank()) return NONE;
        for (ErrorType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
