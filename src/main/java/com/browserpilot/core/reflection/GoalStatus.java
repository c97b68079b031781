package com.browserpilot.core.reflection;

public enum GoalStatus {
    ACHIEVED,
    PARTIALLY_ACHIEVED,
    NOT_ACHIEVED;

    public static GoalStatus parse(String value) {
        if (value == null) return NOT_ACHIEVED;
        String normalized = value.trim().toUpperCase().replace(' ', '_').replace('-', '_');
        for (GoalStatus status : values()) {
            if (status.name().equals(normalized)) return status;
        }
        return NOT_ACHIEVED;
    }
}
