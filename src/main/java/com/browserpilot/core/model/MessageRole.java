package com.browserpilot.core.model;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT,
    TOOL,
    /** Loop-generated guidance: rejections, corrections, quality gaps, strategy proposals. */
    FEEDBACK
}
