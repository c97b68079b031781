package com.browserpilot.core.model;

/**
 * Controls when critical actions pause for the user.
 */
public enum InteractionMode {
    /** Critical actions run without confirmation. */
    FULL_AUTO,
    /** Critical actions wait for a yes/no from the user. */
    CONFIRM_CRITICAL
}
