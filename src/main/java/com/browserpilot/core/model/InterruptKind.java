package com.browserpilot.core.model;

public enum InterruptKind {
    CONFIRMATION,
    QUESTION
}
