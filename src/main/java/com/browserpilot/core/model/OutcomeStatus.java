package com.browserpilot.core.model;

public enum OutcomeStatus {
    SUCCESS,
    FAILURE
}
