package com.browserpilot.core.persistence;

/**
 * Thrown when a session cannot be written to or read from the store.
 */
public class TaskStateStoreException extends RuntimeException {

    public TaskStateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
