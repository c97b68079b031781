package com.browserpilot.core.engine;

/**
 * Thrown when resuming a session that is not suspended (unknown, finished, or never persisted).
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("No suspended session '" + sessionId + "'");
    }
}
