package com.browserpilot.core.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Keeps suspended sessions so they can be resumed, possibly by another process.
 */
public interface TaskStateStore {

    void save(String sessionId, SessionRecord record);

    Optional<SessionRecord> load(String sessionId);

    void delete(String sessionId);

    List<String> listSessionIds();
}
