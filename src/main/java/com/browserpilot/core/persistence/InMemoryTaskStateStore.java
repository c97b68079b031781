package com.browserpilot.core.persistence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Sessions are lost when the JVM exits.
 */
public class InMemoryTaskStateStore implements TaskStateStore {

    private final ConcurrentHashMap<String, SessionRecord> sessions = new ConcurrentHashMap<>();

    @Override
    public void save(String sessionId, SessionRecord record) {
        sessions.put(sessionId, record);
    }

    @Override
    public Optional<SessionRecord> load(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public void delete(String sessionId) {
        sessions.remove(sessionId);
    }

    @Override
    public List<String> listSessionIds() {
        var ids = new ArrayList<>(sessions.keySet());
        Collections.sort(ids);
        return ids;
    }
}
