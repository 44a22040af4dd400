package com.eainde.patientqa.memory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable repository for evaluation runs and tests.
 */
public class InMemorySessionRepository implements SessionRepository {

    private final Map<String, Session> storage = new ConcurrentHashMap<>();

    @Override
    public Optional<Session> load(String sessionId) {
        return Optional.ofNullable(storage.get(sessionId));
    }

    @Override
    public void save(Session session) {
        storage.put(session.id(), session);
    }

    public int size() {
        return storage.size();
    }
}
