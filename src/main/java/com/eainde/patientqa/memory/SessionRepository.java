package com.eainde.patientqa.memory;

import java.util.Optional;

/**
 * Key-value persistence for sessions. Write-then-read must round-trip exactly.
 */
public interface SessionRepository {

    /**
     * @return the stored session, or empty when absent or unreadable
     */
    Optional<Session> load(String sessionId);

    /**
     * @throws PersistenceException when the session cannot be written
     */
    void save(Session session);
}
