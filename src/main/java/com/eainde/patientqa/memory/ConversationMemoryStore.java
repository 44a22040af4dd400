package com.eainde.patientqa.memory;

import com.eainde.patientqa.context.PatientContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-session message log with durable backing storage.
 *
 * <p>Appends to the same session id are serialized by a per-session lock, so
 * ordering follows arrival rather than wall-clock time. Timestamps are forced to
 * be strictly increasing within a session even if the clock steps backwards.
 * Different sessions never contend.</p>
 *
 * <p>Backing storage that is missing or corrupt yields a fresh empty session.
 * A failed write is reported as {@link PersistenceException} after the message
 * has been kept in memory, so the conversation can go on.</p>
 */
public class ConversationMemoryStore {

    private static final Logger log = LoggerFactory.getLogger(ConversationMemoryStore.class);

    private final SessionRepository repository;
    private final Clock clock;
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ConversationMemoryStore(SessionRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public ConversationMemoryStore(SessionRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Returns the session, creating an empty one if none exists.
     */
    public Session getSession(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            return current(sessionId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends a message and persists the session.
     *
     * @return the message as stored, with its timestamp assigned
     * @throws PersistenceException when the write fails; the message is still kept in memory
     */
    public Message append(String sessionId, Message message) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(message, "message");
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            Session session = current(sessionId);
            Message stamped = message.stampedAt(nextTimestamp(session.lastTimestamp()));
            Session updated = session.append(stamped);
            sessions.put(sessionId, updated);
            repository.save(updated);
            return stamped;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Most recent {@code n} messages, oldest first. Unknown sessions yield an empty list.
     */
    public List<Message> historyWindow(String sessionId, int n) {
        if (sessionId == null || n <= 0) {
            return List.of();
        }
        Session cached = sessions.get(sessionId);
        if (cached != null) {
            return cached.lastMessages(n);
        }
        return loadQuietly(sessionId)
                .map(s -> {
                    sessions.putIfAbsent(sessionId, s);
                    return s.lastMessages(n);
                })
                .orElse(List.of());
    }

    /**
     * Stores the patient-context snapshot on the session.
     */
    public void attachPatientContext(String sessionId, PatientContext context) {
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            Session updated = current(sessionId).withPatientContext(context);
            sessions.put(sessionId, updated);
            repository.save(updated);
        } finally {
            lock.unlock();
        }
    }

    public SessionSummary summarize(String sessionId) {
        Session session = getSession(sessionId);
        List<Message> messages = session.messages();
        int flagged = (int) messages.stream().filter(Message::redFlag).count();
        List<String> rules = messages.stream()
                .map(Message::redFlagRuleId)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        return new SessionSummary(
                sessionId,
                messages.size(),
                messages.isEmpty() ? null : messages.get(0).timestamp(),
                session.lastTimestamp(),
                flagged,
                rules);
    }

    private Session current(String sessionId) {
        Session cached = sessions.get(sessionId);
        if (cached != null) {
            return cached;
        }
        Session session = loadQuietly(sessionId)
                .orElseGet(() -> {
                    log.debug("Creating new session {}", sessionId);
                    return Session.empty(sessionId, clock.instant());
                });
        sessions.put(sessionId, session);
        return session;
    }

    private Optional<Session> loadQuietly(String sessionId) {
        try {
            return repository.load(sessionId);
        } catch (RuntimeException e) {
            log.warn("Could not load session {}, continuing with a fresh one", sessionId, e);
            return Optional.empty();
        }
    }

    private Instant nextTimestamp(Instant last) {
        Instant now = clock.instant();
        if (last == null || now.isAfter(last)) {
            return now;
        }
        return last.plusNanos(1);
    }

    private ReentrantLock lockFor(String sessionId) {
        return locks.computeIfAbsent(sessionId, id -> new ReentrantLock());
    }
}
