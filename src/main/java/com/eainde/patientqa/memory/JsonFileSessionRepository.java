package com.eainde.patientqa.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HexFormat;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Stores one JSON document per session under a directory.
 *
 * <p>Writes go to a temp file that is then moved over the target, so a crash
 * mid-write leaves the previous version intact. A file that cannot be parsed is
 * renamed to {@code *.corrupt-<millis>} and reported as absent; the caller
 * then starts a fresh session.</p>
 */
public class JsonFileSessionRepository implements SessionRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSessionRepository.class);

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]{1,120}");

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonFileSessionRepository(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<Session> load(String sessionId) {
        Path file = fileFor(sessionId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            Session session = objectMapper.readValue(json, Session.class);
            if (session.id() == null || !session.id().equals(sessionId)) {
                throw new IOException("Session id mismatch in " + file.getFileName());
            }
            return Optional.of(session);
        } catch (IOException | RuntimeException e) {
            log.warn("Session file {} is unreadable, starting a fresh session: {}", file, e.getMessage());
            quarantine(file);
            return Optional.empty();
        }
    }

    @Override
    public void save(Session session) {
        Path file = fileFor(session.id());
        try {
            Files.createDirectories(directory);
            String json = objectMapper.writeValueAsString(session);
            Path tmp = Files.createTempFile(directory, ".session-", ".tmp");
            try {
                Files.writeString(tmp, json, StandardCharsets.UTF_8);
                moveIntoPlace(tmp, file);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize session " + session.id(), e);
        } catch (IOException e) {
            throw new PersistenceException("Failed to write session " + session.id() + " to " + file, e);
        }
    }

    Path fileFor(String sessionId) {
        String name = SAFE_ID.matcher(sessionId).matches()
                ? sessionId
                : "x-" + HexFormat.of().formatHex(sessionId.getBytes(StandardCharsets.UTF_8));
        return directory.resolve(name + ".json");
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void quarantine(Path file) {
        Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
        try {
            Files.move(file, aside);
            log.warn("Moved unreadable session file to {}", aside);
        } catch (IOException e) {
            log.error("Could not move unreadable session file {} aside", file, e);
        }
    }
}
