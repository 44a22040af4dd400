package com.eainde.patientqa.memory;

import com.eainde.patientqa.context.PatientContext;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable, ordered conversation history for one patient.
 *
 * <p>Immutable snapshot: {@link #append(Message)} returns a new session. The
 * message list is append-only and timestamps never decrease.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Session(
        @JsonProperty("id")             String id,
        @JsonProperty("createdAt")      Instant createdAt,
        @JsonProperty("patientContext") PatientContext patientContext,
        @JsonProperty("messages")       List<Message> messages
) {

    public Session {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static Session empty(String id, Instant now) {
        return new Session(id, now, null, List.of());
    }

    Session append(Message message) {
        List<Message> next = new ArrayList<>(messages.size() + 1);
        next.addAll(messages);
        next.add(message);
        return new Session(id, createdAt, patientContext, next);
    }

    Session withPatientContext(PatientContext context) {
        return new Session(id, createdAt, context, messages);
    }

    /** Most recent {@code n} messages, oldest first. */
    public List<Message> lastMessages(int n) {
        if (n <= 0) return List.of();
        int from = Math.max(0, messages.size() - n);
        return messages.subList(from, messages.size());
    }

    public Instant lastTimestamp() {
        return messages.isEmpty() ? null : messages.get(messages.size() - 1).timestamp();
    }
}
