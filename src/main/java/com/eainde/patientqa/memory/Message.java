package com.eainde.patientqa.memory;

import com.eainde.patientqa.redflag.RedFlagMatch;
import com.eainde.patientqa.redflag.Severity;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a conversation. Immutable once appended to a session.
 *
 * @param role           who produced the text
 * @param text           message body as shown to the patient
 * @param timestamp      append time, monotonic within a session
 * @param redFlag        whether a red flag was raised on this turn
 * @param severity       severity of the winning red-flag rule, null if none
 * @param redFlagRuleId  id of the winning red-flag rule, null if none
 * @param escalationText escalation notice included in the answer, null if none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        @JsonProperty("role")           Role role,
        @JsonProperty("text")           String text,
        @JsonProperty("timestamp")      Instant timestamp,
        @JsonProperty("redFlag")        boolean redFlag,
        @JsonProperty("severity")       Severity severity,
        @JsonProperty("redFlagRuleId")  String redFlagRuleId,
        @JsonProperty("escalationText") String escalationText
) {

    public Message {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(text, "text");
    }

    public static Message user(String text) {
        return new Message(Role.USER, text, null, false, null, null, null);
    }

    public static Message assistant(String text) {
        return new Message(Role.ASSISTANT, text, null, false, null, null, null);
    }

    public static Message systemNote(String text) {
        return new Message(Role.SYSTEM_NOTE, text, null, false, null, null, null);
    }

    public Message flagged(RedFlagMatch match) {
        return new Message(role, text, timestamp, true, match.severity(), match.ruleId(), escalationText);
    }

    public Message withEscalation(String escalation) {
        return new Message(role, text, timestamp, redFlag, severity, redFlagRuleId, escalation);
    }

    Message stampedAt(Instant at) {
        return new Message(role, text, at, redFlag, severity, redFlagRuleId, escalationText);
    }

    @JsonIgnore
    public boolean isFromUser() {
        return role == Role.USER;
    }
}
