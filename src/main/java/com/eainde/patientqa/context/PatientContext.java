package com.eainde.patientqa.context;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Snapshot of what is known about the patient, e.g. pregnancy, age, relevant history.
 *
 * @param patientId  external patient id
 * @param attributes free-form facts, rendered in key order
 */
public record PatientContext(
        @JsonProperty("patientId")  String patientId,
        @JsonProperty("attributes") Map<String, String> attributes
) {

    public PatientContext {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    /** Stable, human-readable rendering used in prompts. */
    public String render() {
        return new TreeMap<>(attributes).entrySet().stream()
                .map(e -> "- " + e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
    }
}
