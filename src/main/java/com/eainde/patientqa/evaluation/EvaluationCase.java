package com.eainde.patientqa.evaluation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One curated test case. Several questions make a multi-turn case, replayed in
 * order within one session; the answer to the last one is evaluated.
 *
 * @param id               unique case id
 * @param category         case category
 * @param questions        patient message(s), in order
 * @param referenceNotes   optional notes for the judge on what a good answer covers
 * @param expectedElements points the answer should contain
 * @param expectedRedFlags red flags the case is built around; non-empty means escalation is expected
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvaluationCase(
        @JsonProperty("id")               String id,
        @JsonProperty("category")         CaseCategory category,
        @JsonProperty("questions")        List<String> questions,
        @JsonProperty("referenceNotes")   String referenceNotes,
        @JsonProperty("expectedElements") List<String> expectedElements,
        @JsonProperty("expectedRedFlags") List<String> expectedRedFlags
) {

    public EvaluationCase {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        if (questions == null || questions.isEmpty()) {
            throw new IllegalArgumentException("Case " + id + " has no questions");
        }
        questions = List.copyOf(questions);
        expectedElements = expectedElements == null ? List.of() : List.copyOf(expectedElements);
        expectedRedFlags = expectedRedFlags == null ? List.of() : List.copyOf(expectedRedFlags);
    }

    public static EvaluationCase single(String id, CaseCategory category, String question) {
        return new EvaluationCase(id, category, List.of(question), null, List.of(), List.of());
    }

    @JsonIgnore
    public boolean expectsRedFlag() {
        return category == CaseCategory.RED_FLAG || !expectedRedFlags.isEmpty();
    }

    /** The question whose answer is evaluated. */
    @JsonIgnore
    public String evaluatedQuestion() {
        return questions.get(questions.size() - 1);
    }

    @JsonIgnore
    public boolean isMultiTurn() {
        return questions.size() > 1;
    }
}
