package com.eainde.patientqa.evaluation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CaseCategory {
    COMMON("common"),
    RED_FLAG("red-flag"),
    EDGE_CASE("edge-case"),
    EMOTIONAL_SUPPORT("emotional-support"),
    FOLLOW_UP("follow-up"),
    MYTH("myth"),
    PREGNANCY_SAFETY("pregnancy-safety");

    private final String label;

    CaseCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static CaseCategory fromLabel(String value) {
        for (CaseCategory category : values()) {
            if (category.label.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown case category: " + value);
    }
}
