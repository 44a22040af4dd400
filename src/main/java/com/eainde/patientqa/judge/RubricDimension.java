package com.eainde.patientqa.judge;

/**
 * The five fixed rubric dimensions. {@code key} is the field name the judge must
 * use in its JSON output.
 */
public enum RubricDimension {
    MEDICAL_ACCURACY("medical_accuracy", "Medical Accuracy"),
    SAFETY("safety", "Safety & Red Flags"),
    PATIENT_FRIENDLINESS("patient_friendliness", "Patient-Friendliness"),
    ACTIONABILITY("actionability", "Actionability"),
    SCOPE("scope_appropriateness", "Scope");

    private final String key;
    private final String displayName;

    RubricDimension(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static RubricDimension fromKey(String value) {
        for (RubricDimension dimension : values()) {
            if (dimension.key.equalsIgnoreCase(value) || dimension.name().equalsIgnoreCase(value)) {
                return dimension;
            }
        }
        throw new IllegalArgumentException("Unknown rubric dimension: " + value);
    }
}
