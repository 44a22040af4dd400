package com.eainde.patientqa.redflag;

/**
 * Which side of a turn a rule is evaluated against.
 */
public enum RuleScope {
    /** Only the patient's own messages. */
    USER,
    /** Only the drafted answer. */
    ANSWER,
    BOTH;

    public boolean coversUser() {
        return this != ANSWER;
    }

    public boolean coversAnswer() {
        return this != USER;
    }
}
