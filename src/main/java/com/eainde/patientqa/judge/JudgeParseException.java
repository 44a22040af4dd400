package com.eainde.patientqa.judge;

import com.eainde.patientqa.PatientQaException;

/** The judging model's output does not match the rubric schema. */
public class JudgeParseException extends PatientQaException {

    public JudgeParseException(String message) {
        super(message);
    }

    public JudgeParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
