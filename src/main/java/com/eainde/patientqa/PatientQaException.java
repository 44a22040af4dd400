package com.eainde.patientqa;

/**
 * Root of the unchecked exception hierarchy used across the assistant.
 */
public class PatientQaException extends RuntimeException {

    public PatientQaException(String message) {
        super(message);
    }

    public PatientQaException(String message, Throwable cause) {
        super(message, cause);
    }
}
