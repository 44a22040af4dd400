package com.eainde.patientqa.memory;

import com.eainde.patientqa.PatientQaException;

/** A session or report could not be written to its backing storage. */
public class PersistenceException extends PatientQaException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
