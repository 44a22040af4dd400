package com.eainde.patientqa.retrieval;

import com.eainde.patientqa.PatientQaException;

/** The retrieval index could not be queried. */
public class RetrievalException extends PatientQaException {

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
