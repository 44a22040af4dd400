package com.eainde.patientqa.config;

import com.eainde.patientqa.PatientQaException;

/**
 * Missing or invalid setup (index, credentials, rule files, thresholds).
 * Fatal at startup, never raised mid-run.
 */
public class ConfigurationException extends PatientQaException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
