package com.eainde.patientqa.context;

import java.util.Optional;

/** Used when no patient-record system is configured. */
public class NoPatientContextService implements PatientContextService {

    @Override
    public Optional<PatientContext> lookup(String userId) {
        return Optional.empty();
    }
}
