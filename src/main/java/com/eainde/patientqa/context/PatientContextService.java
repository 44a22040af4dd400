package com.eainde.patientqa.context;

import java.util.Optional;

/**
 * Optional external patient-record lookup. Implementations may be slow or down;
 * callers treat any failure as "no context".
 */
public interface PatientContextService {

    Optional<PatientContext> lookup(String userId);
}
