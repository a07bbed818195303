package com.medassist.source;

import com.medassist.model.RawPatientFacts;

/**
 * A provider of raw patient facts.
 */
public interface PatientFactSource {

    /**
     * Name used in provenance, degraded-source markers and logs.
     */
    String getName();

    /**
     * @throws com.medassist.exception.ProfileNotFoundException the source does not know the patient
     * @throws com.medassist.exception.SourceUnavailableException the source failed
     */
    RawPatientFacts fetchPatientFacts(String patientId);
}
