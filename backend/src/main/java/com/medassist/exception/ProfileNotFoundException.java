package com.medassist.exception;

/**
 * The patient identifier could not be resolved by any fact source.
 */
public class ProfileNotFoundException extends RuntimeException {

    private final String patientId;

    public ProfileNotFoundException(String patientId) {
        super("Patient not found: " + patientId);
        this.patientId = patientId;
    }

    public String getPatientId() {
        return patientId;
    }
}
