package com.medassist.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Uncanonicalised facts as one source reported them. Any field may be absent;
 * {@link com.medassist.service.ProfileAssembler} merges several of these.
 */
@Value
@Builder
public class RawPatientFacts {

    String sourceName;
    String patientId;
    Integer age;
    String sex;
    Double heightCm;
    Double weightKg;

    Double systolic;
    Double diastolic;
    Integer heartRate;
    Instant vitalsMeasuredAt;

    Double fastingGlucose;
    Double postprandialGlucose;
    Double hba1c;
    Instant labsMeasuredAt;

    @Builder.Default
    List<String> diagnoses = List.of();

    @Builder.Default
    List<Medication> medications = List.of();

    @Builder.Default
    List<String> riskFactors = List.of();

    @Builder.Default
    List<String> targetOrganDamage = List.of();

    @Builder.Default
    List<String> clinicalConditions = List.of();

    @Builder.Default
    List<String> symptoms = List.of();

    @Builder.Default
    List<String> complications = List.of();

    Boolean pregnant;
    Boolean neurologicSymptoms;
    Boolean onInsulin;
    Boolean frequentHypoglycemia;

    @Builder.Default
    List<EvidenceRef> provenance = List.of();
}
