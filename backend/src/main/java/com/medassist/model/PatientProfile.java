package com.medassist.model;

import lombok.Builder;
import lombok.Value;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Structured patient profile for one reasoning pass. Built by
 * {@link com.medassist.service.ProfileAssembler}; term sets hold canonical terms only.
 */
@Value
@Builder(toBuilder = true)
public class PatientProfile {

    String patientId;
    Integer age;

    @Builder.Default
    Sex sex = Sex.UNKNOWN;

    Double heightCm;
    Double weightKg;
    Double bmi;

    @Builder.Default
    Set<String> diagnoses = Set.of();

    @Builder.Default
    List<Medication> medications = List.of();

    @Builder.Default
    Vitals vitals = Vitals.none();

    @Builder.Default
    Labs labs = Labs.none();

    @Builder.Default
    ProfileFlags flags = ProfileFlags.none();

    @Builder.Default
    Set<String> riskFactors = Set.of();

    @Builder.Default
    Set<String> targetOrganDamage = Set.of();

    @Builder.Default
    Set<String> clinicalConditions = Set.of();

    @Builder.Default
    Set<String> diabetesComplications = Set.of();

    @Builder.Default
    List<EvidenceRef> provenance = List.of();

    @Builder.Default
    List<String> sources = List.of();

    public boolean hasDiagnosis(String canonicalTerm) {
        return diagnoses.contains(canonicalTerm);
    }

    public boolean isPregnant() {
        return flags.pregnant();
    }

    public Set<DrugClass> currentDrugClasses() {
        EnumSet<DrugClass> classes = EnumSet.noneOf(DrugClass.class);
        medications.forEach(m -> {
            if (m.drugClass() != null) {
                classes.add(m.drugClass());
            }
        });
        return classes;
    }
}
