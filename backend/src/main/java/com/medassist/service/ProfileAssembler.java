package com.medassist.service;

import com.medassist.exception.InvalidProfileException;
import com.medassist.exception.ProfileNotFoundException;
import com.medassist.model.DrugClass;
import com.medassist.model.EvidenceRef;
import com.medassist.model.Labs;
import com.medassist.model.Medication;
import com.medassist.model.PatientProfile;
import com.medassist.model.ProfileFlags;
import com.medassist.model.RawPatientFacts;
import com.medassist.model.Sex;
import com.medassist.model.Vitals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Profile Assembler
 *
 * Merges the raw facts reported by one or more sources into a single
 * immutable {@link PatientProfile}:
 * - demographics: first source (in the given order) that reports a value
 * - vitals and labs: the most recent measurement set, first source on ties
 * - term sets: union, canonicalised through the term dictionary
 * - medications: de-duplicated by name and class, newest start date first
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProfileAssembler {

    private static final Comparator<Medication> NEWEST_FIRST = Comparator
        .comparing(Medication::startDate, Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
        .thenComparing(m -> m.name().toLowerCase(Locale.ROOT));

    private final TermNormalizer termNormalizer;

    public PatientProfile assemble(String patientId, List<RawPatientFacts> sources) {
        if (sources == null || sources.isEmpty()) {
            throw new ProfileNotFoundException(patientId);
        }

        Integer age = first(sources, RawPatientFacts::getAge);
        if (age != null && age < 0) {
            throw new InvalidProfileException("Age must not be negative: " + age);
        }
        Double heightCm = first(sources, RawPatientFacts::getHeightCm);
        Double weightKg = first(sources, RawPatientFacts::getWeightKg);
        if ((heightCm != null && heightCm <= 0) || (weightKg != null && weightKg <= 0)) {
            throw new InvalidProfileException("Height and weight must be positive");
        }

        Set<String> diagnoses = canonicalSet(sources, RawPatientFacts::getDiagnoses);
        Set<String> clinicalConditions = canonicalSet(sources, RawPatientFacts::getClinicalConditions);
        Set<String> complications = canonicalSet(sources, RawPatientFacts::getComplications);
        Set<String> symptoms = canonicalSet(sources, RawPatientFacts::getSymptoms);
        diagnoses.stream().filter(ClinicalVocabulary.DIABETES_COMPLICATIONS::contains).forEach(complications::add);

        List<Medication> medications = mergeMedications(sources);

        ProfileFlags flags = new ProfileFlags(
            anyTrue(sources, RawPatientFacts::getPregnant)
                || diagnoses.contains(ClinicalVocabulary.PREGNANCY)
                || clinicalConditions.contains(ClinicalVocabulary.PREGNANCY),
            anyTrue(sources, RawPatientFacts::getOnInsulin)
                || medications.stream().anyMatch(m -> m.insulin() || m.drugClass() == DrugClass.INSULIN),
            anyTrue(sources, RawPatientFacts::getNeurologicSymptoms)
                || symptoms.stream().anyMatch(ClinicalVocabulary.NEUROLOGIC_SYMPTOMS::contains),
            anyTrue(sources, RawPatientFacts::getFrequentHypoglycemia)
                || complications.contains(ClinicalVocabulary.FREQUENT_HYPOGLYCEMIA)
                || clinicalConditions.contains(ClinicalVocabulary.FREQUENT_HYPOGLYCEMIA)
        );
        complications.remove(ClinicalVocabulary.FREQUENT_HYPOGLYCEMIA);

        List<EvidenceRef> provenance = new ArrayList<>();
        List<String> sourceNames = new ArrayList<>();
        for (RawPatientFacts facts : sources) {
            provenance.addAll(facts.getProvenance());
            if (facts.getSourceName() != null && !sourceNames.contains(facts.getSourceName())) {
                sourceNames.add(facts.getSourceName());
            }
        }

        PatientProfile profile = PatientProfile.builder()
            .patientId(patientId)
            .age(age)
            .sex(Sex.fromText(first(sources, RawPatientFacts::getSex)))
            .heightCm(heightCm)
            .weightKg(weightKg)
            .bmi(bmi(heightCm, weightKg))
            .diagnoses(Collections.unmodifiableSet(diagnoses))
            .medications(List.copyOf(medications))
            .vitals(latestVitals(sources))
            .labs(latestLabs(sources))
            .flags(flags)
            .riskFactors(Collections.unmodifiableSet(canonicalSet(sources, RawPatientFacts::getRiskFactors)))
            .targetOrganDamage(Collections.unmodifiableSet(canonicalSet(sources, RawPatientFacts::getTargetOrganDamage)))
            .clinicalConditions(Collections.unmodifiableSet(clinicalConditions))
            .diabetesComplications(Collections.unmodifiableSet(complications))
            .provenance(List.copyOf(provenance))
            .sources(List.copyOf(sourceNames))
            .build();

        log.debug("Assembled profile {} from {}: {} diagnoses, {} medications",
            patientId, sourceNames, profile.getDiagnoses().size(), profile.getMedications().size());
        return profile;
    }

    public PatientProfile assemble(RawPatientFacts facts) {
        return assemble(facts.getPatientId(), List.of(facts));
    }

    /**
     * weight / (height in metres)², one decimal.
     */
    static Double bmi(Double heightCm, Double weightKg) {
        if (heightCm == null || weightKg == null) {
            return null;
        }
        double metres = heightCm / 100.0;
        return Math.round(weightKg / (metres * metres) * 10.0) / 10.0;
    }

    private Set<String> canonicalSet(List<RawPatientFacts> sources, Function<RawPatientFacts, List<String>> getter) {
        Set<String> terms = new TreeSet<>();
        for (RawPatientFacts facts : sources) {
            List<String> values = getter.apply(facts);
            if (values == null) {
                continue;
            }
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    terms.add(termNormalizer.canonicalize(value));
                }
            }
        }
        return terms;
    }

    private static List<Medication> mergeMedications(List<RawPatientFacts> sources) {
        Map<String, Medication> byKey = new LinkedHashMap<>();
        for (RawPatientFacts facts : sources) {
            for (Medication medication : facts.getMedications()) {
                String key = medication.name().toLowerCase(Locale.ROOT).trim() + "|" + medication.drugClass();
                byKey.putIfAbsent(key, medication);
            }
        }
        List<Medication> merged = new ArrayList<>(byKey.values());
        merged.sort(NEWEST_FIRST);
        return merged;
    }

    private static Vitals latestVitals(List<RawPatientFacts> sources) {
        RawPatientFacts best = latest(sources,
            f -> f.getSystolic() != null || f.getDiastolic() != null || f.getHeartRate() != null,
            RawPatientFacts::getVitalsMeasuredAt);
        if (best == null) {
            return Vitals.none();
        }
        return new Vitals(best.getSystolic(), best.getDiastolic(), best.getHeartRate(), best.getVitalsMeasuredAt());
    }

    private static Labs latestLabs(List<RawPatientFacts> sources) {
        RawPatientFacts best = latest(sources,
            f -> f.getFastingGlucose() != null || f.getPostprandialGlucose() != null || f.getHba1c() != null,
            RawPatientFacts::getLabsMeasuredAt);
        if (best == null) {
            return Labs.none();
        }
        return new Labs(best.getFastingGlucose(), best.getPostprandialGlucose(), best.getHba1c(), best.getLabsMeasuredAt());
    }

    // Undated measurements rank below dated ones
    private static RawPatientFacts latest(List<RawPatientFacts> sources,
                                          Predicate<RawPatientFacts> hasValues,
                                          Function<RawPatientFacts, Instant> measuredAt) {
        RawPatientFacts best = null;
        for (RawPatientFacts facts : sources) {
            if (!hasValues.test(facts)) {
                continue;
            }
            if (best == null) {
                best = facts;
                continue;
            }
            Instant candidate = measuredAt.apply(facts);
            Instant current = measuredAt.apply(best);
            if (candidate != null && (current == null || candidate.isAfter(current))) {
                best = facts;
            }
        }
        return best;
    }

    private static <T> T first(Collection<RawPatientFacts> sources, Function<RawPatientFacts, T> getter) {
        return sources.stream().map(getter).filter(Objects::nonNull).findFirst().orElse(null);
    }

    private static boolean anyTrue(Collection<RawPatientFacts> sources, Function<RawPatientFacts, Boolean> getter) {
        return sources.stream().map(getter).anyMatch(Boolean.TRUE::equals);
    }
}
