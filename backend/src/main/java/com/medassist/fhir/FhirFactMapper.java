package com.medassist.fhir;

import com.medassist.model.DrugClass;
import com.medassist.model.EvidenceKind;
import com.medassist.model.EvidenceRef;
import com.medassist.model.Medication;
import com.medassist.model.RawPatientFacts;
import com.medassist.service.ClinicalVocabulary;
import com.medassist.service.TermNormalizer;
import lombok.RequiredArgsConstructor;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.Condition;
import org.hl7.fhir.r4.model.MedicationStatement;
import org.hl7.fhir.r4.model.Observation;
import org.hl7.fhir.r4.model.Patient;
import org.hl7.fhir.r4.model.Quantity;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Period;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps FHIR R4 resources onto {@link RawPatientFacts}.
 *
 * Observations are read by LOINC code; the newest reading per code wins.
 * Glucose reported in mg/dL is converted to mmol/L.
 */
@Component
@RequiredArgsConstructor
public class FhirFactMapper {

    public static final String LOINC_SYSTOLIC = "8480-6";
    public static final String LOINC_DIASTOLIC = "8462-4";
    public static final String LOINC_HEART_RATE = "8867-4";
    public static final String LOINC_BODY_WEIGHT = "29463-7";
    public static final String LOINC_BODY_HEIGHT = "8302-2";
    public static final String LOINC_HBA1C = "4548-4";
    public static final String LOINC_FASTING_GLUCOSE = "1558-6";
    public static final String LOINC_POSTPRANDIAL_GLUCOSE = "1521-4";
    public static final String LOINC_BLOOD_PRESSURE_PANEL = "85354-9";

    public static final List<String> OBSERVATION_CODES = List.of(
        LOINC_SYSTOLIC, LOINC_DIASTOLIC, LOINC_HEART_RATE, LOINC_BODY_WEIGHT, LOINC_BODY_HEIGHT,
        LOINC_HBA1C, LOINC_FASTING_GLUCOSE, LOINC_POSTPRANDIAL_GLUCOSE, LOINC_BLOOD_PRESSURE_PANEL);

    private static final double MG_DL_PER_MMOL_L = 18.0;
    private static final Set<String> INACTIVE_CONDITION_STATUSES = Set.of("inactive", "resolved", "remission");

    private final TermNormalizer termNormalizer;
    private final Clock clock;

    public RawPatientFacts toFacts(String sourceName, Patient patient, List<Observation> observations,
                                   List<Condition> conditions, List<MedicationStatement> statements) {
        String patientId = patient.getIdElement().getIdPart();
        List<EvidenceRef> provenance = new ArrayList<>();
        provenance.add(new EvidenceRef(EvidenceKind.PATIENT_RECORD, "Patient/" + patientId, null));

        RawPatientFacts.RawPatientFactsBuilder builder = RawPatientFacts.builder()
            .sourceName(sourceName)
            .patientId(patientId)
            .age(age(patient))
            .sex(patient.hasGender() ? patient.getGender().toCode() : null);

        Map<String, Reading> readings = new HashMap<>();
        for (Observation observation : observations) {
            readObservation(observation, readings, provenance);
        }
        Double heartRate = value(readings, LOINC_HEART_RATE);
        builder.systolic(value(readings, LOINC_SYSTOLIC))
            .diastolic(value(readings, LOINC_DIASTOLIC))
            .heartRate(heartRate != null ? heartRate.intValue() : null)
            .vitalsMeasuredAt(latest(readings, LOINC_SYSTOLIC, LOINC_DIASTOLIC, LOINC_HEART_RATE))
            .heightCm(value(readings, LOINC_BODY_HEIGHT))
            .weightKg(value(readings, LOINC_BODY_WEIGHT))
            .hba1c(value(readings, LOINC_HBA1C))
            .fastingGlucose(value(readings, LOINC_FASTING_GLUCOSE))
            .postprandialGlucose(value(readings, LOINC_POSTPRANDIAL_GLUCOSE))
            .labsMeasuredAt(latest(readings, LOINC_HBA1C, LOINC_FASTING_GLUCOSE, LOINC_POSTPRANDIAL_GLUCOSE));

        List<String> diagnoses = new ArrayList<>();
        List<String> riskFactors = new ArrayList<>();
        List<String> organDamage = new ArrayList<>();
        List<String> clinicalConditions = new ArrayList<>();
        List<String> complications = new ArrayList<>();
        boolean pregnant = false;
        for (Condition condition : conditions) {
            if (!isActive(condition)) {
                continue;
            }
            String text = conceptText(condition.getCode());
            if (text == null) {
                continue;
            }
            String canonical = termNormalizer.canonicalize(text);
            if (ClinicalVocabulary.PREGNANCY.equals(canonical)) {
                pregnant = true;
            } else if (ClinicalVocabulary.RISK_FACTORS.contains(canonical)) {
                riskFactors.add(canonical);
            } else if (ClinicalVocabulary.TARGET_ORGAN_DAMAGE.contains(canonical)) {
                organDamage.add(canonical);
            } else {
                diagnoses.add(canonical);
                if (ClinicalVocabulary.QUALIFYING_CONDITIONS.contains(canonical)) {
                    clinicalConditions.add(canonical);
                }
                if (ClinicalVocabulary.DIABETES_COMPLICATIONS.contains(canonical)) {
                    complications.add(canonical);
                }
            }
            provenance.add(new EvidenceRef(EvidenceKind.PATIENT_RECORD,
                "Condition/" + condition.getIdElement().getIdPart(), toInstant(condition.getRecordedDate())));
        }

        List<Medication> medications = new ArrayList<>();
        for (MedicationStatement statement : statements) {
            Medication medication = toMedication(statement);
            if (medication == null) {
                continue;
            }
            medications.add(medication);
            provenance.add(EvidenceRef.prescriptionRecord("MedicationStatement",
                statement.getIdElement().getIdPart(), toInstant(statement.getDateAsserted())));
        }

        return builder
            .diagnoses(diagnoses)
            .riskFactors(riskFactors)
            .targetOrganDamage(organDamage)
            .clinicalConditions(clinicalConditions)
            .complications(complications)
            .medications(medications)
            .pregnant(pregnant ? Boolean.TRUE : null)
            .onInsulin(medications.stream().anyMatch(Medication::insulin) ? Boolean.TRUE : null)
            .provenance(provenance)
            .build();
    }

    Integer age(Patient patient) {
        if (!patient.hasBirthDate()) {
            return null;
        }
        LocalDate birthDate = patient.getBirthDate().toInstant().atZone(ZoneOffset.UTC).toLocalDate();
        return Period.between(birthDate, LocalDate.now(clock)).getYears();
    }

    private static void readObservation(Observation observation, Map<String, Reading> readings,
                                        List<EvidenceRef> provenance) {
        String code = loincCode(observation.getCode());
        if (code == null) {
            return;
        }
        Instant effective = effectiveInstant(observation);
        String locator = "Observation/" + observation.getIdElement().getIdPart();
        boolean used = false;

        if (LOINC_BLOOD_PRESSURE_PANEL.equals(code)) {
            for (Observation.ObservationComponentComponent component : observation.getComponent()) {
                String componentCode = loincCode(component.getCode());
                if ((LOINC_SYSTOLIC.equals(componentCode) || LOINC_DIASTOLIC.equals(componentCode))
                    && component.hasValueQuantity() && component.getValueQuantity().hasValue()) {
                    used |= offer(readings, componentCode, number(component.getValueQuantity()), effective);
                }
            }
        } else if (OBSERVATION_CODES.contains(code)
            && observation.hasValueQuantity() && observation.getValueQuantity().hasValue()) {
            Quantity quantity = observation.getValueQuantity();
            double value = number(quantity);
            if (LOINC_BODY_HEIGHT.equals(code) && "m".equalsIgnoreCase(quantity.getCode())) {
                value = value * 100.0;
            } else if (LOINC_FASTING_GLUCOSE.equals(code) || LOINC_POSTPRANDIAL_GLUCOSE.equals(code)) {
                value = toMmolPerLitre(value, quantity);
            }
            used = offer(readings, code, value, effective);
        }

        if (used) {
            provenance.add(new EvidenceRef(EvidenceKind.LAB_RECORD, locator, effective));
        }
    }

    /**
     * Keeps the newest reading per code. Undated readings only fill a gap.
     */
    private static boolean offer(Map<String, Reading> readings, String code, double value, Instant effective) {
        Reading current = readings.get(code);
        if (current == null
            || (effective != null && (current.measuredAt() == null || effective.isAfter(current.measuredAt())))) {
            readings.put(code, new Reading(value, effective));
            return true;
        }
        return false;
    }

    private static Double value(Map<String, Reading> readings, String code) {
        Reading reading = readings.get(code);
        return reading != null ? reading.value() : null;
    }

    private static Instant latest(Map<String, Reading> readings, String... codes) {
        Instant latest = null;
        for (String code : codes) {
            Reading reading = readings.get(code);
            if (reading != null && reading.measuredAt() != null
                && (latest == null || reading.measuredAt().isAfter(latest))) {
                latest = reading.measuredAt();
            }
        }
        return latest;
    }

    private static Medication toMedication(MedicationStatement statement) {
        if (statement.hasStatus()
            && statement.getStatus() != MedicationStatement.MedicationStatementStatus.ACTIVE
            && statement.getStatus() != MedicationStatement.MedicationStatementStatus.INTENDED) {
            return null;
        }
        if (!statement.hasMedicationCodeableConcept()) {
            return null;
        }
        String name = conceptText(statement.getMedicationCodeableConcept());
        if (name == null) {
            return null;
        }
        DrugClass drugClass = DrugClass.classify(null, name);
        LocalDate startDate = statement.hasEffectivePeriod() && statement.getEffectivePeriod().hasStart()
            ? statement.getEffectivePeriod().getStart().toInstant().atZone(ZoneOffset.UTC).toLocalDate()
            : null;
        String dose = statement.hasDosage() ? statement.getDosageFirstRep().getText() : null;
        return new Medication(name, drugClass, dose, startDate, drugClass == DrugClass.INSULIN);
    }

    private static boolean isActive(Condition condition) {
        if (!condition.hasClinicalStatus()) {
            return true;
        }
        String status = condition.getClinicalStatus().getCodingFirstRep().getCode();
        return status == null || !INACTIVE_CONDITION_STATUSES.contains(status.toLowerCase(Locale.ROOT));
    }

    private static String conceptText(CodeableConcept concept) {
        if (concept == null) {
            return null;
        }
        if (concept.hasText()) {
            return concept.getText();
        }
        for (Coding coding : concept.getCoding()) {
            if (coding.hasDisplay()) {
                return coding.getDisplay();
            }
        }
        return null;
    }

    private static String loincCode(CodeableConcept concept) {
        for (Coding coding : concept.getCoding()) {
            if (coding.hasCode() && (!coding.hasSystem() || coding.getSystem().contains("loinc"))) {
                return coding.getCode();
            }
        }
        return null;
    }

    private static double number(Quantity quantity) {
        return quantity.getValue().doubleValue();
    }

    private static double toMmolPerLitre(double value, Quantity quantity) {
        String unit = quantity.hasUnit() ? quantity.getUnit() : quantity.getCode();
        if (unit != null && unit.toLowerCase(Locale.ROOT).startsWith("mg")) {
            return Math.round(value / MG_DL_PER_MMOL_L * 10.0) / 10.0;
        }
        return value;
    }

    private static Instant effectiveInstant(Observation observation) {
        if (observation.hasEffectiveDateTimeType()) {
            return toInstant(observation.getEffectiveDateTimeType().getValue());
        }
        return toInstant(observation.getIssued());
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }

    private record Reading(double value, Instant measuredAt) {
    }
}
