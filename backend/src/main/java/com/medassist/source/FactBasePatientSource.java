package com.medassist.source;

import com.medassist.entity.DiabetesControlAssessment;
import com.medassist.entity.DiagnosisRecord;
import com.medassist.entity.HypertensionRiskAssessment;
import com.medassist.entity.LabResult;
import com.medassist.entity.MedicalRecord;
import com.medassist.entity.MedicationRecord;
import com.medassist.entity.PatientInfo;
import com.medassist.exception.ProfileNotFoundException;
import com.medassist.exception.SourceUnavailableException;
import com.medassist.model.DrugClass;
import com.medassist.model.EvidenceKind;
import com.medassist.model.EvidenceRef;
import com.medassist.model.Medication;
import com.medassist.model.RawPatientFacts;
import com.medassist.repository.DiabetesControlAssessmentRepository;
import com.medassist.repository.DiagnosisRecordRepository;
import com.medassist.repository.HypertensionRiskAssessmentRepository;
import com.medassist.repository.LabResultRepository;
import com.medassist.repository.MedicalRecordRepository;
import com.medassist.repository.MedicationRecordRepository;
import com.medassist.repository.PatientInfoRepository;
import com.medassist.service.ClinicalVocabulary;
import com.medassist.service.TermNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Patient facts from the relational fact base: demographics, the latest blood-pressure
 * and diabetes assessments, newer lab results, medications, diagnoses and the latest
 * visit's complaint text.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class FactBasePatientSource implements PatientFactSource {

    public static final String NAME = "fact-base";

    private static final String HBA1C = "glycated hemoglobin";
    private static final String FASTING_GLUCOSE = "fasting plasma glucose";
    private static final String POSTPRANDIAL_GLUCOSE = "postprandial glucose";
    private static final Set<String> HEREDITARY_CARDIOVASCULAR = Set.of(
        ClinicalVocabulary.HYPERTENSION, "coronary heart disease", "myocardial infarction", "stroke");

    private final PatientInfoRepository patientInfoRepository;
    private final HypertensionRiskAssessmentRepository hypertensionRepository;
    private final DiabetesControlAssessmentRepository diabetesRepository;
    private final LabResultRepository labResultRepository;
    private final MedicationRecordRepository medicationRepository;
    private final DiagnosisRecordRepository diagnosisRepository;
    private final MedicalRecordRepository medicalRecordRepository;
    private final TermNormalizer termNormalizer;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    @Transactional(readOnly = true)
    public RawPatientFacts fetchPatientFacts(String patientId) {
        try {
            PatientInfo info = patientInfoRepository.findById(patientId)
                .orElseThrow(() -> new ProfileNotFoundException(patientId));
            return buildFacts(info);
        } catch (DataAccessException e) {
            log.error("Fact base query failed for patient {}: {}", patientId, e.getMessage());
            throw new SourceUnavailableException(NAME, e.getMessage(), e);
        }
    }

    private RawPatientFacts buildFacts(PatientInfo info) {
        String patientId = info.getPatientId();
        List<EvidenceRef> provenance = new ArrayList<>();
        provenance.add(new EvidenceRef(EvidenceKind.PATIENT_RECORD, "patient_info/" + patientId, info.getUpdateTime()));

        RawPatientFacts.RawPatientFactsBuilder builder = RawPatientFacts.builder()
            .sourceName(NAME)
            .patientId(patientId)
            .age(info.getAge())
            .sex(info.getGender())
            .heightCm(info.getHeightCm())
            .weightKg(info.getWeightKg());

        List<String> riskFactors = new ArrayList<>();
        Optional<HypertensionRiskAssessment> bp = hypertensionRepository.findFirstByPatientIdOrderByAssessmentDateDesc(patientId);
        bp.ifPresent(a -> {
            Instant asOf = atStartOfDay(a.getAssessmentDate());
            builder.systolic(a.getSbp())
                .diastolic(a.getDbp())
                .heartRate(a.getHeartRate())
                .vitalsMeasuredAt(asOf)
                .targetOrganDamage(splitTerms(a.getTargetOrgansDamage()))
                .clinicalConditions(splitTerms(a.getClinicalConditions()));
            riskFactors.addAll(splitTerms(a.getRiskFactors()));
            provenance.add(EvidenceRef.labRecord("hypertension_risk_assessment", a.getAssessmentId(), asOf));
        });

        List<String> complications = new ArrayList<>();
        LabValues labs = new LabValues();
        diabetesRepository.findFirstByPatientIdOrderByAssessmentDateDesc(patientId).ifPresent(a -> {
            Instant asOf = atStartOfDay(a.getAssessmentDate());
            labs.fasting = a.getFastingGlucose();
            labs.postprandial = a.getPostprandialGlucose();
            labs.hba1c = a.getHba1c();
            labs.measuredOn = a.getAssessmentDate();
            if (Boolean.TRUE.equals(a.getInsulinUsage())) {
                builder.onInsulin(true);
            }
            complications.addAll(splitTerms(a.getComplications()));
            provenance.add(EvidenceRef.labRecord("diabetes_control_assessment", a.getAssessmentId(), asOf));
        });
        applyNewerLabResults(patientId, labs, provenance);
        builder.fastingGlucose(labs.fasting)
            .postprandialGlucose(labs.postprandial)
            .hba1c(labs.hba1c)
            .labsMeasuredAt(atStartOfDay(labs.measuredOn));

        List<Medication> medications = new ArrayList<>();
        for (MedicationRecord record : medicationRepository.findByPatientIdOrderByMedicationDateDesc(patientId)) {
            DrugClass drugClass = DrugClass.classify(record.getDrugClass(), record.getDrugName());
            boolean insulin = Boolean.TRUE.equals(record.getInsulin()) || drugClass == DrugClass.INSULIN;
            medications.add(new Medication(record.getDrugName(), drugClass, record.getDosage(), record.getMedicationDate(), insulin));
            provenance.add(EvidenceRef.prescriptionRecord("medication_records", record.getMedId(),
                atStartOfDay(record.getMedicationDate())));
        }

        List<String> diagnoses = new ArrayList<>();
        for (DiagnosisRecord record : diagnosisRepository.findByPatientIdOrderByDiagnosisDateDesc(patientId)) {
            diagnoses.add(record.getDiagnosisName());
            if (record.getDiagnosisType() == DiagnosisRecord.DiagnosisType.COMPLICATION) {
                complications.add(record.getDiagnosisName());
            }
            provenance.add(new EvidenceRef(EvidenceKind.PATIENT_RECORD, "diagnosis_records/" + record.getDiagId(),
                atStartOfDay(record.getDiagnosisDate())));
        }

        List<String> symptoms = new ArrayList<>();
        medicalRecordRepository.findFirstByPatientIdOrderByVisitDateDesc(patientId).ifPresent(record -> {
            symptoms.addAll(termNormalizer.findTerms(joinText(record.getChiefComplaint(), record.getPresentIllness())));
            Set<String> family = termNormalizer.findTerms(record.getFamilyHistory());
            if (family.stream().anyMatch(HEREDITARY_CARDIOVASCULAR::contains)) {
                riskFactors.add("family history of premature cardiovascular disease");
            }
            provenance.add(new EvidenceRef(EvidenceKind.PATIENT_RECORD, "medical_records/" + record.getRecordId(),
                atStartOfDay(record.getVisitDate())));
        });

        RawPatientFacts facts = builder
            .medications(medications)
            .diagnoses(diagnoses)
            .riskFactors(riskFactors)
            .complications(complications)
            .symptoms(symptoms)
            .provenance(provenance)
            .build();
        log.debug("Fact base facts for {}: {} medications, {} diagnoses, {} provenance refs",
            patientId, medications.size(), diagnoses.size(), provenance.size());
        return facts;
    }

    /**
     * Lab results dated after the diabetes assessment replace its values.
     */
    private void applyNewerLabResults(String patientId, LabValues labs, List<EvidenceRef> provenance) {
        boolean hba1cSet = false;
        boolean fastingSet = false;
        boolean postprandialSet = false;
        for (LabResult result : labResultRepository.findByPatientIdOrderByTestDateDesc(patientId)) {
            if (result.getResultValue() == null
                || (labs.measuredOn != null
                    && (result.getTestDate() == null || !result.getTestDate().isAfter(labs.measuredOn)))) {
                continue;
            }
            String item = termNormalizer.canonicalize(result.getTestItem());
            boolean used = false;
            if (HBA1C.equals(item) && !hba1cSet) {
                labs.hba1c = result.getResultValue();
                hba1cSet = used = true;
            } else if (FASTING_GLUCOSE.equals(item) && !fastingSet) {
                labs.fasting = result.getResultValue();
                fastingSet = used = true;
            } else if (POSTPRANDIAL_GLUCOSE.equals(item) && !postprandialSet) {
                labs.postprandial = result.getResultValue();
                postprandialSet = used = true;
            }
            if (used) {
                provenance.add(EvidenceRef.labRecord("lab_results", result.getResultId(), atStartOfDay(result.getTestDate())));
                if (result.getTestDate() != null
                    && (labs.latestResult == null || result.getTestDate().isAfter(labs.latestResult))) {
                    labs.latestResult = result.getTestDate();
                }
            }
        }
        if (labs.latestResult != null) {
            labs.measuredOn = labs.latestResult;
        }
    }

    static List<String> splitTerms(String column) {
        if (column == null || column.isBlank()) {
            return List.of();
        }
        return Arrays.stream(column.split("[,;，、]"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private static String joinText(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part != null) {
                sb.append(part).append(". ");
            }
        }
        return sb.toString();
    }

    private static Instant atStartOfDay(LocalDate date) {
        return date == null ? null : date.atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    private static final class LabValues {
        Double fasting;
        Double postprandial;
        Double hba1c;
        LocalDate measuredOn;
        LocalDate latestResult;
    }
}
