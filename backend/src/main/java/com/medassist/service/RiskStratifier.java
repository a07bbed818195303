package com.medassist.service;

import com.medassist.model.DiabetesControlStatus;
import com.medassist.model.Disease;
import com.medassist.model.DiseaseRisk;
import com.medassist.model.FollowUpInterval;
import com.medassist.model.HypertensionRiskLevel;
import com.medassist.model.PatientProfile;
import com.medassist.model.RiskAssessment;
import com.medassist.model.Sex;
import com.medassist.model.Vitals;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Risk Stratifier
 *
 * Deterministic decision tables for hypertension risk and diabetes control.
 * No I/O; the same profile always yields an equal {@link RiskAssessment}.
 *
 * Hypertension, first matching row wins:
 * <ol>
 *   <li>SBP ≥ 180 or DBP ≥ 110, or neurologic symptoms: VERY_HIGH, immediate</li>
 *   <li>≥ 3 risk factors, target-organ damage or a qualifying clinical condition: HIGH, 2-4 weeks</li>
 *   <li>1-2 risk factors, or grade-2 pressure (SBP ≥ 160 or DBP ≥ 100): MEDIUM, 1 month</li>
 *   <li>otherwise: LOW, 3 months</li>
 * </ol>
 *
 * Diabetes by HbA1c band (rows 1-3 = POOR, FAIR, GOOD), escalated one band by
 * frequent hypoglycemia, a diagnosed complication or pregnancy.
 */
@Component
@Slf4j
public class RiskStratifier {

    public static final String MISSING_BLOOD_PRESSURE = "blood pressure";
    public static final String MISSING_HBA1C = "hba1c";

    static final double EMERGENCY_SYSTOLIC = 180.0;
    static final double EMERGENCY_DIASTOLIC = 110.0;
    static final double GRADE2_SYSTOLIC = 160.0;
    static final double GRADE2_DIASTOLIC = 100.0;
    static final double HBA1C_FAIR = 7.0;
    static final double HBA1C_POOR = 9.0;
    static final double BMI_OBESE = 28.0;
    static final double BMI_OVERWEIGHT = 24.0;

    public RiskAssessment assess(PatientProfile profile) {
        Set<String> missing = new TreeSet<>();
        DiseaseRisk hypertension = assessHypertension(profile, missing);
        DiseaseRisk diabetes = assessDiabetes(profile, missing);

        RiskAssessment assessment = new RiskAssessment(profile.getPatientId(), hypertension, diabetes, new ArrayList<>(missing));
        log.debug("Risk for {}: hypertension={} (row {}), diabetes={}, missing={}",
            profile.getPatientId(), hypertension.level(), hypertension.ruleRow(),
            assessment.diabetesStatus().map(Enum::name).orElse("n/a"), missing);
        return assessment;
    }

    DiseaseRisk assessHypertension(PatientProfile profile, Set<String> missing) {
        Vitals vitals = profile.getVitals();
        if (!vitals.hasBloodPressure()) {
            missing.add(MISSING_BLOOD_PRESSURE);
        }

        // Row 1
        Set<String> emergency = new TreeSet<>();
        if (vitals.systolic() != null && vitals.systolic() >= EMERGENCY_SYSTOLIC) {
            emergency.add("systolic blood pressure >= 180");
        }
        if (vitals.diastolic() != null && vitals.diastolic() >= EMERGENCY_DIASTOLIC) {
            emergency.add("diastolic blood pressure >= 110");
        }
        if (profile.getFlags().neurologicSymptoms()) {
            emergency.add("neurologic symptoms");
        }
        if (!emergency.isEmpty()) {
            return hypertensionRisk(HypertensionRiskLevel.VERY_HIGH, emergency, FollowUpInterval.immediate(), 1);
        }

        // Row 2
        Set<String> riskFactors = riskFactors(profile);
        Set<String> organDamage = new TreeSet<>(profile.getTargetOrganDamage());
        Set<String> conditions = qualifyingConditions(profile);
        if (riskFactors.size() >= 3 || !organDamage.isEmpty() || !conditions.isEmpty()) {
            Set<String> factors = new TreeSet<>(riskFactors);
            factors.addAll(organDamage);
            factors.addAll(conditions);
            return hypertensionRisk(HypertensionRiskLevel.HIGH, factors, FollowUpInterval.days(14, 28), 2);
        }

        // Row 3
        Set<String> medium = new TreeSet<>(riskFactors);
        if (vitals.systolic() != null && vitals.systolic() >= GRADE2_SYSTOLIC) {
            medium.add("systolic blood pressure >= 160");
        }
        if (vitals.diastolic() != null && vitals.diastolic() >= GRADE2_DIASTOLIC) {
            medium.add("diastolic blood pressure >= 100");
        }
        if (!medium.isEmpty()) {
            return hypertensionRisk(HypertensionRiskLevel.MEDIUM, medium, FollowUpInterval.days(30, 30), 3);
        }

        return hypertensionRisk(HypertensionRiskLevel.LOW, Set.of(), FollowUpInterval.days(90, 90), 4);
    }

    DiseaseRisk assessDiabetes(PatientProfile profile, Set<String> missing) {
        Double hba1c = profile.getLabs().hba1c();
        if (hba1c == null) {
            if (isDiabetic(profile)) {
                missing.add(MISSING_HBA1C);
            }
            return null;
        }

        Set<String> factors = new TreeSet<>();
        DiabetesControlStatus status;
        int row;
        if (hba1c >= HBA1C_POOR) {
            status = DiabetesControlStatus.POOR;
            factors.add("glycated hemoglobin >= 9.0");
            row = 1;
        } else if (hba1c >= HBA1C_FAIR) {
            status = DiabetesControlStatus.FAIR;
            factors.add("glycated hemoglobin 7.0-8.9");
            row = 2;
        } else {
            status = DiabetesControlStatus.GOOD;
            factors.add("glycated hemoglobin < 7.0");
            row = 3;
        }

        Set<String> overrides = new TreeSet<>(profile.getDiabetesComplications());
        if (profile.getFlags().frequentHypoglycemia()) {
            overrides.add("frequent hypoglycemia");
        }
        if (profile.isPregnant()) {
            overrides.add("pregnancy");
        }
        if (!overrides.isEmpty()) {
            status = status.escalate();
            factors.addAll(overrides);
        }

        return new DiseaseRisk(Disease.DIABETES, status, List.copyOf(factors), diabetesFollowUp(status), row);
    }

    /**
     * Recorded risk factors plus those derived from age, sex, BMI and a diabetes diagnosis.
     */
    static Set<String> riskFactors(PatientProfile profile) {
        Set<String> factors = new TreeSet<>(profile.getRiskFactors());
        Integer age = profile.getAge();
        if (age != null) {
            if ((profile.getSex() == Sex.MALE && age >= 55) || (profile.getSex() == Sex.FEMALE && age >= 65)) {
                factors.add(ClinicalVocabulary.ADVANCED_AGE);
            }
        }
        Double bmi = profile.getBmi();
        if (bmi != null) {
            if (bmi >= BMI_OBESE) {
                factors.add(ClinicalVocabulary.OBESITY);
                factors.remove(ClinicalVocabulary.OVERWEIGHT);
            } else if (bmi >= BMI_OVERWEIGHT) {
                factors.add(ClinicalVocabulary.OVERWEIGHT);
            }
        }
        if (isDiabetic(profile)) {
            factors.add(ClinicalVocabulary.DIABETES);
        }
        return factors;
    }

    static Set<String> qualifyingConditions(PatientProfile profile) {
        Set<String> conditions = new TreeSet<>();
        profile.getClinicalConditions().stream()
            .filter(ClinicalVocabulary.QUALIFYING_CONDITIONS::contains)
            .forEach(conditions::add);
        profile.getDiagnoses().stream()
            .filter(ClinicalVocabulary.QUALIFYING_CONDITIONS::contains)
            .forEach(conditions::add);
        return conditions;
    }

    static boolean isDiabetic(PatientProfile profile) {
        return profile.getDiagnoses().stream().anyMatch(ClinicalVocabulary::isDiabetesDiagnosis);
    }

    private static DiseaseRisk hypertensionRisk(HypertensionRiskLevel level, Set<String> factors,
                                                FollowUpInterval followUp, int row) {
        return new DiseaseRisk(Disease.HYPERTENSION, level, List.copyOf(factors), followUp, row);
    }

    private static FollowUpInterval diabetesFollowUp(DiabetesControlStatus status) {
        return switch (status) {
            case GOOD -> FollowUpInterval.days(90, 90);
            case FAIR -> FollowUpInterval.days(30, 60);
            case POOR -> FollowUpInterval.days(14, 28);
        };
    }
}
