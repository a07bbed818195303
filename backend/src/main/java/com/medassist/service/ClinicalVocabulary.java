package com.medassist.service;

import com.medassist.model.Disease;

import java.util.EnumSet;
import java.util.Set;

/**
 * Canonical term groups the reasoning rules test against. Every entry is a
 * canonical form from the term dictionary.
 */
public final class ClinicalVocabulary {

    public static final String HYPERTENSION = "hypertension";
    public static final String DIABETES = "diabetes mellitus";
    public static final String PREGNANCY = "pregnancy";
    public static final String FREQUENT_HYPOGLYCEMIA = "frequent hypoglycemia";
    public static final String OBESITY = "obesity";
    public static final String OVERWEIGHT = "overweight";
    public static final String ADVANCED_AGE = "advanced age";

    public static final Set<String> DIABETES_DIAGNOSES = Set.of(
        DIABETES,
        "type 2 diabetes mellitus",
        "type 1 diabetes mellitus",
        "gestational diabetes"
    );

    public static final Set<String> RISK_FACTORS = Set.of(
        "smoking",
        "dyslipidemia",
        "family history of premature cardiovascular disease",
        "physical inactivity",
        OBESITY,
        OVERWEIGHT,
        ADVANCED_AGE
    );

    public static final Set<String> TARGET_ORGAN_DAMAGE = Set.of(
        "left ventricular hypertrophy",
        "microalbuminuria",
        "proteinuria",
        "carotid plaque",
        "hypertensive retinopathy"
    );

    public static final Set<String> QUALIFYING_CONDITIONS = Set.of(
        "coronary heart disease",
        "myocardial infarction",
        "stroke",
        "transient ischemic attack",
        "heart failure",
        "chronic kidney disease",
        "peripheral artery disease",
        "diabetic retinopathy",
        "atrial fibrillation"
    );

    public static final Set<String> DIABETES_COMPLICATIONS = Set.of(
        "diabetic retinopathy",
        "diabetic nephropathy",
        "diabetic neuropathy",
        "diabetic foot"
    );

    // Plain "headache" and "dizziness" do not count
    public static final Set<String> NEUROLOGIC_SYMPTOMS = Set.of(
        "confusion",
        "seizure",
        "altered consciousness",
        "hemiparesis",
        "speech disturbance",
        "blurred vision",
        "severe headache",
        "hypertensive encephalopathy"
    );

    public static final Set<String> DIAGNOSES = Set.of(
        HYPERTENSION,
        DIABETES,
        "type 2 diabetes mellitus",
        "type 1 diabetes mellitus",
        "gestational diabetes",
        "coronary heart disease",
        "myocardial infarction",
        "stroke",
        "transient ischemic attack",
        "heart failure",
        "chronic kidney disease",
        "peripheral artery disease",
        "atrial fibrillation",
        "diabetic retinopathy",
        "diabetic nephropathy",
        "diabetic neuropathy",
        "diabetic foot",
        "dyslipidemia",
        "hypertensive emergency"
    );

    private ClinicalVocabulary() {
    }

    public static boolean isDiabetesDiagnosis(String canonical) {
        return DIABETES_DIAGNOSES.contains(canonical);
    }

    /**
     * Disease axes named by a set of canonical terms.
     */
    public static Set<Disease> diseasesIn(Set<String> canonicalTerms) {
        EnumSet<Disease> diseases = EnumSet.noneOf(Disease.class);
        for (String term : canonicalTerms) {
            if (isDiabetesDiagnosis(term)) {
                diseases.add(Disease.DIABETES);
            } else if (HYPERTENSION.equals(term) || "hypertensive emergency".equals(term)) {
                diseases.add(Disease.HYPERTENSION);
            } else if ("myocardial infarction".equals(term)) {
                diseases.add(Disease.CORONARY_HEART_DISEASE);
            } else {
                Disease.fromText(term).ifPresent(diseases::add);
            }
        }
        return diseases;
    }
}
