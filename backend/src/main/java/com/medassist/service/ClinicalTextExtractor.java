package com.medassist.service;

import com.medassist.model.DrugClass;
import com.medassist.model.EvidenceKind;
import com.medassist.model.EvidenceRef;
import com.medassist.model.Medication;
import com.medassist.model.RawPatientFacts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Clinical Text Extractor
 *
 * Pulls structured facts out of a free-text clinical description
 * ("35-year-old pregnant woman, BP 158/96 mmHg, HbA1c 7.2%").
 * Terms are recognised through the term dictionary; numbers through fixed patterns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClinicalTextExtractor {

    public static final String SOURCE_NAME = "description";

    private static final String NUMBER = "(\\d{1,3}(?:\\.\\d+)?)";

    private static final Pattern AGE_PATTERN = Pattern.compile(
        "(?i)(?:(\\d{1,3})\\s*-?\\s*(?:years?|yrs?)\\s*-?\\s*old|(\\d{1,3})\\s*(?:y/o|yo)\\b|\\bage[d:]?\\s*(\\d{1,3}))");
    private static final Pattern FEMALE_PATTERN = Pattern.compile("(?i)\\b(?:female|woman|lady|girl)\\b");
    private static final Pattern MALE_PATTERN = Pattern.compile("(?i)\\b(?:male|man|gentleman|boy)\\b");
    private static final Pattern BLOOD_PRESSURE_PATTERN = Pattern.compile(
        "(?i)(?:\\b(?:bp|blood pressure)\\D{0,15}(\\d{2,3})\\s*/\\s*(\\d{2,3})|(\\d{2,3})\\s*/\\s*(\\d{2,3})\\s*mm\\s*hg)");
    private static final Pattern SYSTOLIC_PATTERN = Pattern.compile(
        "(?i)\\b(?:sbp|systolic(?: blood pressure| pressure)?)\\s*(?:of|is|was|[:=])?\\s*" + NUMBER);
    private static final Pattern DIASTOLIC_PATTERN = Pattern.compile(
        "(?i)\\b(?:dbp|diastolic(?: blood pressure| pressure)?)\\s*(?:of|is|was|[:=])?\\s*" + NUMBER);
    private static final Pattern HEART_RATE_PATTERN = Pattern.compile(
        "(?i)\\b(?:hr|heart rate|pulse)\\s*(?:of|is|was|[:=])?\\s*(\\d{2,3})");
    private static final Pattern HBA1C_PATTERN = Pattern.compile(
        "(?i)\\b(?:hba1c|a1c|glycated hemoglobin)\\s*(?:of|is|was|[:=])?\\s*" + NUMBER);
    private static final Pattern FASTING_GLUCOSE_PATTERN = Pattern.compile(
        "(?i)\\b(?:fpg|fasting (?:plasma )?glucose|fasting blood sugar|fbs)\\s*(?:of|is|was|[:=])?\\s*" + NUMBER);
    private static final Pattern POSTPRANDIAL_GLUCOSE_PATTERN = Pattern.compile(
        "(?i)\\b(?:ppg|postprandial glucose|2h postprandial glucose)\\s*(?:of|is|was|[:=])?\\s*" + NUMBER);
    private static final Pattern HEIGHT_PATTERN = Pattern.compile("(?i)(\\d{2,3}(?:\\.\\d+)?)\\s*cm\\b");
    private static final Pattern WEIGHT_PATTERN = Pattern.compile("(?i)(\\d{2,3}(?:\\.\\d+)?)\\s*kg\\b");
    private static final Pattern NOT_PREGNANT_PATTERN = Pattern.compile("(?i)\\b(?:not|non-?)\\s*pregnant\\b");
    private static final Pattern CURRENT_MEDICATION_PATTERN = Pattern.compile(
        "(?i)\\b(?:on|taking|takes|receiving|treated with)\\s+([a-z][a-z0-9\\- ]{2,40}?)(?=\\s*(?:[,.;)]|\\band\\b|\\bfor\\b|$))");

    private final TermNormalizer termNormalizer;

    public RawPatientFacts extract(String description) {
        String text = description == null ? "" : description;
        // A negated mention drops only that phrase; pregnancy named elsewhere still counts.
        Set<String> terms = termNormalizer.findTerms(NOT_PREGNANT_PATTERN.matcher(text).replaceAll(" "));

        List<String> diagnoses = new ArrayList<>();
        List<String> riskFactors = new ArrayList<>();
        List<String> organDamage = new ArrayList<>();
        List<String> conditions = new ArrayList<>();
        List<String> symptoms = new ArrayList<>();
        List<String> complications = new ArrayList<>();
        for (String term : terms) {
            if (ClinicalVocabulary.DIAGNOSES.contains(term)) {
                diagnoses.add(term);
            }
            if (ClinicalVocabulary.RISK_FACTORS.contains(term)) {
                riskFactors.add(term);
            }
            if (ClinicalVocabulary.TARGET_ORGAN_DAMAGE.contains(term)) {
                organDamage.add(term);
            }
            if (ClinicalVocabulary.QUALIFYING_CONDITIONS.contains(term)) {
                conditions.add(term);
            }
            if (ClinicalVocabulary.NEUROLOGIC_SYMPTOMS.contains(term)) {
                symptoms.add(term);
            }
            if (ClinicalVocabulary.DIABETES_COMPLICATIONS.contains(term)) {
                complications.add(term);
            }
        }

        boolean pregnant = terms.contains(ClinicalVocabulary.PREGNANCY);
        List<Medication> medications = extractMedications(text);

        Double systolic = null;
        Double diastolic = null;
        Matcher bp = BLOOD_PRESSURE_PATTERN.matcher(text);
        if (bp.find()) {
            systolic = Double.valueOf(bp.group(1) != null ? bp.group(1) : bp.group(3));
            diastolic = Double.valueOf(bp.group(2) != null ? bp.group(2) : bp.group(4));
        } else {
            systolic = firstNumber(SYSTOLIC_PATTERN, text);
            diastolic = firstNumber(DIASTOLIC_PATTERN, text);
        }

        RawPatientFacts facts = RawPatientFacts.builder()
            .sourceName(SOURCE_NAME)
            .age(extractAge(text))
            .sex(extractSex(text, pregnant))
            .heightCm(firstNumber(HEIGHT_PATTERN, text))
            .weightKg(firstNumber(WEIGHT_PATTERN, text))
            .systolic(systolic)
            .diastolic(diastolic)
            .heartRate(toInteger(firstNumber(HEART_RATE_PATTERN, text)))
            .hba1c(firstNumber(HBA1C_PATTERN, text))
            .fastingGlucose(firstNumber(FASTING_GLUCOSE_PATTERN, text))
            .postprandialGlucose(firstNumber(POSTPRANDIAL_GLUCOSE_PATTERN, text))
            .diagnoses(diagnoses)
            .riskFactors(riskFactors)
            .targetOrganDamage(organDamage)
            .clinicalConditions(conditions)
            .symptoms(symptoms)
            .complications(complications)
            .medications(medications)
            .pregnant(pregnant)
            .onInsulin(medications.stream().anyMatch(Medication::insulin) ? Boolean.TRUE : null)
            .frequentHypoglycemia(terms.contains(ClinicalVocabulary.FREQUENT_HYPOGLYCEMIA) ? Boolean.TRUE : null)
            .provenance(List.of(new EvidenceRef(EvidenceKind.PATIENT_RECORD, SOURCE_NAME, null)))
            .build();

        log.debug("Extracted from description: {} terms, sbp={}, dbp={}, hba1c={}",
            terms.size(), facts.getSystolic(), facts.getDiastolic(), facts.getHba1c());
        return facts;
    }

    private List<Medication> extractMedications(String text) {
        List<Medication> medications = new ArrayList<>();
        Matcher matcher = CURRENT_MEDICATION_PATTERN.matcher(text);
        while (matcher.find()) {
            String name = matcher.group(1).trim();
            DrugClass drugClass = DrugClass.classify(null, name);
            if (drugClass != DrugClass.OTHER) {
                medications.add(new Medication(name, drugClass, null, null, drugClass == DrugClass.INSULIN));
            }
        }
        return medications;
    }

    private static Integer extractAge(String text) {
        Matcher matcher = AGE_PATTERN.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        for (int group = 1; group <= matcher.groupCount(); group++) {
            if (matcher.group(group) != null) {
                return Integer.valueOf(matcher.group(group));
            }
        }
        return null;
    }

    private static String extractSex(String text, boolean pregnant) {
        if (FEMALE_PATTERN.matcher(text).find() || pregnant) {
            return "female";
        }
        if (MALE_PATTERN.matcher(text).find()) {
            return "male";
        }
        return null;
    }

    private static Double firstNumber(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? Double.valueOf(matcher.group(1)) : null;
    }

    private static Integer toInteger(Double value) {
        return value == null ? null : value.intValue();
    }
}
