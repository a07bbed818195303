package com.medassist.guideline;

import com.medassist.model.DrugClass;
import com.medassist.model.PatientProfile;
import com.medassist.model.ProfileFlags;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Profile fields a guideline condition may constrain.
 * Numeric fields feed threshold clauses, the others feed set-membership clauses.
 */
public enum ProfileField {
    SBP(List.of("sbp", "systolic", "systolic blood pressure"), p -> p.getVitals().systolic()),
    DBP(List.of("dbp", "diastolic", "diastolic blood pressure"), p -> p.getVitals().diastolic()),
    HR(List.of("hr", "heart rate", "pulse"), p -> toDouble(p.getVitals().heartRate())),
    HBA1C(List.of("hba1c", "a1c", "glycated hemoglobin"), p -> p.getLabs().hba1c()),
    FPG(List.of("fpg", "fasting glucose", "fasting plasma glucose"), p -> p.getLabs().fastingGlucose()),
    PPG(List.of("ppg", "postprandial glucose"), p -> p.getLabs().postprandialGlucose()),
    BMI(List.of("bmi", "body mass index"), PatientProfile::getBmi),
    AGE(List.of("age"), p -> toDouble(p.getAge())),

    DIAGNOSIS(List.of("diagnosis", "diagnoses"), null),
    SEX(List.of("sex", "gender"), null),
    MEDICATION_CLASS(List.of("medication-class", "medication class", "drug-class", "drug class"), null),
    FLAG(List.of("flag", "flags"), null);

    public static final String FLAG_PREGNANT = "pregnant";
    public static final String FLAG_ON_INSULIN = "on-insulin";
    public static final String FLAG_NEUROLOGIC_SYMPTOMS = "neurologic-symptoms";
    public static final String FLAG_FREQUENT_HYPOGLYCEMIA = "frequent-hypoglycemia";

    private final List<String> tokens;
    private final Function<PatientProfile, Double> numericValue;

    ProfileField(List<String> tokens, Function<PatientProfile, Double> numericValue) {
        this.tokens = tokens;
        this.numericValue = numericValue;
    }

    List<String> tokens() {
        return tokens;
    }

    public boolean isNumeric() {
        return numericValue != null;
    }

    /**
     * Numeric value, or empty when the profile lacks it.
     */
    public Optional<Double> numericValue(PatientProfile profile) {
        if (!isNumeric()) {
            throw new IllegalStateException(this + " is not a numeric field");
        }
        return Optional.ofNullable(numericValue.apply(profile));
    }

    /**
     * Values of a set-valued field, in the normalised form clause values use.
     */
    public Set<String> setValues(PatientProfile profile) {
        Set<String> values = new LinkedHashSet<>();
        switch (this) {
            case DIAGNOSIS -> values.addAll(profile.getDiagnoses());
            case SEX -> values.add(profile.getSex().name().toLowerCase(Locale.ROOT));
            case MEDICATION_CLASS -> profile.currentDrugClasses().forEach(c -> values.add(c.name()));
            case FLAG -> {
                ProfileFlags flags = profile.getFlags();
                if (flags.pregnant()) {
                    values.add(FLAG_PREGNANT);
                }
                if (flags.onInsulin()) {
                    values.add(FLAG_ON_INSULIN);
                }
                if (flags.neurologicSymptoms()) {
                    values.add(FLAG_NEUROLOGIC_SYMPTOMS);
                }
                if (flags.frequentHypoglycemia()) {
                    values.add(FLAG_FREQUENT_HYPOGLYCEMIA);
                }
            }
            default -> throw new IllegalStateException(this + " is not a set-valued field");
        }
        return values;
    }

    /**
     * Field named by a condition token, case-insensitive.
     */
    public static Optional<ProfileField> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String key = token.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(f -> f.tokens.contains(key))
            .findFirst();
    }

    /**
     * Drug-class clause values are stored as enum names.
     */
    static String drugClassValue(String text) {
        Set<DrugClass> detected = DrugClass.detect(text);
        return detected.size() == 1 ? detected.iterator().next().name() : text.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
    }

    private static Double toDouble(Integer value) {
        return value == null ? null : value.doubleValue();
    }
}
