package com.medassist.service;

import com.medassist.model.Disease;
import com.medassist.model.DrugClass;
import com.medassist.model.EvidenceKind;
import com.medassist.model.EvidenceLevel;
import com.medassist.model.EvidenceRef;
import com.medassist.model.Labs;
import com.medassist.model.Medication;
import com.medassist.model.PatientProfile;
import com.medassist.model.PlanStep;
import com.medassist.model.PlanStepKind;
import com.medassist.model.RiskAssessment;
import com.medassist.model.Vitals;
import com.medassist.model.Warning;
import com.medassist.model.WarningCategory;
import com.medassist.model.WarningSeverity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Safety Guard
 *
 * Screens a candidate plan before delivery. Every rule is evaluated and every
 * applicable warning is returned, contraindications first, then emergencies, then
 * missing data. A blocking contraindication replaces the offending step in place.
 */
@Component
@Slf4j
public class SafetyGuard {

    static final double EMERGENCY_SYSTOLIC = 180.0;
    static final double CRISIS_DIASTOLIC = 120.0;
    static final double HYPOGLYCEMIA_GLUCOSE = 3.9;
    static final double SEVERE_HYPERGLYCEMIA_GLUCOSE = 16.7;

    static final Set<DrugClass> RAAS_BLOCKERS = EnumSet.of(DrugClass.ACE_INHIBITOR, DrugClass.ANGIOTENSIN_RECEPTOR_BLOCKER);

    private static final EvidenceRef PREGNANCY_SAFETY_RULE =
        new EvidenceRef(EvidenceKind.GUIDELINE, "safety-rules/pregnancy-raas-blockade", null);
    private static final EvidenceRef EMERGENCY_SAFETY_RULE =
        new EvidenceRef(EvidenceKind.GUIDELINE, "safety-rules/hypertensive-emergency", null);

    private static final List<Interaction> INTERACTIONS = List.of(
        new Interaction(DrugClass.ACE_INHIBITOR, DrugClass.ANGIOTENSIN_RECEPTOR_BLOCKER, WarningSeverity.CAUTION,
            "dual renin-angiotensin blockade raises the risk of hyperkalemia and renal impairment"),
        new Interaction(DrugClass.ACE_INHIBITOR, DrugClass.POTASSIUM_SPARING_DIURETIC, WarningSeverity.CAUTION,
            "raises the risk of hyperkalemia"),
        new Interaction(DrugClass.BETA_BLOCKER, DrugClass.NON_DIHYDROPYRIDINE_CCB, WarningSeverity.CRITICAL,
            "may cause severe bradycardia or heart block")
    );

    public SafetyReview review(PatientProfile profile, RiskAssessment risk, List<PlanStep> proposed,
                               List<String> degradedSources) {
        List<PlanStep> plan = new ArrayList<>(proposed);
        List<Warning> contraindications = new ArrayList<>();
        List<Warning> emergencies = new ArrayList<>();
        List<Warning> missingData = new ArrayList<>();

        if (profile.isPregnant()) {
            checkPregnancy(profile, plan, contraindications);
        }
        checkInteractions(profile, plan, contraindications);
        checkBloodPressure(profile, plan, emergencies);
        checkGlucose(profile.getLabs(), emergencies);
        checkMissingData(profile, risk, degradedSources, missingData);

        List<Warning> warnings = new ArrayList<>(contraindications);
        warnings.addAll(emergencies);
        warnings.addAll(missingData);

        if (!warnings.isEmpty()) {
            log.info("Safety review for {}: {} contraindications, {} emergencies, {} missing-data warnings",
                profile.getPatientId(), contraindications.size(), emergencies.size(), missingData.size());
        }
        return new SafetyReview(plan, warnings);
    }

    private void checkPregnancy(PatientProfile profile, List<PlanStep> plan, List<Warning> warnings) {
        boolean referralNeeded = false;

        for (int i = 0; i < plan.size(); i++) {
            PlanStep step = plan.get(i);
            if (!step.prescribesAny(RAAS_BLOCKERS)) {
                continue;
            }
            PlanStep substitute = pregnancySubstitute(step);
            plan.set(i, substitute);
            referralNeeded = true;
            warnings.add(Warning.builder()
                .category(WarningCategory.CONTRAINDICATION)
                .severity(WarningSeverity.CRITICAL)
                .message("ACE inhibitors and angiotensin receptor blockers are contraindicated in pregnancy: "
                    + "they are teratogenic and cause fetal renal damage, oligohydramnios and skull hypoplasia. "
                    + "The proposed step was replaced with methyldopa or labetalol.")
                .blocksDelivery(true)
                .suggestedAlternative(substitute)
                .build());
        }

        List<String> current = profile.getMedications().stream()
            .filter(m -> m.drugClass() != null && RAAS_BLOCKERS.contains(m.drugClass()))
            .map(Medication::name)
            .toList();
        if (!current.isEmpty()) {
            referralNeeded = true;
            warnings.add(Warning.builder()
                .category(WarningCategory.CONTRAINDICATION)
                .severity(WarningSeverity.CRITICAL)
                .message("Pregnant patient is currently taking " + String.join(", ", current)
                    + ". Stop ACE inhibitor or angiotensin receptor blocker therapy and switch to methyldopa or labetalol.")
                .blocksDelivery(false)
                .suggestedAlternative(pregnancySubstitute(null))
                .build());
        }

        if (referralNeeded) {
            plan.add(PlanStep.builder()
                .kind(PlanStepKind.REFERRAL)
                .disease(Disease.HYPERTENSION)
                .action("Obstetric consultation to assess the pregnancy and fetal status; monitor blood pressure closely")
                .rationale("Antihypertensive therapy in pregnancy is co-managed with obstetrics")
                .evidence(PREGNANCY_SAFETY_RULE)
                .build());
        }
    }

    private static PlanStep pregnancySubstitute(PlanStep replaced) {
        String rationale = replaced != null && replaced.getAction() != null
            ? "Replaces a step contraindicated in pregnancy: " + replaced.getAction()
            : "Preferred antihypertensives in pregnancy";
        return PlanStep.builder()
            .kind(PlanStepKind.SAFETY_SUBSTITUTE)
            .disease(replaced != null && replaced.getDisease() != null ? replaced.getDisease() : Disease.HYPERTENSION)
            .action("Use methyldopa or labetalol for blood pressure control during pregnancy")
            .rationale(rationale)
            .evidenceLevel(EvidenceLevel.IB)
            .drugClasses(EnumSet.of(DrugClass.METHYLDOPA_CLASS, DrugClass.LABETALOL_CLASS))
            .evidence(PREGNANCY_SAFETY_RULE)
            .build();
    }

    /**
     * Pairs among current medications and proposed steps. Alternatives named by one
     * step ("ACE inhibitor or ARB") are not combined with each other.
     */
    private void checkInteractions(PatientProfile profile, List<PlanStep> plan, List<Warning> warnings) {
        Set<DrugClass> current = profile.currentDrugClasses();

        for (Interaction interaction : INTERACTIONS) {
            if (combined(interaction, current, plan)) {
                warnings.add(Warning.builder()
                    .category(WarningCategory.CONTRAINDICATION)
                    .severity(interaction.severity())
                    .message("Drug interaction " + interaction.first().getLabel() + " + "
                        + interaction.second().getLabel() + ": " + interaction.risk()
                        + ". Review the regimen.")
                    .blocksDelivery(false)
                    .build());
            }
        }
    }

    private static boolean combined(Interaction interaction, Set<DrugClass> current, List<PlanStep> plan) {
        boolean firstCurrent = current.contains(interaction.first());
        boolean secondCurrent = current.contains(interaction.second());
        if (firstCurrent && secondCurrent) {
            return true;
        }
        for (int i = 0; i < plan.size(); i++) {
            Set<DrugClass> classes = plan.get(i).getDrugClasses();
            if ((firstCurrent && classes.contains(interaction.second()))
                || (secondCurrent && classes.contains(interaction.first()))) {
                return true;
            }
            for (int j = 0; j < plan.size(); j++) {
                if (i != j && classes.contains(interaction.first())
                    && plan.get(j).getDrugClasses().contains(interaction.second())) {
                    return true;
                }
            }
        }
        return false;
    }

    private void checkBloodPressure(PatientProfile profile, List<PlanStep> plan, List<Warning> warnings) {
        Vitals vitals = profile.getVitals();
        boolean severeSystolic = vitals.systolic() != null && vitals.systolic() >= EMERGENCY_SYSTOLIC;
        boolean severeDiastolic = vitals.diastolic() != null && vitals.diastolic() >= CRISIS_DIASTOLIC;
        String reading = formatBloodPressure(vitals);

        if (severeSystolic && profile.getFlags().neurologicSymptoms()) {
            PlanStep referral = PlanStep.builder()
                .kind(PlanStepKind.REFERRAL)
                .disease(Disease.HYPERTENSION)
                .action("Urgent referral to the emergency department; start intravenous antihypertensive therapy "
                    + "and lower blood pressure by no more than 25% within the first hour under continuous monitoring")
                .rationale("Hypertensive emergency with neurologic symptoms")
                .evidenceLevel(EvidenceLevel.IA)
                .drugClasses(EnumSet.of(DrugClass.IV_ANTIHYPERTENSIVE))
                .evidence(EMERGENCY_SAFETY_RULE)
                .build();
            plan.add(0, referral);
            warnings.add(Warning.builder()
                .category(WarningCategory.EMERGENCY)
                .severity(WarningSeverity.CRITICAL)
                .message("Hypertensive emergency: blood pressure " + reading + " with neurologic symptoms. "
                    + "Refer urgently and start intravenous antihypertensive therapy.")
                .blocksDelivery(false)
                .suggestedAlternative(referral)
                .build());
        } else if (severeSystolic || severeDiastolic) {
            warnings.add(Warning.builder()
                .category(WarningCategory.EMERGENCY)
                .severity(WarningSeverity.CAUTION)
                .message("Severely elevated blood pressure " + reading
                    + " without neurologic symptoms. Reassess promptly and exclude acute target-organ damage.")
                .blocksDelivery(false)
                .build());
        }
    }

    private static void checkGlucose(Labs labs, List<Warning> warnings) {
        Double fasting = labs.fastingGlucose();
        if (fasting == null) {
            return;
        }
        if (fasting < HYPOGLYCEMIA_GLUCOSE) {
            warnings.add(Warning.builder()
                .category(WarningCategory.EMERGENCY)
                .severity(WarningSeverity.CRITICAL)
                .message("Hypoglycemia: fasting glucose " + fasting + " mmol/L. Give glucose now and review "
                    + "glucose-lowering doses.")
                .blocksDelivery(false)
                .build());
        } else if (fasting > SEVERE_HYPERGLYCEMIA_GLUCOSE) {
            warnings.add(Warning.builder()
                .category(WarningCategory.EMERGENCY)
                .severity(WarningSeverity.CRITICAL)
                .message("Severe hyperglycemia: fasting glucose " + fasting + " mmol/L. Assess urgently for "
                    + "diabetic ketoacidosis.")
                .blocksDelivery(false)
                .build());
        }
    }

    private static void checkMissingData(PatientProfile profile, RiskAssessment risk, List<String> degradedSources,
                                         List<Warning> warnings) {
        if (profile.getVitals().isEmpty()) {
            warnings.add(missingData(WarningSeverity.CAUTION,
                "No vital signs available; hypertension risk was assessed without blood pressure."));
        } else if (risk.missingInputs().contains(RiskStratifier.MISSING_BLOOD_PRESSURE)) {
            warnings.add(missingData(WarningSeverity.CAUTION,
                "Blood pressure incomplete; the emergency threshold could not be checked."));
        }
        if (risk.missingInputs().contains(RiskStratifier.MISSING_HBA1C)) {
            warnings.add(missingData(WarningSeverity.INFO,
                "No HbA1c on record for a diabetic patient; glycemic control was not classified."));
        }
        for (String source : degradedSources) {
            warnings.add(missingData(WarningSeverity.CAUTION,
                "Source '" + source + "' did not answer; facts it holds are missing from this assessment."));
        }
    }

    private static Warning missingData(WarningSeverity severity, String message) {
        return Warning.builder()
            .category(WarningCategory.MISSING_DATA)
            .severity(severity)
            .message(message)
            .blocksDelivery(false)
            .build();
    }

    private static String formatBloodPressure(Vitals vitals) {
        return format(vitals.systolic()) + "/" + format(vitals.diastolic()) + " mmHg";
    }

    private static String format(Double value) {
        if (value == null) {
            return "?";
        }
        return value % 1 == 0 ? String.valueOf(value.intValue()) : String.valueOf(value);
    }

    private record Interaction(DrugClass first, DrugClass second, WarningSeverity severity, String risk) {
    }
}
