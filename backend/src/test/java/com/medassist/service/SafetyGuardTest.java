package com.medassist.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.medassist.TestFixtures;
import com.medassist.model.Disease;
import com.medassist.model.DrugClass;
import com.medassist.model.EvidenceLevel;
import com.medassist.model.Labs;
import com.medassist.model.Medication;
import com.medassist.model.PatientProfile;
import com.medassist.model.PlanStep;
import com.medassist.model.PlanStepKind;
import com.medassist.model.ProfileFlags;
import com.medassist.model.RiskAssessment;
import com.medassist.model.Sex;
import com.medassist.model.Vitals;
import com.medassist.model.Warning;
import com.medassist.model.WarningCategory;
import com.medassist.model.WarningSeverity;

@DisplayName("SafetyGuard Tests")
class SafetyGuardTest {

    private final SafetyGuard guard = new SafetyGuard();
    private final RiskStratifier stratifier = new RiskStratifier();

    private static PlanStep guidelineStep(String action, DrugClass... classes) {
        return PlanStep.builder()
                .kind(PlanStepKind.GUIDELINE)
                .disease(Disease.HYPERTENSION)
                .action(action)
                .evidenceLevel(EvidenceLevel.IA)
                .drugClasses(classes.length == 0 ? Set.of() : EnumSet.of(classes[0], classes))
                .build();
    }

    private SafetyReview review(PatientProfile profile, List<PlanStep> plan) {
        RiskAssessment risk = stratifier.assess(profile);
        return guard.review(profile, risk, plan, List.of());
    }

    @Nested
    @DisplayName("Pregnancy Tests")
    class PregnancyTests {

        private final PatientProfile pregnant = PatientProfile.builder()
                .patientId("P0003")
                .age(31)
                .sex(Sex.FEMALE)
                .diagnoses(Set.of("hypertension", "pregnancy"))
                .vitals(TestFixtures.bloodPressure(150, 98))
                .flags(new ProfileFlags(true, false, false, false))
                .build();

        @Test
        @DisplayName("Should replace an ACE inhibitor step in place and block delivery")
        void shouldSubstituteRaasBlocker() {
            // Arrange
            PlanStep lifestyle = guidelineStep("Lifestyle intervention");
            PlanStep acei = guidelineStep("Start an ACE inhibitor", DrugClass.ACE_INHIBITOR);

            // Act
            SafetyReview review = review(pregnant, List.of(lifestyle, acei));

            // Assert
            assertTrue(review.blocked());
            assertEquals(lifestyle, review.plan().get(0));
            PlanStep substitute = review.plan().get(1);
            assertEquals(PlanStepKind.SAFETY_SUBSTITUTE, substitute.getKind());
            assertTrue(substitute.getDrugClasses().containsAll(
                    Set.of(DrugClass.METHYLDOPA_CLASS, DrugClass.LABETALOL_CLASS)));
            assertFalse(review.plan().stream().anyMatch(s -> s.prescribesAny(SafetyGuard.RAAS_BLOCKERS)));
            assertEquals(PlanStepKind.REFERRAL, review.plan().get(review.plan().size() - 1).getKind());

            Warning warning = review.warnings().get(0);
            assertEquals(WarningCategory.CONTRAINDICATION, warning.getCategory());
            assertEquals(WarningSeverity.CRITICAL, warning.getSeverity());
            assertTrue(warning.getMessage().contains("teratogenic"));
            assertEquals(substitute, warning.getSuggestedAlternative().orElseThrow());
        }

        @Test
        @DisplayName("Should warn without blocking when an ARB is already prescribed")
        void shouldWarnOnCurrentRaasBlocker() {
            PatientProfile onValsartan = pregnant.toBuilder()
                    .medications(List.of(new Medication("Valsartan", DrugClass.ANGIOTENSIN_RECEPTOR_BLOCKER,
                            "80 mg", TestFixtures.TODAY.minusMonths(2), false)))
                    .build();

            SafetyReview review = review(onValsartan, List.of(guidelineStep("Lifestyle intervention")));

            assertFalse(review.blocked());
            assertTrue(review.warnings().stream()
                    .anyMatch(w -> w.getCategory() == WarningCategory.CONTRAINDICATION
                            && w.getMessage().contains("Valsartan")));
        }

        @Test
        @DisplayName("Should leave the plan alone for a non-pregnant patient")
        void shouldNotSubstituteWhenNotPregnant() {
            PatientProfile notPregnant = pregnant.toBuilder()
                    .diagnoses(Set.of("hypertension"))
                    .flags(ProfileFlags.none())
                    .build();
            PlanStep acei = guidelineStep("Start an ACE inhibitor", DrugClass.ACE_INHIBITOR);

            SafetyReview review = review(notPregnant, List.of(acei));

            assertFalse(review.blocked());
            assertEquals(List.of(acei), review.plan());
        }
    }

    @Nested
    @DisplayName("Interaction Tests")
    class InteractionTests {

        @Test
        @DisplayName("Should warn when a proposed ARB joins a current ACE inhibitor")
        void shouldWarnOnDualRaasBlockade() {
            PatientProfile profile = PatientProfile.builder()
                    .patientId("P1")
                    .vitals(TestFixtures.bloodPressure(150, 92))
                    .medications(List.of(new Medication("Enalapril", DrugClass.ACE_INHIBITOR, null, null, false)))
                    .build();

            SafetyReview review = review(profile,
                    List.of(guidelineStep("Add an ARB", DrugClass.ANGIOTENSIN_RECEPTOR_BLOCKER)));

            Warning warning = review.warnings().get(0);
            assertEquals(WarningCategory.CONTRAINDICATION, warning.getCategory());
            assertEquals(WarningSeverity.CAUTION, warning.getSeverity());
            assertFalse(warning.isBlocksDelivery());
        }

        @Test
        @DisplayName("Should not combine alternatives named by a single step")
        void shouldNotCombineAlternativesInOneStep() {
            PatientProfile profile = PatientProfile.builder()
                    .patientId("P1")
                    .vitals(TestFixtures.bloodPressure(165, 100))
                    .build();

            SafetyReview review = review(profile, List.of(guidelineStep("ACE inhibitor or ARB plus CCB",
                    DrugClass.ACE_INHIBITOR, DrugClass.ANGIOTENSIN_RECEPTOR_BLOCKER, DrugClass.CALCIUM_CHANNEL_BLOCKER)));

            assertTrue(review.warnings().isEmpty());
        }

        @Test
        @DisplayName("Should flag beta blocker with verapamil as critical")
        void shouldFlagBetaBlockerWithVerapamil() {
            PatientProfile profile = PatientProfile.builder()
                    .patientId("P1")
                    .vitals(TestFixtures.bloodPressure(150, 92))
                    .medications(List.of(
                            new Medication("Metoprolol", DrugClass.BETA_BLOCKER, null, null, false),
                            new Medication("Verapamil", DrugClass.NON_DIHYDROPYRIDINE_CCB, null, null, false)))
                    .build();

            SafetyReview review = review(profile, List.of());

            assertEquals(WarningSeverity.CRITICAL, review.warnings().get(0).getSeverity());
        }
    }

    @Nested
    @DisplayName("Emergency Tests")
    class EmergencyTests {

        @Test
        @DisplayName("Should put an urgent referral first for SBP >= 180 with neurologic symptoms")
        void shouldReferHypertensiveEmergency() {
            PatientProfile profile = PatientProfile.builder()
                    .patientId("P0004")
                    .vitals(TestFixtures.bloodPressure(196, 118))
                    .flags(new ProfileFlags(false, false, true, false))
                    .build();

            SafetyReview review = review(profile, List.of(guidelineStep("Combination therapy", DrugClass.CALCIUM_CHANNEL_BLOCKER)));

            PlanStep first = review.plan().get(0);
            assertEquals(PlanStepKind.REFERRAL, first.getKind());
            assertTrue(first.getDrugClasses().contains(DrugClass.IV_ANTIHYPERTENSIVE));
            Warning warning = review.warnings().get(0);
            assertEquals(WarningCategory.EMERGENCY, warning.getCategory());
            assertEquals(WarningSeverity.CRITICAL, warning.getSeverity());
            assertTrue(warning.getMessage().contains("196/118 mmHg"));
            assertFalse(review.blocked());
        }

        @Test
        @DisplayName("Should only caution for severe pressure without neurologic symptoms")
        void shouldCautionWithoutNeurologicSymptoms() {
            PatientProfile profile = PatientProfile.builder()
                    .patientId("P1")
                    .vitals(TestFixtures.bloodPressure(184, 100))
                    .build();

            SafetyReview review = review(profile, List.of());

            assertEquals(WarningSeverity.CAUTION, review.warnings().get(0).getSeverity());
            assertTrue(review.plan().isEmpty());
        }

        @Test
        @DisplayName("Should flag hypoglycemia")
        void shouldFlagHypoglycemia() {
            PatientProfile profile = PatientProfile.builder()
                    .patientId("P1")
                    .vitals(TestFixtures.bloodPressure(120, 80))
                    .labs(new Labs(3.2, null, 6.8, TestFixtures.NOW))
                    .build();

            SafetyReview review = review(profile, List.of());

            assertTrue(review.warnings().get(0).getMessage().startsWith("Hypoglycemia"));
        }
    }

    @Nested
    @DisplayName("Missing Data Tests")
    class MissingDataTests {

        @Test
        @DisplayName("Should warn about missing vitals, HbA1c and degraded sources after other warnings")
        void shouldOrderMissingDataLast() {
            PatientProfile profile = PatientProfile.builder()
                    .patientId("P0002")
                    .diagnoses(Set.of("type 2 diabetes mellitus"))
                    .vitals(Vitals.none())
                    .labs(new Labs(18.0, null, null, TestFixtures.NOW))
                    .build();
            RiskAssessment risk = stratifier.assess(profile);

            SafetyReview review = guard.review(profile, risk, List.of(), List.of("fhir"));

            List<WarningCategory> categories = review.warnings().stream().map(Warning::getCategory).toList();
            assertEquals(List.of(WarningCategory.EMERGENCY, WarningCategory.MISSING_DATA,
                    WarningCategory.MISSING_DATA, WarningCategory.MISSING_DATA), categories);
            assertTrue(review.warnings().get(3).getMessage().contains("'fhir'"));
        }
    }
}
