package com.medassist.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.medassist.TestFixtures;
import com.medassist.model.DiabetesControlStatus;
import com.medassist.model.DiseaseRisk;
import com.medassist.model.FollowUpInterval;
import com.medassist.model.HypertensionRiskLevel;
import com.medassist.model.Labs;
import com.medassist.model.PatientProfile;
import com.medassist.model.ProfileFlags;
import com.medassist.model.RiskAssessment;
import com.medassist.model.Sex;

@DisplayName("RiskStratifier Tests")
class RiskStratifierTest {

    private final RiskStratifier stratifier = new RiskStratifier();

    private static PatientProfile.PatientProfileBuilder hypertensive(double systolic, double diastolic) {
        return PatientProfile.builder()
                .patientId("P0001")
                .age(45)
                .sex(Sex.FEMALE)
                .diagnoses(Set.of("hypertension"))
                .vitals(TestFixtures.bloodPressure(systolic, diastolic));
    }

    @Nested
    @DisplayName("Hypertension Tests")
    class HypertensionTests {

        @Test
        @DisplayName("Should grade SBP >= 180 as very high with immediate follow-up")
        void shouldGradeEmergencySystolicVeryHigh() {
            // Act
            RiskAssessment risk = stratifier.assess(hypertensive(196, 100).build());

            // Assert
            assertEquals(HypertensionRiskLevel.VERY_HIGH, risk.hypertensionLevel());
            assertEquals(1, risk.hypertension().ruleRow());
            assertTrue(risk.hypertension().followUp().isImmediate());
            assertTrue(risk.hypertension().contributingFactors().contains("systolic blood pressure >= 180"));
        }

        @Test
        @DisplayName("Should grade DBP >= 110 as very high")
        void shouldGradeEmergencyDiastolicVeryHigh() {
            RiskAssessment risk = stratifier.assess(hypertensive(170, 110).build());

            assertEquals(HypertensionRiskLevel.VERY_HIGH, risk.hypertensionLevel());
        }

        @Test
        @DisplayName("Should grade neurologic symptoms as very high at moderate pressure")
        void shouldGradeNeurologicSymptomsVeryHigh() {
            PatientProfile profile = hypertensive(150, 95)
                    .flags(new ProfileFlags(false, false, true, false))
                    .build();

            RiskAssessment risk = stratifier.assess(profile);

            assertEquals(HypertensionRiskLevel.VERY_HIGH, risk.hypertensionLevel());
            assertEquals(List.of("neurologic symptoms"), risk.hypertension().contributingFactors());
        }

        @Test
        @DisplayName("Should grade target-organ damage as high")
        void shouldGradeOrganDamageHigh() {
            PatientProfile profile = hypertensive(150, 95)
                    .targetOrganDamage(Set.of("left ventricular hypertrophy"))
                    .build();

            RiskAssessment risk = stratifier.assess(profile);

            assertEquals(HypertensionRiskLevel.HIGH, risk.hypertensionLevel());
            assertEquals(2, risk.hypertension().ruleRow());
            assertEquals(FollowUpInterval.days(14, 28), risk.hypertension().followUp());
        }

        @Test
        @DisplayName("Should grade a qualifying diagnosis as high")
        void shouldGradeQualifyingDiagnosisHigh() {
            PatientProfile profile = hypertensive(150, 95)
                    .diagnoses(Set.of("hypertension", "coronary heart disease"))
                    .build();

            assertEquals(HypertensionRiskLevel.HIGH, stratifier.assess(profile).hypertensionLevel());
        }

        @Test
        @DisplayName("Should count derived risk factors towards the high row")
        void shouldCountDerivedRiskFactors() {
            PatientProfile profile = hypertensive(150, 95)
                    .age(58)
                    .sex(Sex.MALE)
                    .bmi(29.0)
                    .riskFactors(Set.of("smoking"))
                    .build();

            RiskAssessment risk = stratifier.assess(profile);

            assertEquals(HypertensionRiskLevel.HIGH, risk.hypertensionLevel());
            assertTrue(risk.hypertension().contributingFactors()
                    .containsAll(Set.of("advanced age", "obesity", "smoking")));
        }

        @Test
        @DisplayName("Should grade one or two risk factors as medium")
        void shouldGradeFewRiskFactorsMedium() {
            PatientProfile profile = hypertensive(152, 94).riskFactors(Set.of("smoking")).build();

            RiskAssessment risk = stratifier.assess(profile);

            assertEquals(HypertensionRiskLevel.MEDIUM, risk.hypertensionLevel());
            assertEquals(3, risk.hypertension().ruleRow());
            assertEquals(FollowUpInterval.days(30, 30), risk.hypertension().followUp());
        }

        @Test
        @DisplayName("Should grade no risk factors as low")
        void shouldGradeNoRiskFactorsLow() {
            RiskAssessment risk = stratifier.assess(hypertensive(145, 92).build());

            assertEquals(HypertensionRiskLevel.LOW, risk.hypertensionLevel());
            assertEquals(4, risk.hypertension().ruleRow());
            assertTrue(risk.missingInputs().isEmpty());
        }

        @Test
        @DisplayName("Should grade grade-2 pressure without risk factors as medium")
        void shouldGradeGrade2PressureMedium() {
            // Arrange
            PatientProfile profile = hypertensive(175, 105).age(40).build();

            // Act
            RiskAssessment risk = stratifier.assess(profile);

            // Assert
            assertEquals(HypertensionRiskLevel.MEDIUM, risk.hypertensionLevel());
            assertEquals(3, risk.hypertension().ruleRow());
            assertEquals(FollowUpInterval.days(30, 30), risk.hypertension().followUp());
            assertEquals(List.of("diastolic blood pressure >= 100", "systolic blood pressure >= 160"),
                    risk.hypertension().contributingFactors());
        }

        @Test
        @DisplayName("Diastolic 100 alone should be enough for medium")
        void shouldGradeGrade2DiastolicMedium() {
            RiskAssessment risk = stratifier.assess(hypertensive(150, 100).build());

            assertEquals(HypertensionRiskLevel.MEDIUM, risk.hypertensionLevel());
        }

        @Test
        @DisplayName("Should report missing blood pressure")
        void shouldReportMissingBloodPressure() {
            PatientProfile profile = PatientProfile.builder().patientId("P9").age(40).build();

            RiskAssessment risk = stratifier.assess(profile);

            assertEquals(HypertensionRiskLevel.LOW, risk.hypertensionLevel());
            assertTrue(risk.missingInputs().contains(RiskStratifier.MISSING_BLOOD_PRESSURE));
        }
    }

    @Nested
    @DisplayName("Diabetes Tests")
    class DiabetesTests {

        private PatientProfile.PatientProfileBuilder diabetic(double hba1c) {
            return PatientProfile.builder()
                    .patientId("P0002")
                    .age(52)
                    .sex(Sex.FEMALE)
                    .diagnoses(Set.of("type 2 diabetes mellitus"))
                    .vitals(TestFixtures.bloodPressure(128, 80))
                    .labs(TestFixtures.hba1c(hba1c));
        }

        @Test
        @DisplayName("Should grade HbA1c bands")
        void shouldGradeHba1cBands() {
            assertEquals(DiabetesControlStatus.GOOD, stratifier.assess(diabetic(6.5).build()).diabetesStatus().orElseThrow());
            assertEquals(DiabetesControlStatus.FAIR, stratifier.assess(diabetic(7.0).build()).diabetesStatus().orElseThrow());
            assertEquals(DiabetesControlStatus.FAIR, stratifier.assess(diabetic(8.9).build()).diabetesStatus().orElseThrow());
            assertEquals(DiabetesControlStatus.POOR, stratifier.assess(diabetic(9.0).build()).diabetesStatus().orElseThrow());
        }

        @Test
        @DisplayName("Poor control should carry a 2-4 week follow-up and count as very high overall")
        void poorControlShouldDriveOverallLevel() {
            RiskAssessment risk = stratifier.assess(diabetic(9.4).build());

            DiseaseRisk diabetes = risk.diabetesRisk().orElseThrow();
            assertEquals(1, diabetes.ruleRow());
            assertEquals(FollowUpInterval.days(14, 28), diabetes.followUp());
            assertEquals(HypertensionRiskLevel.VERY_HIGH, risk.overallLevel());
        }

        @Test
        @DisplayName("Should escalate one band for frequent hypoglycemia")
        void shouldEscalateForHypoglycemia() {
            PatientProfile profile = diabetic(6.5).flags(new ProfileFlags(false, true, false, true)).build();

            RiskAssessment risk = stratifier.assess(profile);

            assertEquals(DiabetesControlStatus.FAIR, risk.diabetesStatus().orElseThrow());
            assertEquals(3, risk.diabetes().ruleRow());
            assertTrue(risk.diabetes().contributingFactors().contains("frequent hypoglycemia"));
        }

        @Test
        @DisplayName("Should escalate a complication but never beyond poor")
        void shouldNotEscalateBeyondPoor() {
            PatientProfile fair = diabetic(7.5).diabetesComplications(Set.of("diabetic nephropathy")).build();
            PatientProfile poor = diabetic(9.5).diabetesComplications(Set.of("diabetic nephropathy")).build();

            assertEquals(DiabetesControlStatus.POOR, stratifier.assess(fair).diabetesStatus().orElseThrow());
            assertEquals(DiabetesControlStatus.POOR, stratifier.assess(poor).diabetesStatus().orElseThrow());
        }

        @Test
        @DisplayName("Should report missing HbA1c only for diagnosed diabetes")
        void shouldReportMissingHba1cForDiabetics() {
            PatientProfile diabeticWithoutLabs = diabetic(7.0).labs(Labs.none()).build();
            PatientProfile nonDiabetic = hypertensive(140, 90).build();

            RiskAssessment diabeticRisk = stratifier.assess(diabeticWithoutLabs);
            RiskAssessment otherRisk = stratifier.assess(nonDiabetic);

            assertTrue(diabeticRisk.diabetesStatus().isEmpty());
            assertTrue(diabeticRisk.missingInputs().contains(RiskStratifier.MISSING_HBA1C));
            assertFalse(otherRisk.missingInputs().contains(RiskStratifier.MISSING_HBA1C));
        }

        @Test
        @DisplayName("A diabetes diagnosis should count as a hypertension risk factor")
        void diabetesShouldCountAsRiskFactor() {
            assertTrue(RiskStratifier.riskFactors(diabetic(6.0).build()).contains("diabetes mellitus"));
        }
    }

    @Test
    @DisplayName("Same profile should yield an equal assessment")
    void shouldBeDeterministic() {
        PatientProfile profile = hypertensive(165, 100).riskFactors(Set.of("smoking", "dyslipidemia")).build();

        assertEquals(stratifier.assess(profile), stratifier.assess(profile));
    }
}
