package com.medassist.guideline;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.medassist.TestFixtures;
import com.medassist.model.Disease;
import com.medassist.model.DrugClass;
import com.medassist.model.GuidelineRule;

@DisplayName("GuidelineConditionParser Tests")
class GuidelineConditionParserTest {

    private GuidelineConditionParser parser;

    @BeforeEach
    void setUp() {
        parser = new GuidelineConditionParser(TestFixtures.termNormalizer());
    }

    @Nested
    @DisplayName("Threshold Tests")
    class ThresholdTests {

        @Test
        @DisplayName("Should parse a bounded SBP range and keep the remainder as a tag")
        void shouldParseBoundedRange() {
            // Act
            ConditionPredicate predicate = parser.parseCondition("SBP >= 140, SBP < 160, no other risk factors");

            // Assert
            assertEquals(List.of(
                    new NumericThreshold(ProfileField.SBP, ComparisonOperator.GREATER_OR_EQUAL, 140),
                    new NumericThreshold(ProfileField.SBP, ComparisonOperator.LESS_THAN, 160)),
                    predicate.structuredClauses());
            assertEquals(2, predicate.specificity());
            assertEquals(List.of(new FreeTextTag("no other risk factors")), predicate.tags());
        }

        @Test
        @DisplayName("Should strip units and canonicalise the free text")
        void shouldStripUnits() {
            ConditionPredicate predicate = parser.parseCondition("SBP > 180 mmHg, hypertensive emergency");

            assertEquals(List.of(new NumericThreshold(ProfileField.SBP, ComparisonOperator.GREATER_THAN, 180)),
                    predicate.structuredClauses());
            assertEquals(List.of(new FreeTextTag("hypertensive emergency")), predicate.tags());
        }

        @Test
        @DisplayName("Should accept Unicode operators and percent units")
        void shouldAcceptUnicodeOperators() {
            ConditionPredicate predicate = parser.parseCondition("HbA1c ≥ 9.0%；DBP≤90");

            assertEquals(List.of(
                    new NumericThreshold(ProfileField.HBA1C, ComparisonOperator.GREATER_OR_EQUAL, 9.0),
                    new NumericThreshold(ProfileField.DBP, ComparisonOperator.LESS_OR_EQUAL, 90)),
                    predicate.structuredClauses());
            assertTrue(predicate.tags().isEmpty());
        }

        @Test
        @DisplayName("Should split conjuncts on the word and")
        void shouldSplitOnAnd() {
            ConditionPredicate predicate = parser.parseCondition("age >= 65 and BMI >= 28");

            assertEquals(List.of(
                    new NumericThreshold(ProfileField.AGE, ComparisonOperator.GREATER_OR_EQUAL, 65),
                    new NumericThreshold(ProfileField.BMI, ComparisonOperator.GREATER_OR_EQUAL, 28)),
                    predicate.structuredClauses());
        }

        @Test
        @DisplayName("Should turn the recognised term of a remainder into a tag")
        void shouldTagRecognisedTerm() {
            ConditionPredicate predicate = parser.parseCondition(
                    "HbA1c >= 7.0%, HbA1c < 9.0%, poorly controlled on metformin");

            assertEquals(2, predicate.specificity());
            assertEquals(List.of(new FreeTextTag("metformin")), predicate.tags());
        }
    }

    @Nested
    @DisplayName("Membership Tests")
    class MembershipTests {

        @Test
        @DisplayName("Should canonicalise diagnosis members")
        void shouldCanonicaliseDiagnosisMembers() {
            ConditionPredicate predicate = parser.parseCondition("diagnosis in {CHD, CVA}");

            assertEquals(List.of(new SetMembership(ProfileField.DIAGNOSIS, Set.of("coronary heart disease", "stroke"))),
                    predicate.clauses());
        }

        @Test
        @DisplayName("Should normalise sex, flag and medication-class members")
        void shouldNormaliseOtherMembers() {
            ConditionPredicate predicate = parser.parseCondition(
                    "sex in {F}; flag in {pregnant}; medication class in {ACE inhibitor}");

            assertEquals(List.of(
                    new SetMembership(ProfileField.SEX, Set.of("female")),
                    new SetMembership(ProfileField.FLAG, Set.of(ProfileField.FLAG_PREGNANT)),
                    new SetMembership(ProfileField.MEDICATION_CLASS, Set.of(DrugClass.ACE_INHIBITOR.name()))),
                    predicate.clauses());
        }

        @Test
        @DisplayName("Should not split inside braces")
        void shouldNotSplitInsideBraces() {
            assertEquals(List.of("diagnosis in {a, b; c}", "SBP > 140"),
                    GuidelineConditionParser.splitConjuncts("diagnosis in {a, b; c}, SBP > 140"));
        }
    }

    @Nested
    @DisplayName("Free-text Tests")
    class FreeTextTests {

        @Test
        @DisplayName("A disjunction should never become a required clause")
        void disjunctionShouldOnlyScore() {
            ConditionPredicate predicate = parser.parseCondition("SBP >= 160 or grade 1 with target organ damage");

            assertEquals(0, predicate.specificity());
            assertFalse(predicate.tags().isEmpty());
        }

        @Test
        @DisplayName("Should return the empty predicate for blank conditions")
        void shouldReturnEmptyForBlank() {
            assertSame(ConditionPredicate.EMPTY, parser.parseCondition("  "));
            assertSame(ConditionPredicate.EMPTY, parser.parseCondition(null));
        }
    }

    @Test
    @DisplayName("parse() should extract the drug classes of the rule content")
    void parseShouldExtractDrugClasses() {
        // Arrange
        List<GuidelineRule> rules = TestFixtures.seedRules();

        // Act
        ParsedGuidelineRule combination = parser.parse(rules.get(1));
        ParsedGuidelineRule insulin = parser.parse(rules.get(5));

        // Assert
        assertEquals(Set.of(DrugClass.ACE_INHIBITOR, DrugClass.ANGIOTENSIN_RECEPTOR_BLOCKER,
                DrugClass.CALCIUM_CHANNEL_BLOCKER), combination.drugClasses());
        assertEquals(Set.of(DrugClass.INSULIN), insulin.drugClasses());
        assertEquals("guideline_recommendations/6", insulin.evidenceRef().locator());
    }

    @Test
    @DisplayName("parse() should keep the rule it was given")
    void parseShouldKeepRule() {
        GuidelineRule rule = TestFixtures.rule(42, "Stroke", Disease.STROKE, "diagnosis in {stroke}", "Aspirin plus a statin",
                LocalDate.of(2022, 9, 1));

        assertSame(rule, parser.parse(rule).rule());
    }
}
