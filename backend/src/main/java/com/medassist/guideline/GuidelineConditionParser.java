package com.medassist.guideline;

import com.medassist.model.DrugClass;
import com.medassist.model.GuidelineRule;
import com.medassist.model.Sex;
import com.medassist.service.TermNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Guideline Condition Parser
 *
 * Turns the free-text condition column of a guideline rule into a {@link ConditionPredicate}.
 * Runs once per rule at corpus load; matching never looks at the raw text again.
 *
 * Grammar, per conjunct (conjuncts split on ";", "," and " and " outside braces):
 * <pre>
 *   SBP &gt; 180 mmHg          numeric threshold (SBP, DBP, HR, HbA1c, FPG, PPG, BMI, age)
 *   diagnosis in {a, b}      set membership (diagnosis, sex, medication-class, flag)
 *   x or y                   free-text tags only, thresholds included
 *   anything else            free-text tag, canonicalised through the term dictionary
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GuidelineConditionParser {

    private static final String OPERATOR = "(>=|<=|=>|=<|==|≥|≤|＞|＜|>|<|=)";
    private static final String UNIT = "(?:\\s*(?:mmhg|mmol/l|mg/dl|kg/m2|kg/m²|bpm|%|years?|y))?";

    private static final Pattern THRESHOLD_PATTERN = Pattern.compile(
        "(?<![\\p{L}\\p{N}])(" + numericTokens() + ")\\s*" + OPERATOR + "\\s*(\\d+(?:\\.\\d+)?)" + UNIT,
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern MEMBERSHIP_PATTERN = Pattern.compile(
        "^\\s*([a-z][a-z\\- ]*?)\\s+in\\s*\\{([^}]*)}\\s*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern AND_PATTERN = Pattern.compile("(?i)^\\s+and\\s+");

    private static final Pattern OR_PATTERN = Pattern.compile("(?i)\\s+or\\s+");

    private final TermNormalizer termNormalizer;

    public ParsedGuidelineRule parse(GuidelineRule rule) {
        ConditionPredicate predicate = parseCondition(rule.condition());
        Set<DrugClass> drugClasses = DrugClass.detect(rule.content());
        log.debug("Parsed rule {} '{}': {} structured clauses, {} tags, classes {}",
            rule.ruleId(), rule.condition(), predicate.specificity(), predicate.tags().size(), drugClasses);
        return new ParsedGuidelineRule(rule, predicate, drugClasses);
    }

    public ConditionPredicate parseCondition(String condition) {
        if (condition == null || condition.isBlank()) {
            return ConditionPredicate.EMPTY;
        }
        List<ConditionClause> structured = new ArrayList<>();
        Set<String> tags = new LinkedHashSet<>();

        for (String conjunct : splitConjuncts(condition)) {
            Matcher membership = MEMBERSHIP_PATTERN.matcher(conjunct);
            if (membership.matches()) {
                Optional<ProfileField> field = ProfileField.fromToken(membership.group(1));
                if (field.isPresent() && !field.get().isNumeric()) {
                    structured.add(new SetMembership(field.get(), memberValues(field.get(), membership.group(2))));
                    continue;
                }
            }

            // An alternative cannot be required, so the whole conjunct only scores
            if (OR_PATTERN.matcher(conjunct).find()) {
                tags.addAll(canonicalTags(conjunct));
                continue;
            }

            Matcher threshold = THRESHOLD_PATTERN.matcher(conjunct);
            StringBuilder remainder = new StringBuilder();
            while (threshold.find()) {
                ProfileField field = ProfileField.fromToken(threshold.group(1)).orElseThrow();
                ComparisonOperator operator = ComparisonOperator.fromSymbol(threshold.group(2)).orElseThrow();
                structured.add(new NumericThreshold(field, operator, Double.parseDouble(threshold.group(3))));
                threshold.appendReplacement(remainder, " ");
            }
            threshold.appendTail(remainder);

            String text = remainder.toString().trim();
            if (!text.isEmpty()) {
                tags.addAll(canonicalTags(text));
            }
        }

        List<ConditionClause> clauses = new ArrayList<>(structured);
        tags.forEach(tag -> clauses.add(new FreeTextTag(tag)));
        return new ConditionPredicate(clauses);
    }

    /**
     * Dictionary terms found in the text, or the whole lower-cased text when none is.
     */
    private Set<String> canonicalTags(String text) {
        Set<String> found = termNormalizer.findTerms(text);
        if (!found.isEmpty()) {
            return found;
        }
        String cleaned = text.replaceAll("[\\p{Punct}&&[^\\-/]]", " ").replaceAll("\\s+", " ").trim();
        return cleaned.isEmpty() ? Set.of() : Set.of(cleaned.toLowerCase(Locale.ROOT));
    }

    private Set<String> memberValues(ProfileField field, String body) {
        Set<String> values = new LinkedHashSet<>();
        for (String raw : body.split("[,;|]")) {
            String value = raw.trim();
            if (value.isEmpty()) {
                continue;
            }
            values.add(switch (field) {
                case DIAGNOSIS -> termNormalizer.canonicalize(value);
                case SEX -> Sex.fromText(value).name().toLowerCase(Locale.ROOT);
                case MEDICATION_CLASS -> ProfileField.drugClassValue(value);
                default -> value.toLowerCase(Locale.ROOT).replace(' ', '-');
            });
        }
        return values;
    }

    /**
     * Splits on ";", ",", full-width separators and the word "and", ignoring separators inside braces.
     */
    static List<String> splitConjuncts(String condition) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        int i = 0;
        while (i < condition.length()) {
            char c = condition.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
            }
            if (depth == 0) {
                if (c == ';' || c == ',' || c == '；' || c == '，') {
                    flush(parts, current);
                    i++;
                    continue;
                }
                Matcher and = AND_PATTERN.matcher(condition).region(i, condition.length());
                if (Character.isWhitespace(c) && and.lookingAt()) {
                    flush(parts, current);
                    i = and.end();
                    continue;
                }
            }
            current.append(c);
            i++;
        }
        flush(parts, current);
        return parts;
    }

    private static void flush(List<String> parts, StringBuilder current) {
        String part = current.toString().trim();
        if (!part.isEmpty()) {
            parts.add(part);
        }
        current.setLength(0);
    }

    private static String numericTokens() {
        return Arrays.stream(ProfileField.values())
            .filter(ProfileField::isNumeric)
            .flatMap(f -> f.tokens().stream())
            .sorted(Comparator.comparingInt(String::length).reversed())
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
    }
}
