package com.medassist.guideline;

import com.medassist.model.PatientProfile;

public record NumericThreshold(ProfileField field, ComparisonOperator operator, double value) implements ConditionClause {

    public NumericThreshold {
        if (!field.isNumeric()) {
            throw new IllegalArgumentException(field + " is not numeric");
        }
    }

    /**
     * A missing value never satisfies a threshold.
     */
    public boolean isSatisfiedBy(PatientProfile profile) {
        return field.numericValue(profile)
            .map(actual -> operator.test(actual, value))
            .orElse(false);
    }

    @Override
    public boolean isStructured() {
        return true;
    }

    @Override
    public String describe() {
        String number = value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
        return field.name() + " " + operator.getSymbol() + " " + number;
    }
}
