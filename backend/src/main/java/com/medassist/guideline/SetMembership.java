package com.medassist.guideline;

import com.medassist.model.PatientProfile;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

public record SetMembership(ProfileField field, Set<String> values) implements ConditionClause {

    public SetMembership {
        if (field.isNumeric()) {
            throw new IllegalArgumentException(field + " is numeric");
        }
        values = Set.copyOf(values);
    }

    /**
     * Satisfied when any of the profile's values for the field is listed.
     */
    public boolean isSatisfiedBy(PatientProfile profile) {
        return field.setValues(profile).stream().anyMatch(values::contains);
    }

    @Override
    public boolean isStructured() {
        return true;
    }

    @Override
    public String describe() {
        return field.name().toLowerCase(Locale.ROOT).replace('_', '-') + " in " + new TreeSet<>(values);
    }
}
