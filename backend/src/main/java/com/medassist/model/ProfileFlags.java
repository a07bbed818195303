package com.medassist.model;

public record ProfileFlags(boolean pregnant, boolean onInsulin, boolean neurologicSymptoms, boolean frequentHypoglycemia) {

    public static ProfileFlags none() {
        return new ProfileFlags(false, false, false, false);
    }
}
