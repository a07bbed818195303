package com.medassist.model;

import java.time.Instant;

/**
 * Latest vital signs. Any value may be absent.
 */
public record Vitals(Double systolic, Double diastolic, Integer heartRate, Instant measuredAt) {

    public static Vitals none() {
        return new Vitals(null, null, null, null);
    }

    public boolean hasBloodPressure() {
        return systolic != null && diastolic != null;
    }

    public boolean isEmpty() {
        return systolic == null && diastolic == null && heartRate == null;
    }
}
