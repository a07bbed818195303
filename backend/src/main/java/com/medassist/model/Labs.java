package com.medassist.model;

import java.time.Instant;

/**
 * Latest glycemic labs: glucose in mmol/L, HbA1c in percent.
 */
public record Labs(Double fastingGlucose, Double postprandialGlucose, Double hba1c, Instant measuredAt) {

    public static Labs none() {
        return new Labs(null, null, null, null);
    }

    public boolean isEmpty() {
        return fastingGlucose == null && postprandialGlucose == null && hba1c == null;
    }
}
