package com.medassist.model;

import java.time.Duration;

/**
 * Follow-up window. An immediate follow-up has both bounds at zero.
 */
public record FollowUpInterval(Duration minimum, Duration maximum) {

    public static FollowUpInterval immediate() {
        return new FollowUpInterval(Duration.ZERO, Duration.ZERO);
    }

    public static FollowUpInterval days(long minimum, long maximum) {
        return new FollowUpInterval(Duration.ofDays(minimum), Duration.ofDays(maximum));
    }

    public boolean isImmediate() {
        return maximum.isZero();
    }
}
