package com.medassist.model;

public enum WarningSeverity {
    INFO,
    CAUTION,
    CRITICAL
}
