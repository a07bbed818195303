package com.medassist.model;

/**
 * Declaration order is the delivery order of warnings.
 */
public enum WarningCategory {
    CONTRAINDICATION,
    EMERGENCY,
    MISSING_DATA
}
