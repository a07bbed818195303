package com.medassist.model;

/**
 * Ordered grade shared by the per-disease level enums.
 */
public interface RiskGrade {

    /** Position in the disease's ordering, 0 = least severe. */
    int rank();

    String label();
}
