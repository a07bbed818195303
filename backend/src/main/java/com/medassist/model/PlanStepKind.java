package com.medassist.model;

public enum PlanStepKind {
    GUIDELINE,
    SAFETY_SUBSTITUTE,
    REFERRAL,
    NO_GUIDELINE_MATCH
}
