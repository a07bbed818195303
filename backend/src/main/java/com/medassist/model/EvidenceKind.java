package com.medassist.model;

public enum EvidenceKind {
    GUIDELINE,
    LAB_RECORD,
    PRESCRIPTION_RECORD,
    PATIENT_RECORD,
    CORPUS_DOCUMENT
}
