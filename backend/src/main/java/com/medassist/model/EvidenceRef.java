package com.medassist.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Provenance pointer. The locator is opaque to the reasoning core
 * ({@code table/row}, {@code document#page}, FHIR resource reference).
 */
public record EvidenceRef(EvidenceKind kind, String locator, Instant asOf) {

    public static EvidenceRef guideline(long ruleId, LocalDate effectiveFrom) {
        Instant asOf = effectiveFrom != null ? effectiveFrom.atStartOfDay().toInstant(ZoneOffset.UTC) : null;
        return new EvidenceRef(EvidenceKind.GUIDELINE, "guideline_recommendations/" + ruleId, asOf);
    }

    public static EvidenceRef labRecord(String table, Object row, Instant asOf) {
        return new EvidenceRef(EvidenceKind.LAB_RECORD, table + "/" + row, asOf);
    }

    public static EvidenceRef prescriptionRecord(String table, Object row, Instant asOf) {
        return new EvidenceRef(EvidenceKind.PRESCRIPTION_RECORD, table + "/" + row, asOf);
    }
}
