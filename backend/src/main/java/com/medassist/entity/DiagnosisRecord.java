package com.medassist.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(name = "diagnosis_records")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DiagnosisRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "diag_id")
    private Long diagId;

    @Column(name = "patient_id", nullable = false, length = 200)
    private String patientId;

    @Column(name = "record_id")
    private Long recordId;

    @Column(name = "diagnosis_date", nullable = false)
    private LocalDate diagnosisDate;

    @Column(name = "diagnosis_code", length = 20)
    private String diagnosisCode;

    @Column(name = "diagnosis_name", nullable = false, length = 100)
    private String diagnosisName;

    @Enumerated(EnumType.STRING)
    @Column(name = "diagnosis_type", nullable = false, length = 20)
    private DiagnosisType diagnosisType;

    @Column(name = "icd10_code", length = 20)
    private String icd10Code;

    public enum DiagnosisType {
        PRIMARY,
        SECONDARY,
        COMPLICATION
    }
}
