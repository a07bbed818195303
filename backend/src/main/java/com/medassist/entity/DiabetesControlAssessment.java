package com.medassist.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(name = "diabetes_control_assessment")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DiabetesControlAssessment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "assessment_id")
    private Long assessmentId;

    @Column(name = "patient_id", nullable = false, length = 200)
    private String patientId;

    @Column(name = "assessment_date", nullable = false)
    private LocalDate assessmentDate;

    @Column(name = "fasting_glucose")
    private Double fastingGlucose;

    @Column(name = "postprandial_glucose")
    private Double postprandialGlucose;

    @Column(name = "hba1c")
    private Double hba1c;

    @Column(name = "insulin_usage")
    private Boolean insulinUsage;

    @Column(name = "insulin_type", length = 50)
    private String insulinType;

    @Column(name = "control_status", length = 20)
    private String controlStatus;

    // Comma-separated
    @Column(columnDefinition = "TEXT")
    private String complications;
}
