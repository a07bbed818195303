package com.medassist.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

/**
 * Recorded blood-pressure assessment. Term columns hold comma-separated lists.
 */
@Entity
@Table(name = "hypertension_risk_assessment")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HypertensionRiskAssessment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "assessment_id")
    private Long assessmentId;

    @Column(name = "patient_id", nullable = false, length = 200)
    private String patientId;

    @Column(name = "assessment_date", nullable = false)
    private LocalDate assessmentDate;

    @Column(nullable = false)
    private Double sbp;

    @Column(nullable = false)
    private Double dbp;

    @Column(name = "heart_rate")
    private Integer heartRate;

    @Column(name = "risk_factors", columnDefinition = "TEXT")
    private String riskFactors;

    @Column(name = "target_organs_damage", columnDefinition = "TEXT")
    private String targetOrgansDamage;

    @Column(name = "clinical_conditions", columnDefinition = "TEXT")
    private String clinicalConditions;

    @Column(name = "risk_level", length = 20)
    private String riskLevel;

    @Column(name = "follow_up_plan", columnDefinition = "TEXT")
    private String followUpPlan;
}
