package com.medassist.entity;

import com.medassist.model.Disease;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(name = "guideline_recommendations")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GuidelineRecommendation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "rule_id")
    private Long ruleId;

    @Column(name = "guideline_name", nullable = false, length = 200)
    private String guidelineName;

    @Enumerated(EnumType.STRING)
    @Column(name = "disease_type", nullable = false, length = 40)
    private Disease diseaseType;

    @Column(name = "patient_condition", columnDefinition = "TEXT")
    private String patientCondition;

    @Column(name = "recommendation_level", nullable = false, length = 8)
    private String recommendationLevel;

    @Column(name = "recommendation_content", nullable = false, columnDefinition = "TEXT")
    private String recommendationContent;

    @Column(name = "evidence_source", length = 200)
    private String evidenceSource;

    @Column(name = "update_date")
    private LocalDate updateDate;

    @Column(name = "is_active")
    @Builder.Default
    private Boolean active = Boolean.TRUE;
}
