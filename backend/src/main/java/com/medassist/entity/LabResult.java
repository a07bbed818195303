package com.medassist.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(name = "lab_results")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LabResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "result_id")
    private Long resultId;

    @Column(name = "patient_id", nullable = false, length = 200)
    private String patientId;

    @Column(name = "test_date", nullable = false)
    private LocalDate testDate;

    @Column(name = "test_type", nullable = false, length = 100)
    private String testType;

    @Column(name = "test_item", nullable = false, length = 100)
    private String testItem;

    @Column(name = "result_value")
    private Double resultValue;

    @Column(length = 20)
    private String unit;

    @Column(name = "is_abnormal")
    private Boolean abnormal;
}
