package com.medassist.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(name = "medication_records")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MedicationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "med_id")
    private Long medId;

    @Column(name = "patient_id", nullable = false, length = 200)
    private String patientId;

    @Column(name = "medication_date", nullable = false)
    private LocalDate medicationDate;

    @Column(name = "drug_name", nullable = false, length = 100)
    private String drugName;

    @Column(name = "drug_class", length = 50)
    private String drugClass;

    @Column(length = 50)
    private String dosage;

    @Column(length = 50)
    private String frequency;

    @Column(name = "is_insulin")
    private Boolean insulin;
}
