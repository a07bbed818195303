package com.medassist.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "patient_info")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PatientInfo {

    @Id
    @Column(name = "patient_id", length = 200)
    private String patientId;

    @Column(nullable = false, length = 50)
    private String name;

    @Column(nullable = false, length = 10)
    private String gender;

    @Column(nullable = false)
    private Integer age;

    @Column(name = "height_cm")
    private Double heightCm;

    @Column(name = "weight_kg")
    private Double weightKg;

    // Generated column in the fact base
    @Column(name = "bmi", insertable = false, updatable = false)
    private Double bmi;

    @Column(name = "update_time")
    private Instant updateTime;
}
