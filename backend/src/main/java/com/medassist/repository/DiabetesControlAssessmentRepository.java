package com.medassist.repository;

import com.medassist.entity.DiabetesControlAssessment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DiabetesControlAssessmentRepository extends JpaRepository<DiabetesControlAssessment, Long> {
    Optional<DiabetesControlAssessment> findFirstByPatientIdOrderByAssessmentDateDesc(String patientId);
}
