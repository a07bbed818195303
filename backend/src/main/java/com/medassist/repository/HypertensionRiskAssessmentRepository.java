package com.medassist.repository;

import com.medassist.entity.HypertensionRiskAssessment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface HypertensionRiskAssessmentRepository extends JpaRepository<HypertensionRiskAssessment, Long> {
    Optional<HypertensionRiskAssessment> findFirstByPatientIdOrderByAssessmentDateDesc(String patientId);
}
