package com.medassist.repository;

import com.medassist.entity.DiagnosisRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DiagnosisRecordRepository extends JpaRepository<DiagnosisRecord, Long> {
    List<DiagnosisRecord> findByPatientIdOrderByDiagnosisDateDesc(String patientId);
}
