package com.medassist.repository;

import com.medassist.entity.GuidelineRecommendation;
import com.medassist.model.Disease;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface GuidelineRecommendationRepository extends JpaRepository<GuidelineRecommendation, Long> {

    @Query("SELECT g FROM GuidelineRecommendation g WHERE g.active = true " +
           "AND (:diseaseType IS NULL OR g.diseaseType = :diseaseType) " +
           "AND (:effectiveFrom IS NULL OR g.updateDate >= :effectiveFrom) " +
           "ORDER BY g.updateDate DESC, g.ruleId")
    List<GuidelineRecommendation> findActive(@Param("diseaseType") Disease diseaseType,
                                             @Param("effectiveFrom") LocalDate effectiveFrom);
}
