package com.mugpunters.backend.repository;

import com.mugpunters.backend.model.AnalysisReport;
import com.mugpunters.backend.model.RiskLevel;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AnalysisReportRepository extends JpaRepository<AnalysisReport, String> {

    // Active reports of a user, newest first; null filters match everything
    @Query("SELECT r FROM AnalysisReport r WHERE r.userId = :userId AND r.active = true " +
           "AND (:riskLevel IS NULL OR r.riskLevel = :riskLevel) " +
           "AND (:timeframe IS NULL OR r.timeframe = :timeframe) " +
           "AND (:stockSymbol IS NULL OR r.stockSymbol = :stockSymbol) " +
           "ORDER BY r.createdAt DESC")
    List<AnalysisReport> findActiveForUser(@Param("userId") String userId,
                                           @Param("riskLevel") RiskLevel riskLevel,
                                           @Param("timeframe") String timeframe,
                                           @Param("stockSymbol") String stockSymbol);

    // Serialises concurrent re-evaluations of the same report
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM AnalysisReport r WHERE r.id = :id")
    Optional<AnalysisReport> findByIdForUpdate(@Param("id") String id);
}
