package com.mugpunters.backend.repository;

import com.mugpunters.backend.model.ReportPerformance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ReportPerformanceRepository extends JpaRepository<ReportPerformance, Long> {
}
