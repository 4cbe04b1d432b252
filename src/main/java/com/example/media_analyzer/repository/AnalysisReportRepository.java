package com.example.media_analyzer.repository;

import com.example.media_analyzer.model.AnalysisReport;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface AnalysisReportRepository extends JpaRepository<AnalysisReport, UUID> {

    @Query("select r from AnalysisReport r where r.job.id = :jobId")
    Optional<AnalysisReport> findByJobId(@Param("jobId") UUID jobId);

    @Modifying
    @Query("delete from AnalysisReport r where r.job.id = :jobId")
    int deleteByJobId(@Param("jobId") UUID jobId);
}
