package com.example.media_analyzer.repository;

import com.example.media_analyzer.model.AnalysisJob;
import com.example.media_analyzer.util.PipelineStage;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface AnalysisJobRepository extends JpaRepository<AnalysisJob, UUID> {
    // PostgreSQL only: rows stay locked until the claiming transaction commits.
    @Query(value = """
        SELECT id FROM analysis_job
        WHERE stage = 'QUEUED'
        ORDER BY created_at
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<UUID> selectQueuedIdsForUpdate(@Param("limit") int limit);

    @Query("select j.cancelRequested from AnalysisJob j where j.id = :id")
    Boolean findCancelRequested(@Param("id") UUID id);

    Page<AnalysisJob> findAllByOrderByCreatedAtDesc(Pageable pageable);

    Page<AnalysisJob> findByStageOrderByCreatedAtDesc(PipelineStage stage, Pageable pageable);

    boolean existsByMediaPath(String mediaPath);
}
