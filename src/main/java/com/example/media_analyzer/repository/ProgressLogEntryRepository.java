package com.example.media_analyzer.repository;

import com.example.media_analyzer.model.ProgressLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface ProgressLogEntryRepository extends JpaRepository<ProgressLogEntry, UUID> {

    @Query("select e from ProgressLogEntry e where e.job.id = :jobId order by e.seq asc")
    List<ProgressLogEntry> findByJobIdOrdered(@Param("jobId") UUID jobId);

    @Query("select coalesce(max(e.seq), 0) from ProgressLogEntry e where e.job.id = :jobId")
    int findMaxSeq(@Param("jobId") UUID jobId);

    @Modifying
    @Query("delete from ProgressLogEntry e where e.job.id = :jobId")
    int deleteByJobId(@Param("jobId") UUID jobId);
}
