package com.example.media_analyzer.repository;

import com.example.media_analyzer.model.FrameRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface FrameRecordRepository extends JpaRepository<FrameRecord, UUID> {

    @Query("select f from FrameRecord f where f.job.id = :jobId order by f.frameIndex asc")
    List<FrameRecord> findByJobIdOrdered(@Param("jobId") UUID jobId);

    @Modifying
    @Query("delete from FrameRecord f where f.job.id = :jobId")
    int deleteByJobId(@Param("jobId") UUID jobId);
}
