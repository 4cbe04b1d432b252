package com.example.media_analyzer.repository;

import com.example.media_analyzer.model.Transcript;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface TranscriptRepository extends JpaRepository<Transcript, UUID> {

    @Query("select t from Transcript t where t.job.id = :jobId")
    Optional<Transcript> findByJobId(@Param("jobId") UUID jobId);

    @Modifying
    @Query("delete from Transcript t where t.job.id = :jobId")
    int deleteByJobId(@Param("jobId") UUID jobId);
}
