package com.example.media_analyzer.service.Interfaces;

import com.example.media_analyzer.dto.media.AnalyzedFrame;
import com.example.media_analyzer.dto.media.SynthesisResult;
import com.example.media_analyzer.dto.media.TranscriptEnrichment;
import com.example.media_analyzer.engine.Interfaces.TranscriptionEngine;

import java.util.List;
import java.util.UUID;

/**
 * Stores the results of one job atomically.
 * Implementations report failures as {@link com.example.media_analyzer.exception.PersistenceFailureException}.
 */
public interface AnalysisResultStore {

    void saveResults(UUID jobId,
                     TranscriptionEngine.Result transcript,
                     TranscriptEnrichment enrichment,
                     List<AnalyzedFrame> frames,
                     SynthesisResult analysis);

    /** Removes every stored result of the job. Idempotent. */
    void clearResults(UUID jobId);

    /** Removes the job row together with its results and progress log. */
    void deleteJob(UUID jobId);
}
