package com.example.media_analyzer.service;

import com.example.media_analyzer.dto.media.AnalyzedFrame;
import com.example.media_analyzer.dto.media.SynthesisResult;
import com.example.media_analyzer.dto.media.TranscriptEnrichment;
import com.example.media_analyzer.engine.Interfaces.TranscriptionEngine;
import com.example.media_analyzer.exception.PersistenceFailureException;
import com.example.media_analyzer.model.AnalysisJob;
import com.example.media_analyzer.model.AnalysisReport;
import com.example.media_analyzer.model.FrameRecord;
import com.example.media_analyzer.model.Transcript;
import com.example.media_analyzer.repository.AnalysisJobRepository;
import com.example.media_analyzer.repository.AnalysisReportRepository;
import com.example.media_analyzer.repository.FrameRecordRepository;
import com.example.media_analyzer.repository.ProgressLogEntryRepository;
import com.example.media_analyzer.repository.TranscriptRepository;
import com.example.media_analyzer.service.Interfaces.AnalysisResultStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Service
public class JpaAnalysisResultStore implements AnalysisResultStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(JpaAnalysisResultStore.class);

    private final AnalysisJobRepository jobRepo;
    private final TranscriptRepository transcriptRepo;
    private final FrameRecordRepository frameRepo;
    private final AnalysisReportRepository reportRepo;
    private final ProgressLogEntryRepository progressRepo;
    private final ObjectMapper mapper;
    private final TransactionTemplate tx;

    public JpaAnalysisResultStore(AnalysisJobRepository jobRepo,
                                  TranscriptRepository transcriptRepo,
                                  FrameRecordRepository frameRepo,
                                  AnalysisReportRepository reportRepo,
                                  ProgressLogEntryRepository progressRepo,
                                  ObjectMapper mapper,
                                  PlatformTransactionManager txManager) {
        this.jobRepo = jobRepo;
        this.transcriptRepo = transcriptRepo;
        this.frameRepo = frameRepo;
        this.reportRepo = reportRepo;
        this.progressRepo = progressRepo;
        this.mapper = mapper;
        this.tx = new TransactionTemplate(txManager);
    }

    @Override
    public void saveResults(UUID jobId,
                            TranscriptionEngine.Result transcript,
                            TranscriptEnrichment enrichment,
                            List<AnalyzedFrame> frames,
                            SynthesisResult analysis) {
        try {
            tx.executeWithoutResult(status -> {
                AnalysisJob job = jobRepo.getReferenceById(jobId);
                deleteAll(jobId);

                Transcript t = new Transcript(job, transcript.lang(), transcript.provider());
                t.setText(transcript.text());
                t.setSegments(mapper.valueToTree(transcript.segments()));
                t.setEnriched(enrichment.enriched());
                t.setEnrichment(enrichmentJson(enrichment));
                transcriptRepo.save(t);

                List<FrameRecord> records = new ArrayList<>(frames.size());
                for (AnalyzedFrame f : frames) {
                    FrameRecord r = new FrameRecord(job, f.frameIndex(), f.timestampSeconds(), f.frameNumber(),
                            f.extractionMethod(), f.sceneChangeScore());
                    r.setImageKey(f.imageKey());
                    r.setImageUrl(f.imageUrl());
                    r.setDescription(f.description().text());
                    r.setFallback(f.description().fallback());
                    r.setExternalCalls(f.description().externalCalls());
                    records.add(r);
                }
                frameRepo.saveAll(records);

                reportRepo.save(new AnalysisReport(job, analysis.mode(), analysis.summary(), analysis.document()));
            });
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            throw new PersistenceFailureException("Saving results of job " + jobId + " failed", e);
        }
        LOGGER.info("STORE saved jobId={} frames={} mode={}", jobId, frames.size(), analysis.mode());
    }

    @Override
    public void clearResults(UUID jobId) {
        try {
            tx.executeWithoutResult(status -> deleteAll(jobId));
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            throw new PersistenceFailureException("Clearing results of job " + jobId + " failed", e);
        }
        LOGGER.info("STORE cleared jobId={}", jobId);
    }

    @Override
    public void deleteJob(UUID jobId) {
        try {
            tx.executeWithoutResult(status -> {
                deleteAll(jobId);
                progressRepo.deleteByJobId(jobId);
                jobRepo.deleteById(jobId);
            });
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            throw new PersistenceFailureException("Deleting job " + jobId + " failed", e);
        }
        LOGGER.info("STORE deleted jobId={}", jobId);
    }

    private void deleteAll(UUID jobId) {
        reportRepo.deleteByJobId(jobId);
        frameRepo.deleteByJobId(jobId);
        transcriptRepo.deleteByJobId(jobId);
    }

    private ObjectNode enrichmentJson(TranscriptEnrichment e) {
        ObjectNode node = mapper.createObjectNode();
        node.put("enriched", e.enriched());
        node.put("semantic_summary", e.semanticSummary());
        node.set("topics", mapper.valueToTree(e.topics()));
        node.set("keywords", mapper.valueToTree(e.keywords()));
        node.put("tone", e.tone());
        node.put("speakers_detected", e.speakersDetected());
        if (e.error() != null) {
            node.put("enrichment_error", e.error());
        }
        return node;
    }
}
