package com.example.media_analyzer.service;

import com.example.media_analyzer.config.PipelineProperties;
import com.example.media_analyzer.dedup.DedupResult;
import com.example.media_analyzer.dedup.FrameDeduplicator;
import com.example.media_analyzer.dto.media.AnalyzedFrame;
import com.example.media_analyzer.dto.media.MediaProbe;
import com.example.media_analyzer.dto.media.SynthesisResult;
import com.example.media_analyzer.dto.media.TranscriptEnrichment;
import com.example.media_analyzer.engine.Interfaces.TranscriptionEngine;
import com.example.media_analyzer.exception.FrameDecodeException;
import com.example.media_analyzer.exception.JobCancelledException;
import com.example.media_analyzer.exception.MediaProcessingException;
import com.example.media_analyzer.exception.StorageException;
import com.example.media_analyzer.model.AnalysisJob;
import com.example.media_analyzer.sampling.CandidateFrame;
import com.example.media_analyzer.sampling.FileFrameImage;
import com.example.media_analyzer.sampling.FrameSampler;
import com.example.media_analyzer.sampling.VideoSource;
import com.example.media_analyzer.service.Interfaces.AnalysisResultStore;
import com.example.media_analyzer.service.Interfaces.MediaToolkit;
import com.example.media_analyzer.service.Interfaces.StorageService;
import com.example.media_analyzer.util.JsonResponses;
import com.example.media_analyzer.util.MediaKind;
import com.example.media_analyzer.util.PipelineStage;
import com.example.media_analyzer.vision.FrameContext;
import com.example.media_analyzer.vision.FrameDescriber;
import com.example.media_analyzer.vision.FrameDescription;
import com.example.media_analyzer.vision.SampledFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs one analysis job through its stages on the calling thread:
 * <pre>
 * EXTRACTING_AUDIO → TRANSCRIBING → ENRICHING → SAMPLING_FRAMES → DEDUPLICATING → ANALYZING_FRAMES
 *   → SYNTHESIZING → PERSISTING → COMPLETED
 * </pre>
 * Any stage failure moves the job to FAILED. The job workspace is removed on every exit path.
 */
@Service
public class AnalysisPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisPipeline.class);
    private static final int STACK_TOP_FRAMES = 8;

    private final PipelineJobService jobs;
    private final ProgressLogger progress;
    private final StorageService storage;
    private final MediaToolkit media;
    private final TranscriptionEngine transcription;
    private final TranscriptEnricher enricher;
    private final FrameSampler sampler;
    private final FrameDeduplicator deduplicator;
    private final FrameDescriber describer;
    private final FlowSynthesizer synthesizer;
    private final AnalysisResultStore resultStore;
    private final PipelineProperties props;

    public AnalysisPipeline(PipelineJobService jobs,
                            ProgressLogger progress,
                            StorageService storage,
                            MediaToolkit media,
                            TranscriptionEngine transcription,
                            TranscriptEnricher enricher,
                            FrameSampler sampler,
                            FrameDeduplicator deduplicator,
                            FrameDescriber describer,
                            FlowSynthesizer synthesizer,
                            AnalysisResultStore resultStore,
                            PipelineProperties props) {
        this.jobs = jobs;
        this.progress = progress;
        this.storage = storage;
        this.media = media;
        this.transcription = transcription;
        this.enricher = enricher;
        this.sampler = sampler;
        this.deduplicator = deduplicator;
        this.describer = describer;
        this.synthesizer = synthesizer;
        this.resultStore = resultStore;
        this.props = props;
    }

    /**
     * @return {@code true} when the job completed.
     */
    public boolean run(UUID jobId) {
        AnalysisJob job = jobs.getJob(jobId);
        Run run = new Run(job);
        long t0 = System.nanoTime();
        try (JobWorkspace ws = JobWorkspace.create(Path.of(props.getWorkDir()), jobId)) {
            execute(run, ws);
        } catch (JobCancelledException e) {
            LOGGER.warn("PIPELINE cancelled jobId={} stage={}", jobId, run.stage);
            jobs.markFailed(jobId, PipelineJobService.CANCELLED);
            progress.error(jobId, PipelineStage.FAILED, "Job cancelled during " + stageName(run.stage));
            return false;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            LOGGER.error("PIPELINE failed jobId={} stage={} err={}", jobId, run.stage, e.toString(), e);
            jobs.markFailed(jobId, message);
            progress.error(jobId, PipelineStage.FAILED, "Failed during " + stageName(run.stage) + ": " + message);
            progress.error(jobId, PipelineStage.FAILED, "Stack: " + stackTop(e));
            return false;
        }
        LOGGER.info("PIPELINE completed jobId={} frames={} durMs={}", jobId, run.frames.size(), (System.nanoTime() - t0) / 1_000_000);
        return true;
    }

    private void execute(Run run, JobWorkspace ws) throws Exception {
        AnalysisJob job = run.job;
        UUID jobId = job.getId();
        boolean video = job.getMediaKind() == MediaKind.VIDEO;
        String fileName = Path.of(job.getMediaPath()).getFileName().toString();

        enter(run, PipelineStage.EXTRACTING_AUDIO, video ? "Extracting audio track" : "Preparing audio");
        Path source = storage.resolveRaw(job.getMediaPath());
        MediaProbe probe = media.probe(source);
        Path audio = extractAudio(run, source, probe, ws);

        enter(run, PipelineStage.TRANSCRIBING, "Transcribing audio");
        TranscriptionEngine.Result transcript = audio == null
                ? new TranscriptionEngine.Result("", List.of(), "auto", "none")
                : transcription.transcribe(new TranscriptionEngine.Request(audio, props.getLanguage()));
        progress.info(jobId, PipelineStage.TRANSCRIBING, String.format(Locale.ROOT,
                "Transcript ready: %d segments, %d characters, language %s",
                transcript.segments().size(), transcript.text().length(), transcript.lang()));

        enter(run, PipelineStage.ENRICHING, "Identifying topics and keywords");
        TranscriptEnrichment enrichment = enricher.enrich(transcript, probe.durationSeconds(), fileName);
        if (!enrichment.enriched() && enrichment.error() != null) {
            progress.warning(jobId, PipelineStage.ENRICHING, "Enrichment unavailable, using raw transcript: " + enrichment.error());
        } else if (enrichment.enriched()) {
            progress.info(jobId, PipelineStage.ENRICHING, enrichment.topics().size() + " topics, " + enrichment.keywords().size() + " keywords");
        }

        if (video) {
            enter(run, PipelineStage.SAMPLING_FRAMES, "Sampling representative frames");
            VideoSource videoSource = media.openVideo(source, probe, ws.frames());
            List<CandidateFrame> candidates = sampler.sample(videoSource, props.getSampling().toParams());
            progress.info(jobId, PipelineStage.SAMPLING_FRAMES, candidates.size() + " candidate frames");

            enter(run, PipelineStage.DEDUPLICATING, "Removing near-duplicate frames");
            DedupResult dedup = deduplicator.deduplicate(candidates, props.getDedupThreshold(), true);
            progress.info(jobId, PipelineStage.DEDUPLICATING,
                    dedup.unique().size() + " unique frames selected, " + dedup.removedCount() + " duplicates removed");

            enter(run, PipelineStage.ANALYZING_FRAMES, "Analysing " + dedup.unique().size() + " frames");
            analyzeFrames(run, dedup.unique(), transcript, enrichment);
        } else {
            for (PipelineStage s : List.of(PipelineStage.SAMPLING_FRAMES, PipelineStage.DEDUPLICATING, PipelineStage.ANALYZING_FRAMES)) {
                enter(run, s, stageName(s) + " skipped for audio-only media");
            }
        }

        enter(run, PipelineStage.SYNTHESIZING, "Generating the final analysis");
        SynthesisResult synthesis = video
                ? synthesizer.synthesizeVideo(transcript.text(), run.frames, probe.durationSeconds(), fileName, job.getContext())
                : synthesizer.synthesizeAudio(transcript.text(), enrichment, probe.durationSeconds(), fileName, job.getContext(), job.getAnalysisMode());
        if (synthesis.document().has("parse_error")) {
            progress.warning(jobId, PipelineStage.SYNTHESIZING, "Analysis response was not valid JSON, raw text kept");
        }

        enter(run, PipelineStage.PERSISTING, "Saving results");
        resultStore.saveResults(jobId, transcript, enrichment, run.frames, synthesis);

        checkCancelled(run);
        jobs.markCompleted(jobId);
        run.stage = PipelineStage.COMPLETED;
        progress.success(jobId, PipelineStage.COMPLETED, "Analysis completed");
    }

    private Path extractAudio(Run run, Path source, MediaProbe probe, JobWorkspace ws) {
        UUID jobId = run.job.getId();
        if (run.job.getMediaKind() == MediaKind.AUDIO) {
            try {
                return media.extractAudio(source, ws.file("audio.mp3"));
            } catch (MediaProcessingException e) {
                LOGGER.warn("AUDIO conversion failed, using original jobId={} err={}", jobId, e.getMessage());
                progress.warning(jobId, PipelineStage.EXTRACTING_AUDIO, "Conversion failed, transcribing the original file");
                return source;
            }
        }
        if (!probe.hasAudio()) {
            LOGGER.warn("AUDIO no audio stream jobId={}", jobId);
            progress.warning(jobId, PipelineStage.EXTRACTING_AUDIO, "The video has no audio track, continuing without transcript");
            return null;
        }
        return media.extractAudio(source, ws.file("audio.mp3"));
    }

    private void analyzeFrames(Run run, List<CandidateFrame> frames, TranscriptionEngine.Result transcript, TranscriptEnrichment enrichment) {
        UUID jobId = run.job.getId();
        List<String> keywords = enrichment.keywords().stream().limit(props.getMaxKeywords()).toList();
        FrameContext context = new FrameContext(run.job.getContext(), keywords);
        String previous = null;
        int fallbacks = 0;
        try {
            for (int i = 0; i < frames.size(); i++) {
                checkCancelled(run);
                CandidateFrame frame = frames.get(i);
                double ts = frame.timestampSeconds();
                SampledFrame sampled = new SampledFrame(frame,
                        TranscriptContext.window(transcript.segments(), ts, props.getTranscriptWindowSeconds()),
                        TranscriptContext.topicsAt(enrichment.topics(), ts),
                        previous);
                try {
                    FrameDescription description = describer.describe(sampled, context);
                    previous = description.text();
                    String key = PipelineJobService.outPrefix(jobId) + String.format(Locale.ROOT, "frames/frame-%04d.jpg", frame.frameIndex());
                    String url = upload(jobId, frame, key);
                    run.frames.add(new AnalyzedFrame(frame.frameIndex(), ts, frame.frameNumber(), frame.extractionMethod(),
                            frame.sceneChangeScore(), url == null ? null : key, url, description));
                    if (description.fallback()) {
                        fallbacks++;
                        progress.warning(jobId, PipelineStage.ANALYZING_FRAMES, String.format(Locale.ROOT,
                                "Frame %d/%d at %s: provider unavailable or refused, fallback description used",
                                i + 1, frames.size(), JsonResponses.clock(ts)));
                    } else {
                        progress.info(jobId, PipelineStage.ANALYZING_FRAMES, String.format(Locale.ROOT,
                                "Frame %d/%d at %s analysed", i + 1, frames.size(), JsonResponses.clock(ts)));
                    }
                } catch (RuntimeException e) {
                    LOGGER.warn("ANALYZE frame skipped jobId={} idx={} ts={} err={}", jobId, frame.frameIndex(), ts, e.toString());
                    progress.warning(jobId, PipelineStage.ANALYZING_FRAMES, "Frame " + (i + 1) + " skipped: " + e.getMessage());
                } finally {
                    frame.image().release();
                }
            }
        } finally {
            frames.stream().filter(f -> !f.image().isReleased()).forEach(f -> f.image().release());
        }
        LOGGER.info("ANALYZE done jobId={} frames={} fallbacks={}", jobId, run.frames.size(), fallbacks);
    }

    private String upload(UUID jobId, CandidateFrame frame, String key) {
        try {
            if (frame.image() instanceof FileFrameImage file) {
                storage.uploadToOut(file.file(), key);
            } else {
                storage.writeToOut(frame.image().encoded(), key);
            }
            return storage.publicUrl(key);
        } catch (StorageException | FrameDecodeException e) {
            LOGGER.warn("ANALYZE frame upload failed jobId={} idx={} err={}", jobId, frame.frameIndex(), e.toString());
            return null;
        }
    }

    private void enter(Run run, PipelineStage stage, String message) {
        checkCancelled(run);
        jobs.markStage(run.job.getId(), stage);
        run.stage = stage;
        LOGGER.info("PIPELINE stage jobId={} stage={}", run.job.getId(), stage);
        progress.info(run.job.getId(), stage, message);
    }

    private void checkCancelled(Run run) {
        UUID jobId = run.job.getId();
        if (Thread.currentThread().isInterrupted() || jobs.isCancelRequested(jobId)) {
            throw new JobCancelledException(jobId);
        }
    }

    private static String stageName(PipelineStage stage) {
        String s = stage.name().toLowerCase(Locale.ROOT).replace('_', ' ');
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    static String stackTop(Throwable e) {
        return e.toString() + " at " + Arrays.stream(e.getStackTrace())
                .limit(STACK_TOP_FRAMES)
                .map(StackTraceElement::toString)
                .collect(Collectors.joining(" < "));
    }

    private static final class Run {
        final AnalysisJob job;
        final List<AnalyzedFrame> frames = new ArrayList<>();
        PipelineStage stage = PipelineStage.QUEUED;

        Run(AnalysisJob job) {
            this.job = job;
        }
    }
}
