package com.example.media_analyzer.sampling;

import com.example.media_analyzer.exception.SourceUnreadableException;
import com.example.media_analyzer.util.ExtractionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks a bounded set of representative frames from a video.
 * <p>
 * A uniform coverage pass guarantees the whole duration is represented; a histogram based scene scan then adds
 * frames at hard transitions that fall between the uniform samples. The result is sorted by timestamp and indexed
 * {@code 0..n-1} in that order.
 */
public class FrameSampler {
    private static final Logger LOGGER = LoggerFactory.getLogger(FrameSampler.class);

    static final double UNIFORM_MIN_GAP_SEC = 1.0;
    static final double SCENE_MIN_GAP_SEC = 2.0;
    static final int DEGENERATE_MIN_FRAMES = 3;
    static final double DEGENERATE_MIN_DURATION_SEC = 10.0;

    public List<CandidateFrame> sample(VideoSource video, SamplingParams params) {
        VideoInfo info = video.info();
        if (info.frameCount() <= 0 || info.fps() <= 0) {
            throw new SourceUnreadableException("video has no readable frames (frames=" + info.frameCount() + ", fps=" + info.fps() + ")");
        }
        double duration = info.durationSeconds();
        int target = clamp((int) (duration / params.targetIntervalSeconds()), params.minFrames(), params.maxFrames());
        LOGGER.info("SAMPLE start duration={}s fps={} frames={} target={}", round2(duration), round2(info.fps()), info.frameCount(), target);

        List<CandidateFrame> frames = new ArrayList<>(uniformPass(video, info, target));
        List<Double> accepted = new ArrayList<>();
        frames.forEach(f -> accepted.add(f.timestampSeconds()));

        if (frames.size() < params.maxFrames()) {
            frames.addAll(scenePass(video, info, params.sceneThreshold(), params.maxFrames() - frames.size(), accepted));
        }

        if (frames.size() < DEGENERATE_MIN_FRAMES && duration > DEGENERATE_MIN_DURATION_SEC) {
            LOGGER.info("SAMPLE degenerate frames={} duration={}s, falling back to uniform count={}", frames.size(), round2(duration), params.maxFrames());
            frames.forEach(f -> f.image().release());
            frames = evenlySpaced(video, info, params.maxFrames());
        }

        if (frames.isEmpty()) {
            throw new SourceUnreadableException("no frame of the video could be decoded");
        }

        frames.sort(Comparator.comparingDouble(CandidateFrame::timestampSeconds));
        List<CandidateFrame> indexed = new ArrayList<>(frames.size());
        for (int i = 0; i < frames.size(); i++) {
            indexed.add(frames.get(i).withIndex(i));
        }
        LOGGER.info("SAMPLE done frames={} uniform={} scene={}", indexed.size(),
                indexed.stream().filter(f -> f.extractionMethod() == ExtractionMethod.UNIFORM).count(),
                indexed.stream().filter(f -> f.extractionMethod() == ExtractionMethod.SCENE_CHANGE).count());
        return indexed;
    }

    private List<CandidateFrame> uniformPass(VideoSource video, VideoInfo info, int target) {
        List<CandidateFrame> out = new ArrayList<>();
        List<Double> taken = new ArrayList<>();
        double interval = info.durationSeconds() / (target + 1);
        for (int k = 1; k <= target; k++) {
            long pos = Math.min((long) (interval * k * info.fps()), info.frameCount() - 1);
            double ts = round2(pos / info.fps());
            if (isNear(taken, ts, UNIFORM_MIN_GAP_SEC)) {
                continue;
            }
            FrameImage image = video.grab(pos);
            if (image == null) {
                LOGGER.debug("SAMPLE uniform frame unreadable pos={}", pos);
                continue;
            }
            out.add(new CandidateFrame(out.size(), ts, pos, image, ExtractionMethod.UNIFORM, 0));
            taken.add(ts);
        }
        return out;
    }

    private List<CandidateFrame> scenePass(VideoSource video, VideoInfo info, double threshold, int maxAdditional, List<Double> accepted) {
        int step = Math.max(1, (int) (info.fps() / 2));
        List<SceneHit> hits = new ArrayList<>();
        double[][] previous = new double[1][];

        video.scan(step, (frameNumber, luma) -> {
            double[] hist = LumaHistogram.of(luma);
            if (previous[0] != null) {
                double score = LumaHistogram.sceneChangeScore(previous[0], hist);
                double ts = round2(frameNumber / info.fps());
                if (score > threshold && !isNear(accepted, ts, SCENE_MIN_GAP_SEC)) {
                    hits.add(new SceneHit(frameNumber, ts, round2(score)));
                    accepted.add(ts);
                    LOGGER.debug("SAMPLE scene change ts={}s score={}", ts, round2(score));
                }
            }
            previous[0] = hist;
            return hits.size() < maxAdditional;
        });

        List<CandidateFrame> out = new ArrayList<>(hits.size());
        for (SceneHit hit : hits) {
            FrameImage image = video.grab(hit.frameNumber());
            if (image == null) {
                continue;
            }
            out.add(new CandidateFrame(out.size(), hit.timestamp(), hit.frameNumber(), image, ExtractionMethod.SCENE_CHANGE, hit.score()));
        }
        return out;
    }

    private List<CandidateFrame> evenlySpaced(VideoSource video, VideoInfo info, int count) {
        List<CandidateFrame> out = new ArrayList<>();
        long interval = info.frameCount() / (count + 1);
        long last = -1;
        for (int i = 0; i < count; i++) {
            long pos = Math.min(interval * (i + 1), info.frameCount() - 1);
            if (pos == last) {
                continue;
            }
            last = pos;
            FrameImage image = video.grab(pos);
            if (image == null) {
                continue;
            }
            out.add(new CandidateFrame(out.size(), round2(pos / info.fps()), pos, image, ExtractionMethod.UNIFORM, 0));
        }
        return out;
    }

    private static boolean isNear(List<Double> timestamps, double ts, double gap) {
        for (double t : timestamps) {
            if (Math.abs(t - ts) < gap) {
                return true;
            }
        }
        return false;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(value, max));
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private record SceneHit(long frameNumber, double timestamp, double score) {}
}
