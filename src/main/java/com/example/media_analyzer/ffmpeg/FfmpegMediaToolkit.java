package com.example.media_analyzer.ffmpeg;

import com.example.media_analyzer.dto.media.MediaProbe;
import com.example.media_analyzer.exception.MediaProcessingException;
import com.example.media_analyzer.exception.SourceUnreadableException;
import com.example.media_analyzer.sampling.VideoSource;
import com.example.media_analyzer.service.Interfaces.MediaToolkit;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

@Service
public class FfmpegMediaToolkit implements MediaToolkit {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegMediaToolkit.class);
    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(60);
    private static final Duration AUDIO_TIMEOUT = Duration.ofMinutes(30);

    private final String ffmpegBin;
    private final String ffprobeBin;
    private final ObjectMapper mapper;

    public FfmpegMediaToolkit(@Value("${ffmpeg.binary:ffmpeg}") String ffmpegBin,
                              @Value("${ffmpeg.probe-binary:ffprobe}") String ffprobeBin,
                              ObjectMapper mapper) {
        this.ffmpegBin = ffmpegBin;
        this.ffprobeBin = ffprobeBin;
        this.mapper = mapper;
    }

    @Override
    public MediaProbe probe(Path media) {
        if (!Files.isRegularFile(media)) {
            throw new SourceUnreadableException("media not found: " + media.getFileName());
        }
        List<String> cmd = List.of(ffprobeBin, "-v", "error",
                "-print_format", "json", "-show_format", "-show_streams",
                media.toString());
        ProcessRunner.Result res;
        try {
            res = ProcessRunner.run(cmd, PROBE_TIMEOUT);
        } catch (MediaProcessingException e) {
            throw new SourceUnreadableException("ffprobe failed for " + media.getFileName(), e);
        }
        if (!res.ok()) {
            throw new SourceUnreadableException("ffprobe exit=" + res.exitCode() + " file=" + media.getFileName()
                    + " out=" + ProcessRunner.tail(res.output(), 400));
        }
        try {
            MediaProbe probe = parseProbe(mapper.readTree(res.output()));
            LOGGER.info("PROBE file={} duration={}s video={} audio={} fps={} frames={}",
                    media.getFileName(), probe.durationSeconds(), probe.hasVideo(), probe.hasAudio(), probe.fps(), probe.frameCount());
            return probe;
        } catch (JsonProcessingException e) {
            throw new SourceUnreadableException("ffprobe output unreadable for " + media.getFileName(), e);
        }
    }

    static MediaProbe parseProbe(JsonNode root) {
        double duration = parseDouble(root.path("format").path("duration").asText(""));
        JsonNode video = null;
        boolean audio = false;
        for (JsonNode s : root.path("streams")) {
            String type = s.path("codec_type").asText("");
            if ("video".equals(type) && video == null && s.path("disposition").path("attached_pic").asInt(0) == 0) {
                video = s;
            } else if ("audio".equals(type)) {
                audio = true;
            }
        }
        if (video == null) {
            return new MediaProbe(duration, false, audio, 0, 0, 0, 0);
        }
        double fps = parseRate(video.path("avg_frame_rate").asText(""));
        if (fps <= 0) {
            fps = parseRate(video.path("r_frame_rate").asText(""));
        }
        double streamDuration = parseDouble(video.path("duration").asText(""));
        if (duration <= 0) {
            duration = streamDuration;
        }
        long frames = video.path("nb_frames").asLong(0);
        if (frames <= 0 && fps > 0 && duration > 0) {
            frames = (long) Math.floor(duration * fps);
        }
        return new MediaProbe(duration, true, audio, fps, frames,
                video.path("width").asInt(0), video.path("height").asInt(0));
    }

    static double parseRate(String rate) {
        if (rate == null || rate.isBlank()) return 0;
        int slash = rate.indexOf('/');
        if (slash < 0) return parseDouble(rate);
        double num = parseDouble(rate.substring(0, slash));
        double den = parseDouble(rate.substring(slash + 1));
        return den > 0 ? num / den : 0;
    }

    private static double parseDouble(String s) {
        if (s == null || s.isBlank() || "N/A".equals(s)) return 0;
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    @Override
    public Path extractAudio(Path media, Path targetMp3) {
        List<String> cmd = List.of(ffmpegBin, "-hide_banner", "-nostats", "-loglevel", "error",
                "-i", media.toString(),
                "-vn", "-ac", "1", "-ar", "16000",
                "-acodec", "libmp3lame", "-b:a", "64k",
                "-y", targetMp3.toString());
        long t0 = System.nanoTime();
        ProcessRunner.Result res = ProcessRunner.run(cmd, AUDIO_TIMEOUT);
        if (!res.ok() || !Files.isRegularFile(targetMp3)) {
            throw new MediaProcessingException("ffmpeg audio extraction failed exit=" + res.exitCode()
                    + " out=" + ProcessRunner.tail(res.output(), 400));
        }
        LOGGER.info("AUDIO extracted file={} durMs={}", targetMp3.getFileName(), (System.nanoTime() - t0) / 1_000_000);
        return targetMp3;
    }

    @Override
    public VideoSource openVideo(Path video, MediaProbe probe, Path frameDir) {
        if (!probe.hasVideo()) {
            throw new SourceUnreadableException("no video stream in " + video.getFileName());
        }
        return new FfmpegVideoSource(ffmpegBin, video, probe, frameDir);
    }
}
