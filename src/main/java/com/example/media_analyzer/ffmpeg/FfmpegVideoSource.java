package com.example.media_analyzer.ffmpeg;

import com.example.media_analyzer.dto.media.MediaProbe;
import com.example.media_analyzer.exception.MediaProcessingException;
import com.example.media_analyzer.sampling.FileFrameImage;
import com.example.media_analyzer.sampling.FrameImage;
import com.example.media_analyzer.sampling.VideoInfo;
import com.example.media_analyzer.sampling.VideoSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Video access through the ffmpeg binary. Single frames are grabbed by seeking; the scene scan pipes
 * downscaled grayscale frames from one long-running process.
 */
class FfmpegVideoSource implements VideoSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegVideoSource.class);
    private static final Duration GRAB_TIMEOUT = Duration.ofSeconds(60);
    static final int SCAN_WIDTH = 160;

    private final String ffmpegBin;
    private final Path video;
    private final VideoInfo info;
    private final Path frameDir;

    FfmpegVideoSource(String ffmpegBin, Path video, MediaProbe probe, Path frameDir) {
        this.ffmpegBin = ffmpegBin;
        this.video = video;
        this.info = new VideoInfo(probe.fps(), probe.frameCount(), probe.width(), probe.height(),
                probe.durationSeconds() > 0 ? probe.durationSeconds() : (probe.fps() > 0 ? probe.frameCount() / probe.fps() : 0));
        this.frameDir = frameDir;
    }

    @Override
    public VideoInfo info() {
        return info;
    }

    @Override
    public FrameImage grab(long frameNumber) {
        Path out = frameDir.resolve("frame-" + UUID.randomUUID() + ".jpg");
        String ts = String.format(Locale.ROOT, "%.3f", frameNumber / info.fps());
        List<String> cmd = List.of(ffmpegBin, "-hide_banner", "-nostats", "-loglevel", "error",
                "-ss", ts, "-i", video.toString(),
                "-frames:v", "1", "-q:v", "2",
                "-y", out.toString());
        ProcessRunner.Result res = ProcessRunner.run(cmd, GRAB_TIMEOUT);
        try {
            if (!res.ok() || !Files.isRegularFile(out) || Files.size(out) == 0) {
                LOGGER.debug("GRAB failed frame={} ts={} exit={} out={}", frameNumber, ts, res.exitCode(), ProcessRunner.tail(res.output(), 200));
                Files.deleteIfExists(out);
                return null;
            }
        } catch (IOException e) {
            throw new MediaProcessingException("cannot inspect grabbed frame " + out.getFileName(), e);
        }
        return new FileFrameImage(out);
    }

    @Override
    public void scan(int step, LumaVisitor visitor) {
        int width = Math.min(SCAN_WIDTH, Math.max(2, info.width()));
        int height = info.width() > 0 ? Math.max(2, (int) Math.round((double) info.height() * width / info.width())) : width;
        height += height % 2;
        String filter = "select='not(mod(n\\," + step + "))',scale=" + width + ":" + height + ",format=gray";
        List<String> cmd = List.of(ffmpegBin, "-hide_banner", "-nostats", "-loglevel", "error",
                "-i", video.toString(),
                "-vf", filter, "-vsync", "vfr",
                "-f", "rawvideo", "-pix_fmt", "gray", "-");

        Process p;
        try {
            p = new ProcessBuilder(cmd).redirectError(ProcessBuilder.Redirect.DISCARD).start();
        } catch (IOException e) {
            throw new MediaProcessingException("cannot start ffmpeg scan", e);
        }
        int frameSize = width * height;
        long visited = 0;
        boolean stopped = false;
        try (InputStream in = p.getInputStream()) {
            byte[] buf = new byte[frameSize];
            while (in.readNBytes(buf, 0, frameSize) == frameSize) {
                if (!visitor.visit(visited * step, buf.clone())) {
                    stopped = true;
                    break;
                }
                visited++;
            }
        } catch (IOException e) {
            p.destroyForcibly();
            throw new MediaProcessingException("ffmpeg scan read failed after frames=" + visited, e);
        }
        finish(p, stopped);
        LOGGER.debug("SCAN done step={} visited={} stopped={}", step, visited, stopped);
    }

    private void finish(Process p, boolean stopped) {
        if (stopped) {
            p.destroy();
        }
        try {
            if (!p.waitFor(GRAB_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                p.destroyForcibly();
            }
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new MediaProcessingException("ffmpeg scan interrupted", e);
        }
    }
}
