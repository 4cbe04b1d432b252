package com.example.media_analyzer.ffmpeg;

import com.example.media_analyzer.exception.MediaProcessingException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a short-lived external command and collects its combined output.
 */
final class ProcessRunner {
    private static final int MAX_OUTPUT_CHARS = 64_000;

    private ProcessRunner() {}

    record Result(int exitCode, String output) {
        boolean ok() {
            return exitCode == 0;
        }
    }

    static Result run(List<String> cmd, Duration timeout) {
        Process p;
        try {
            p = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new MediaProcessingException("cannot start " + cmd.get(0), e);
        }
        try {
            String output = drain(p.getInputStream());
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                throw new MediaProcessingException(cmd.get(0) + " timed out after " + timeout.toSeconds() + "s");
            }
            return new Result(p.exitValue(), output);
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new MediaProcessingException(cmd.get(0) + " interrupted", e);
        } catch (IOException e) {
            p.destroyForcibly();
            throw new MediaProcessingException("cannot read output of " + cmd.get(0), e);
        }
    }

    private static String drain(InputStream in) throws IOException {
        byte[] bytes = in.readAllBytes();
        String s = new String(bytes, StandardCharsets.UTF_8);
        return s.length() > MAX_OUTPUT_CHARS ? s.substring(s.length() - MAX_OUTPUT_CHARS) : s;
    }

    static String tail(String output, int max) {
        if (output == null) return "";
        String trimmed = output.strip();
        return trimmed.length() <= max ? trimmed : trimmed.substring(trimmed.length() - max);
    }
}
