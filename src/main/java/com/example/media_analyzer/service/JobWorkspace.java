package com.example.media_analyzer.service;

import com.example.media_analyzer.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Job-scoped scratch directory for the audio track and frame images. Closing it removes the whole tree.
 */
public final class JobWorkspace implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobWorkspace.class);

    private final Path root;
    private final Path frames;

    private JobWorkspace(Path root) throws IOException {
        this.root = root;
        this.frames = Files.createDirectories(root.resolve("frames"));
    }

    public static JobWorkspace create(Path workDir, UUID jobId) {
        try {
            Files.createDirectories(workDir);
            return new JobWorkspace(Files.createTempDirectory(workDir, "job-" + jobId + "-"));
        } catch (IOException e) {
            throw new StorageException("Cannot create workspace under " + workDir, e);
        }
    }

    public Path root() {
        return root;
    }

    public Path frames() {
        return frames;
    }

    public Path file(String name) {
        return root.resolve(name);
    }

    @Override
    public void close() {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    LOGGER.warn("Workspace cleanup could not delete {} err={}", p, e.toString());
                }
            });
        } catch (IOException e) {
            LOGGER.warn("Workspace cleanup failed root={} err={}", root, e.toString());
        }
    }
}
