package com.example.media_analyzer.service;

import com.example.media_analyzer.exception.StorageException;
import com.example.media_analyzer.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * File-system backed {@link StorageService}. Keys are relative paths below the raw or out root; keys that escape
 * their root are rejected.
 */
public class LocalStorageService implements StorageService {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStorageService.class);

    private final Path rawDir;
    private final Path outDir;
    private final String publicBaseUrl;

    public LocalStorageService(Path baseDir, String rawPrefix, String outPrefix, String publicBaseUrl) {
        Path base = baseDir.toAbsolutePath().normalize();
        this.rawDir = base.resolve(rawPrefix).normalize();
        this.outDir = base.resolve(outPrefix).normalize();
        this.publicBaseUrl = publicBaseUrl == null ? "" : publicBaseUrl.replaceAll("/+$", "");

        try {
            Files.createDirectories(rawDir);
            Files.createDirectories(outDir);
            LOGGER.info("LocalStorageService ready. raw={}, out={}, publicBaseUrl={}", rawDir, outDir, this.publicBaseUrl);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directories", e);
        }
    }

    @Override
    public Path resolveRaw(String objectKey) {
        return safeResolve(rawDir, objectKey);
    }

    @Override
    public Path resolveOut(String objectKey) {
        return safeResolve(outDir, objectKey);
    }

    @Override
    public void uploadToRaw(Path sourceFile, String objectKey) {
        copyFile(sourceFile, safeResolve(rawDir, objectKey));
    }

    @Override
    public void uploadToOut(Path sourceFile, String objectKey) {
        copyFile(sourceFile, safeResolve(outDir, objectKey));
    }

    @Override
    public void writeToOut(byte[] data, String objectKey) {
        Path target = safeResolve(outDir, objectKey);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, data);
        } catch (IOException e) {
            throw new StorageException("Write failed to " + target, e);
        }
    }

    @Override
    public boolean existsInRaw(String objectKey) {
        return Files.exists(safeResolve(rawDir, objectKey));
    }

    @Override
    public boolean existsInOut(String objectKey) {
        return Files.exists(safeResolve(outDir, objectKey));
    }

    @Override
    public boolean deleteRaw(String objectKey) {
        Path p = safeResolve(rawDir, objectKey);
        try {
            return Files.deleteIfExists(p);
        } catch (IOException e) {
            throw new StorageException("Delete failed: " + p, e);
        }
    }

    @Override
    public int deleteOutPrefix(String keyPrefix) {
        Path root = safeResolve(outDir, keyPrefix);
        if (!Files.exists(root)) {
            return 0;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        } catch (IOException e) {
            throw new StorageException("List failed: " + root, e);
        }
        int files = 0;
        for (Path p : paths) {
            try {
                if (Files.isRegularFile(p)) files++;
                Files.deleteIfExists(p);
            } catch (IOException e) {
                throw new StorageException("Delete failed: " + p, e);
            }
        }
        return files;
    }

    @Override
    public String publicUrl(String objectKey) {
        return publicBaseUrl + "/" + normalizeKey(objectKey);
    }

    private Path safeResolve(Path root, String objectKey) {
        if (objectKey == null || objectKey.isBlank()) {
            throw new StorageException("objectKey is blank");
        }
        Path p = root.resolve(normalizeKey(objectKey)).normalize();
        if (!p.startsWith(root) || p.equals(root)) {
            throw new StorageException("Invalid objectKey (path traversal?): " + objectKey);
        }
        return p;
    }

    // forward slashes, no leading slash
    private static String normalizeKey(String objectKey) {
        return objectKey.replace('\\', '/').replaceAll("^/+", "");
    }

    private void copyFile(Path source, Path target) {
        try {
            Files.createDirectories(target.getParent());
            Files.copy(source, target, REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Copy failed to " + target, e);
        }
    }
}
