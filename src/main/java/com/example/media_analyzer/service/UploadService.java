package com.example.media_analyzer.service;

import com.example.media_analyzer.exception.StorageException;
import com.example.media_analyzer.service.Interfaces.StorageService;
import com.example.media_analyzer.util.AnalysisMode;
import com.example.media_analyzer.util.MediaKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Stores a multipart upload in the raw area and submits it for analysis.
 */
@Service
public class UploadService {
    private static final Logger LOGGER = LoggerFactory.getLogger(UploadService.class);

    private final StorageService storage;
    private final PipelineJobService jobService;

    public UploadService(StorageService storage, PipelineJobService jobService) {
        this.storage = storage;
        this.jobService = jobService;
    }

    public UUID uploadAndSubmit(MultipartFile file, String context, AnalysisMode analysisMode) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "FILE_EMPTY");
        }
        String name = sanitize(file.getOriginalFilename());
        MediaKind.fromFileName(name)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "UNSUPPORTED_MEDIA_TYPE"));
        String objectKey = "uploads/" + UUID.randomUUID() + "-" + name;

        Path tmp = null;
        try {
            tmp = Files.createTempFile("upload-", ".bin");
            file.transferTo(tmp.toFile());
            storage.uploadToRaw(tmp, objectKey);
            LOGGER.info("UPLOAD stored objectKey={} size={}", objectKey, Files.size(tmp));
        } catch (IOException | StorageException e) {
            LOGGER.error("UPLOAD failed name={} err={}", name, e.toString());
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "UPLOAD_FAILED", e);
        } finally {
            deleteQuietly(tmp);
        }
        return jobService.submit(objectKey, context, analysisMode);
    }

    // keep only the last path segment and a safe character set
    static String sanitize(String originalName) {
        if (originalName == null || originalName.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "FILE_NAME_REQUIRED");
        }
        String base = originalName.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        String cleaned = base.replaceAll("[^A-Za-z0-9._-]", "_");
        if (cleaned.isBlank() || cleaned.startsWith(".")) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "FILE_NAME_REQUIRED");
        }
        return cleaned;
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOGGER.warn("UPLOAD temp cleanup failed path={} err={}", tmp, e.toString());
        }
    }
}
