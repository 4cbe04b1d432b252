package com.example.media_analyzer.controller;

import com.example.media_analyzer.exception.StorageException;
import com.example.media_analyzer.service.Interfaces.StorageService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.HandlerMapping;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Serves published frame images from the out area.
 */
@RestController
@RequestMapping("/v1/files")
public class FileController {

    private final StorageService storage;

    public FileController(StorageService storage) {
        this.storage = storage;
    }

    @GetMapping(value = "/out/**", produces = MediaType.ALL_VALUE)
    public ResponseEntity<Resource> getOut(HttpServletRequest req) throws IOException {
        String pattern = (String) req.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        String path = (String) req.getAttribute(HandlerMapping.PATH_WITHIN_HANDLER_MAPPING_ATTRIBUTE);
        String objectKey = new AntPathMatcher().extractPathWithinPattern(pattern, path);
        if (objectKey == null || objectKey.isBlank()) {
            return ResponseEntity.badRequest().build();
        }

        Path file;
        try {
            file = storage.resolveOut(objectKey);
        } catch (StorageException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_OBJECT_KEY", e);
        }
        if (!Files.isRegularFile(file)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "FILE_NOT_FOUND");
        }

        String probed = Files.probeContentType(file);
        MediaType contentType = probed == null ? MediaType.APPLICATION_OCTET_STREAM : MediaType.parseMediaType(probed);
        return ResponseEntity.ok()
                .contentType(contentType)
                .contentLength(Files.size(file))
                .cacheControl(CacheControl.maxAge(Duration.ofHours(1)).cachePublic())
                .body(new FileSystemResource(file));
    }
}
