package com.example.media_analyzer.service;

import com.example.media_analyzer.exception.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LocalStorageServiceTest {

    @TempDir
    Path base;

    private LocalStorageService storage;

    @BeforeEach
    void setUp() {
        storage = new LocalStorageService(base, "raw", "out", "http://localhost:8080/v1/files/out/");
    }

    @Test
    void uploadToRawCopiesIntoNestedKey() throws Exception {
        Path source = Files.writeString(base.resolve("source.mp4"), "video");

        storage.uploadToRaw(source, "uploads/abc-demo.mp4");

        assertThat(storage.existsInRaw("uploads/abc-demo.mp4")).isTrue();
        assertThat(Files.readString(storage.resolveRaw("uploads/abc-demo.mp4"))).isEqualTo("video");
    }

    @Test
    void deleteOutPrefixRemovesOnlyThatJob() {
        storage.writeToOut(new byte[]{1}, "analyses/job-1/frames/frame-0000.jpg");
        storage.writeToOut(new byte[]{2}, "analyses/job-1/frames/frame-0001.jpg");
        storage.writeToOut(new byte[]{3}, "analyses/job-2/frames/frame-0000.jpg");

        int deleted = storage.deleteOutPrefix("analyses/job-1/");

        assertThat(deleted).isEqualTo(2);
        assertThat(storage.existsInOut("analyses/job-1/frames/frame-0000.jpg")).isFalse();
        assertThat(storage.existsInOut("analyses/job-2/frames/frame-0000.jpg")).isTrue();
        assertThat(storage.deleteOutPrefix("analyses/job-3/")).isZero();
    }

    @Test
    void publicUrlJoinsBaseAndKey() {
        assertThat(storage.publicUrl("/analyses/j/frames/frame-0003.jpg"))
                .isEqualTo("http://localhost:8080/v1/files/out/analyses/j/frames/frame-0003.jpg");
    }

    @Test
    void keysEscapingTheRootAreRejected() {
        assertThrows(StorageException.class, () -> storage.resolveOut("../raw/secret.mp4"));
        assertThrows(StorageException.class, () -> storage.resolveRaw(" "));
    }

    @Test
    void deleteRawRemovesUploadOnce() throws Exception {
        Path source = Files.writeString(base.resolve("source.mp4"), "video");
        storage.uploadToRaw(source, "uploads/abc-demo.mp4");

        assertThat(storage.deleteRaw("uploads/abc-demo.mp4")).isTrue();
        assertThat(storage.existsInRaw("uploads/abc-demo.mp4")).isFalse();
        assertThat(storage.deleteRaw("uploads/abc-demo.mp4")).isFalse();
        assertThrows(StorageException.class, () -> storage.deleteRaw("../out/anything.jpg"));
    }
}
