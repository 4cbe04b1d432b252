package com.example.media_analyzer.service.Interfaces;

import java.nio.file.Path;

/**
 * Object store with a raw area for uploaded media and an out area for published frame images.
 */
public interface StorageService {

    /** Absolute local path of a raw object, for ffmpeg and ffprobe. */
    Path resolveRaw(String objectKey);

    Path resolveOut(String objectKey);

    void uploadToRaw(Path sourceFile, String objectKey);

    void uploadToOut(Path sourceFile, String objectKey);

    /** Writes bytes under the out area. Creates parent folders when needed. */
    void writeToOut(byte[] data, String objectKey);

    boolean existsInRaw(String objectKey);

    boolean existsInOut(String objectKey);

    /** @return {@code true} when the raw object existed and was removed. */
    boolean deleteRaw(String objectKey);

    /**
     * Removes every out object whose key starts with the prefix.
     *
     * @return number of objects deleted.
     */
    int deleteOutPrefix(String keyPrefix);

    /** URL under which an out object is served to clients. */
    String publicUrl(String objectKey);
}
