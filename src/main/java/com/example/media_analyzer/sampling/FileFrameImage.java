package com.example.media_analyzer.sampling;

import com.example.media_analyzer.exception.FrameDecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Frame stored as a JPEG file inside the job workspace. Releasing the frame deletes the file.
 */
public class FileFrameImage implements FrameImage {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileFrameImage.class);

    private final Path file;
    private volatile boolean released;

    public FileFrameImage(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    @Override
    public BufferedImage read() {
        ensureAvailable();
        try {
            BufferedImage img = ImageIO.read(file.toFile());
            if (img == null) {
                throw new FrameDecodeException("unsupported or corrupt image: " + file.getFileName());
            }
            return img;
        } catch (IOException e) {
            throw new FrameDecodeException("cannot read frame " + file.getFileName(), e);
        }
    }

    @Override
    public byte[] encoded() {
        ensureAvailable();
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new FrameDecodeException("cannot read frame " + file.getFileName(), e);
        }
    }

    @Override
    public void release() {
        if (released) {
            return;
        }
        released = true;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            // the workspace sweep removes it later
            LOGGER.warn("Frame release failed file={} err={}", file, e.toString());
        }
    }

    @Override
    public boolean isReleased() {
        return released;
    }

    private void ensureAvailable() {
        if (released) {
            throw new FrameDecodeException("frame already released: " + file.getFileName());
        }
    }
}
