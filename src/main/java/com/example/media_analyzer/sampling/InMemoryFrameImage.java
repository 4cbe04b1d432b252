package com.example.media_analyzer.sampling;

import com.example.media_analyzer.exception.FrameDecodeException;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

public class InMemoryFrameImage implements FrameImage {
    private volatile BufferedImage image;

    public InMemoryFrameImage(BufferedImage image) {
        this.image = image;
    }

    @Override
    public BufferedImage read() {
        BufferedImage current = image;
        if (current == null) {
            throw new FrameDecodeException("frame already released");
        }
        return current;
    }

    @Override
    public byte[] encoded() {
        BufferedImage rgb = toRgb(read());
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (!ImageIO.write(rgb, "jpg", out)) {
                throw new FrameDecodeException("no JPEG writer available");
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new FrameDecodeException("JPEG encode failed", e);
        }
    }

    @Override
    public void release() {
        image = null;
    }

    @Override
    public boolean isReleased() {
        return image == null;
    }

    // the JPEG writer rejects images with an alpha channel
    private static BufferedImage toRgb(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_INT_RGB) {
            return src;
        }
        BufferedImage rgb = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
}
