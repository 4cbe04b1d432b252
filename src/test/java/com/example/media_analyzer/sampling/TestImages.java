package com.example.media_analyzer.sampling;

import java.awt.image.BufferedImage;

public final class TestImages {
    private TestImages() {}

    public static BufferedImage solid(int width, int height, int gray) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int rgb = (gray << 16) | (gray << 8) | gray;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                img.setRGB(x, y, rgb);
            }
        }
        return img;
    }

    /** Brightness grows from left to right, or the other way round when {@code reversed}. */
    public static BufferedImage horizontalGradient(int width, int height, boolean reversed) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int x = 0; x < width; x++) {
            int gray = (int) Math.round(255.0 * x / (width - 1));
            if (reversed) gray = 255 - gray;
            int rgb = (gray << 16) | (gray << 8) | gray;
            for (int y = 0; y < height; y++) {
                img.setRGB(x, y, rgb);
            }
        }
        return img;
    }
}
