package com.example.media_analyzer.dedup;

import com.example.media_analyzer.exception.FrameDecodeException;
import com.example.media_analyzer.sampling.FrameImage;

import java.awt.image.BufferedImage;
import java.util.BitSet;

/**
 * Difference hash over an area-averaged luminance thumbnail.
 * <p>
 * The image is reduced to {@code (hashSize + 1) x hashSize} cells, each the exact area-weighted mean of the source
 * pixels it covers, rounded to 8 bits. Bit {@code [r][c]} is set when cell {@code [r][c+1]} is brighter than cell
 * {@code [r][c]}; bits are laid out row-major.
 */
public class PerceptualHasher {
    public static final int DEFAULT_HASH_SIZE = 16;

    private final int hashSize;

    public PerceptualHasher() {
        this(DEFAULT_HASH_SIZE);
    }

    public PerceptualHasher(int hashSize) {
        if (hashSize < 2) {
            throw new IllegalArgumentException("hashSize must be >= 2");
        }
        this.hashSize = hashSize;
    }

    public int hashSize() {
        return hashSize;
    }

    /**
     * @throws FrameDecodeException when the frame cannot be decoded.
     */
    public FrameHash hash(FrameImage image) {
        return hash(image.read());
    }

    public FrameHash hash(BufferedImage image) {
        if (image == null || image.getWidth() == 0 || image.getHeight() == 0) {
            throw new FrameDecodeException("empty image");
        }
        int cols = hashSize + 1;
        int rows = hashSize;
        int[][] cells = downscale(luminance(image), image.getWidth(), image.getHeight(), cols, rows);

        BitSet bits = new BitSet(rows * hashSize);
        int i = 0;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < hashSize; c++) {
                if (cells[r][c + 1] > cells[r][c]) {
                    bits.set(i);
                }
                i++;
            }
        }
        return new FrameHash(bits, rows * hashSize);
    }

    public int distance(FrameHash a, FrameHash b) {
        return a.distance(b);
    }

    static double[] luminance(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        double[] lum = new double[w * h];
        for (int p = 0; p < argb.length; p++) {
            int rgb = argb[p];
            int r = (rgb >> 16) & 0xFF;
            int g = (rgb >> 8) & 0xFF;
            int b = rgb & 0xFF;
            lum[p] = 0.299 * r + 0.587 * g + 0.114 * b;
        }
        return lum;
    }

    // exact box filter: every source pixel contributes in proportion to its overlap with the target cell
    static int[][] downscale(double[] lum, int w, int h, int cols, int rows) {
        double sx = (double) w / cols;
        double sy = (double) h / rows;
        int[][] out = new int[rows][cols];
        for (int r = 0; r < rows; r++) {
            double y0 = r * sy;
            double y1 = y0 + sy;
            for (int c = 0; c < cols; c++) {
                double x0 = c * sx;
                double x1 = x0 + sx;
                double sum = 0;
                double area = 0;
                for (int y = (int) Math.floor(y0); y < Math.min(h, (int) Math.ceil(y1)); y++) {
                    double wy = Math.min(y + 1, y1) - Math.max(y, y0);
                    if (wy <= 0) continue;
                    for (int x = (int) Math.floor(x0); x < Math.min(w, (int) Math.ceil(x1)); x++) {
                        double wx = Math.min(x + 1, x1) - Math.max(x, x0);
                        if (wx <= 0) continue;
                        double weight = wx * wy;
                        sum += lum[y * w + x] * weight;
                        area += weight;
                    }
                }
                out[r][c] = area > 0 ? (int) Math.round(sum / area) : 0;
            }
        }
        return out;
    }
}
