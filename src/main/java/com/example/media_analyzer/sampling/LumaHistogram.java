package com.example.media_analyzer.sampling;

/**
 * 256-bin luma histograms and the correlation-based scene change score.
 */
public final class LumaHistogram {
    public static final int BINS = 256;

    private LumaHistogram() {}

    public static double[] of(byte[] luma) {
        double[] hist = new double[BINS];
        if (luma == null || luma.length == 0) {
            return hist;
        }
        for (byte b : luma) {
            hist[b & 0xFF]++;
        }
        double max = 0;
        for (double v : hist) max = Math.max(max, v);
        if (max > 0) {
            for (int i = 0; i < BINS; i++) hist[i] /= max;
        }
        return hist;
    }

    /**
     * Pearson correlation of two histograms. Two flat histograms correlate perfectly (1.0).
     */
    public static double correlation(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("histogram size mismatch");
        }
        int n = a.length;
        double meanA = 0, meanB = 0;
        for (int i = 0; i < n; i++) {
            meanA += a[i];
            meanB += b[i];
        }
        meanA /= n;
        meanB /= n;
        double num = 0, varA = 0, varB = 0;
        for (int i = 0; i < n; i++) {
            double da = a[i] - meanA;
            double db = b[i] - meanB;
            num += da * db;
            varA += da * da;
            varB += db * db;
        }
        double denom = Math.sqrt(varA * varB);
        return denom > 1e-12 ? num / denom : 1.0;
    }

    /** {@code (1 - correlation) * 100}. */
    public static double sceneChangeScore(double[] previous, double[] current) {
        return (1.0 - correlation(previous, current)) * 100.0;
    }
}
