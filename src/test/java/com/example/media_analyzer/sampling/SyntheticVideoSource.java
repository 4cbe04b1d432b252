package com.example.media_analyzer.sampling;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.LongToIntFunction;

/**
 * In-memory video whose frames are solid gray planes; the gray level of each frame comes from a function of the
 * frame number.
 */
public class SyntheticVideoSource implements VideoSource {
    private final VideoInfo info;
    private final LongToIntFunction brightness;
    private final List<FrameImage> grabbed = new ArrayList<>();

    public SyntheticVideoSource(double fps, long frameCount, LongToIntFunction brightness) {
        this.info = VideoInfo.of(fps, frameCount, 32, 18);
        this.brightness = brightness;
    }

    @Override
    public VideoInfo info() {
        return info;
    }

    @Override
    public FrameImage grab(long frameNumber) {
        if (frameNumber < 0 || frameNumber >= info.frameCount()) {
            return null;
        }
        FrameImage image = new InMemoryFrameImage(TestImages.solid(info.width(), info.height(), brightness.applyAsInt(frameNumber)));
        grabbed.add(image);
        return image;
    }

    @Override
    public void scan(int step, LumaVisitor visitor) {
        for (long n = 0; n < info.frameCount(); n += step) {
            byte[] luma = new byte[info.width() * info.height()];
            Arrays.fill(luma, (byte) brightness.applyAsInt(n));
            if (!visitor.visit(n, luma)) {
                return;
            }
        }
    }

    public List<FrameImage> grabbed() {
        return grabbed;
    }
}
