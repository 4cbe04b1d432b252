package com.example.media_analyzer.vision;

import com.example.media_analyzer.engine.Interfaces.VisionEngine;
import com.example.media_analyzer.exception.FrameDecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Describes one frame through the vision provider and always returns a usable description.
 * <ol>
 *     <li>Primary call with the full contextual prompt.</li>
 *     <li>If it threw or the answer looks like a refusal, exactly one retry with a short neutral prompt.</li>
 *     <li>If the retry threw or was refused as well, a locally generated fallback document.</li>
 * </ol>
 * At most two provider calls are made per frame. Call timeouts are enforced by the engine and surface here as
 * exceptions.
 */
public class FrameDescriber {
    private static final Logger LOGGER = LoggerFactory.getLogger(FrameDescriber.class);
    static final String MEDIA_TYPE = "image/jpeg";

    private final VisionEngine vision;
    private final RefusalDetector refusalDetector;
    private final FramePromptBuilder prompts;
    private final FallbackDescriptionFactory fallbacks;

    public FrameDescriber(VisionEngine vision,
                          RefusalDetector refusalDetector,
                          FramePromptBuilder prompts,
                          FallbackDescriptionFactory fallbacks) {
        this.vision = vision;
        this.refusalDetector = refusalDetector;
        this.prompts = prompts;
        this.fallbacks = fallbacks;
    }

    public FrameDescription describe(SampledFrame frame, FrameContext context) {
        double ts = frame.timestampSeconds();
        byte[] image;
        try {
            image = frame.frame().image().encoded();
        } catch (FrameDecodeException e) {
            LOGGER.warn("VISION frame undecodable ts={}s, using fallback err={}", ts, e.getMessage());
            return FrameDescription.fallback(fallbacks.create(frame, context), 0);
        }
        var providerContext = prompts.providerContext(frame, context);

        Attempt primary = attempt(new VisionEngine.Request(image, MEDIA_TYPE, prompts.contextual(frame, context), providerContext));
        if (primary.accepted()) {
            LOGGER.info("VISION accepted ts={}s calls=1", ts);
            return FrameDescription.accepted(primary.text(), 1);
        }
        LOGGER.warn("VISION primary {} ts={}s, retrying with simplified prompt{}", primary.outcome(), ts, primary.detail());

        Attempt retry = attempt(new VisionEngine.Request(image, MEDIA_TYPE, prompts.simplified(), providerContext));
        if (retry.accepted()) {
            LOGGER.info("VISION accepted on retry ts={}s calls=2", ts);
            return FrameDescription.accepted(retry.text(), 2);
        }
        LOGGER.warn("VISION retry {} ts={}s, using fallback{}", retry.outcome(), ts, retry.detail());
        return FrameDescription.fallback(fallbacks.create(frame, context), 2);
    }

    private Attempt attempt(VisionEngine.Request request) {
        String text;
        try {
            text = vision.describe(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Attempt(null, "interrupted", e);
        } catch (Exception e) {
            return new Attempt(null, "failed", e);
        }
        if (refusalDetector.looksLikeRefusal(text)) {
            return new Attempt(text, "refused", null);
        }
        return new Attempt(text, "accepted", null);
    }

    private record Attempt(String text, String outcome, Exception error) {
        boolean accepted() {
            return "accepted".equals(outcome);
        }

        String detail() {
            return error == null ? "" : " err=" + error;
        }
    }
}
