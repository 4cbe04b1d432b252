package com.example.media_analyzer.vision;

import com.example.media_analyzer.sampling.CandidateFrame;

import java.util.List;

/**
 * A frame that survived deduplication, enriched with the narration around it.
 *
 * @param continuityHint description text of the previous frame in the job, {@code null} for the first frame.
 */
public record SampledFrame(CandidateFrame frame,
                           String transcriptWindow,
                           List<String> topicsInWindow,
                           String continuityHint) {

    public SampledFrame {
        transcriptWindow = transcriptWindow == null ? "" : transcriptWindow;
        topicsInWindow = topicsInWindow == null ? List.of() : List.copyOf(topicsInWindow);
    }

    public double timestampSeconds() {
        return frame.timestampSeconds();
    }
}
