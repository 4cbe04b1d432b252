package com.example.media_analyzer.vision;

import java.util.List;

/**
 * Job-wide context shared by every frame of one analysis.
 *
 * @param domainContext free text supplied with the job, e.g. the name and purpose of the recorded application.
 * @param keywords keywords extracted from the transcript enrichment.
 */
public record FrameContext(String domainContext, List<String> keywords) {
    public FrameContext {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public static FrameContext empty() {
        return new FrameContext(null, List.of());
    }

    public boolean hasDomainContext() {
        return domainContext != null && !domainContext.isBlank();
    }
}
