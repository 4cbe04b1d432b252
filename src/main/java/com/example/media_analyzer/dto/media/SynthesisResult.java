package com.example.media_analyzer.dto.media;

import com.example.media_analyzer.util.AnalysisMode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * @param mode the mode actually used, never {@link AnalysisMode#AUTO}.
 */
public record SynthesisResult(AnalysisMode mode, ObjectNode document, String summary) {
}
