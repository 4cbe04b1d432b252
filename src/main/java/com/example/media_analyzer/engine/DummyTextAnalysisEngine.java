package com.example.media_analyzer.engine;

import com.example.media_analyzer.engine.Interfaces.TextAnalysisEngine;

public class DummyTextAnalysisEngine implements TextAnalysisEngine {

    @Override
    public String analyze(Request request) {
        return "{\"summary\":\"Dummy analysis\",\"topics\":[],\"keywords\":[],\"content_type\":\"notes\"}";
    }
}
