package com.example.media_analyzer.engine;

import com.example.media_analyzer.engine.Interfaces.VisionEngine;

import java.util.Locale;

public class DummyVisionEngine implements VisionEngine {

    @Override
    public String describe(Request request) {
        Object ts = request.context() == null ? null : request.context().get("timestamp");
        return String.format(Locale.ROOT,
                "{\"summary\":\"Dummy description of the frame at %ss\",\"screen_type\":\"unknown\",\"module_name\":\"\",\"components\":[],\"confidence\":\"low\"}",
                ts == null ? "?" : ts);
    }
}
