package com.example.media_analyzer.engine;

import com.example.media_analyzer.engine.Interfaces.TranscriptionEngine;

import java.util.List;

public class DummyTranscriptionEngine implements TranscriptionEngine {

    @Override
    public Result transcribe(Request request) {
        List<Segment> segments = List.of(
                new Segment(0.0, 5.0, "Hello, this is a dummy transcript."),
                new Segment(5.0, 10.0, "Nothing was sent to a transcription provider."));
        return new Result("Hello, this is a dummy transcript. Nothing was sent to a transcription provider.",
                segments, "en", "dummy");
    }
}
