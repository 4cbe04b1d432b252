package com.example.media_analyzer.engine.Interfaces;

import java.nio.file.Path;
import java.util.List;

public interface TranscriptionEngine {
    record Request(Path audioFile, String langHint) {}
    record Segment(double start, double end, String text) {}
    record Result(String text,
                  List<Segment> segments,
                  String lang,
                  String provider) {}

    Result transcribe(Request req) throws Exception;
}
