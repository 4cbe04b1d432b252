package com.example.media_analyzer.util;

public enum ExtractionMethod {
    UNIFORM,
    SCENE_CHANGE
}
