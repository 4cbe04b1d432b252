package com.example.media_analyzer.util;

public enum LogLevel {
    INFO,
    WARNING,
    ERROR,
    SUCCESS
}
