package com.example.media_analyzer.dedup;

import com.example.media_analyzer.sampling.CandidateFrame;

import java.util.List;

public record DedupResult(List<CandidateFrame> unique, int removedCount) {
    public DedupResult {
        unique = List.copyOf(unique);
    }
}
