package com.example.media_analyzer.dedup;

import com.example.media_analyzer.exception.FrameDecodeException;
import com.example.media_analyzer.sampling.CandidateFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy, order-preserving near-duplicate removal. A frame is dropped when its hash lies within
 * {@code similarityThreshold} bits of any frame accepted before it, so the earliest occurrence of a
 * recurring screen always wins. Frames that cannot be hashed are kept.
 */
public class FrameDeduplicator {
    private static final Logger LOGGER = LoggerFactory.getLogger(FrameDeduplicator.class);
    public static final int DEFAULT_THRESHOLD = 20;

    private final PerceptualHasher hasher;

    public FrameDeduplicator(PerceptualHasher hasher) {
        this.hasher = hasher;
    }

    public DedupResult deduplicate(List<CandidateFrame> candidates) {
        return deduplicate(candidates, DEFAULT_THRESHOLD, true);
    }

    /**
     * Removes near duplicates and releases their images.
     *
     * @param candidates frames in timestamp order.
     * @param similarityThreshold maximum Hamming distance at which two frames count as the same screen.
     * @param keepFirst only {@code true} is supported.
     * @return the surviving frames, in input order, and the number removed.
     */
    public DedupResult deduplicate(List<CandidateFrame> candidates, int similarityThreshold, boolean keepFirst) {
        if (!keepFirst) {
            throw new IllegalArgumentException("only keep-first deduplication is supported");
        }
        if (candidates == null || candidates.isEmpty()) {
            return new DedupResult(List.of(), 0);
        }
        LOGGER.info("DEDUP start frames={} threshold={}", candidates.size(), similarityThreshold);

        List<CandidateFrame> unique = new ArrayList<>();
        // aligned with unique; null for frames that could not be hashed
        List<FrameHash> uniqueHashes = new ArrayList<>();
        int undecodable = 0;

        for (CandidateFrame candidate : candidates) {
            FrameHash hash;
            try {
                hash = hasher.hash(candidate.image());
            } catch (FrameDecodeException e) {
                LOGGER.warn("DEDUP frame undecodable, kept idx={} ts={}s err={}", candidate.frameIndex(), candidate.timestampSeconds(), e.getMessage());
                unique.add(candidate);
                uniqueHashes.add(null);
                undecodable++;
                continue;
            }

            CandidateFrame duplicateOf = null;
            int distance = -1;
            for (int j = 0; j < unique.size(); j++) {
                FrameHash other = uniqueHashes.get(j);
                if (other == null) {
                    continue;
                }
                int d = hash.distance(other);
                if (d <= similarityThreshold) {
                    duplicateOf = unique.get(j);
                    distance = d;
                    break;
                }
            }

            if (duplicateOf != null) {
                LOGGER.debug("DEDUP drop ts={}s duplicateOf={}s distance={}", candidate.timestampSeconds(), duplicateOf.timestampSeconds(), distance);
                candidate.image().release();
            } else {
                unique.add(candidate);
                uniqueHashes.add(hash);
            }
        }
        int removed = candidates.size() - unique.size();
        LOGGER.info("DEDUP done unique={} removed={} undecodable={}", unique.size(), removed, undecodable);
        return new DedupResult(unique, removed);
    }
}
