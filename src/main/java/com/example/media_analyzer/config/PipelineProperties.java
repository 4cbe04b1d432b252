package com.example.media_analyzer.config;

import com.example.media_analyzer.sampling.SamplingParams;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning of the analysis pipeline: workspace location, frame sampling, deduplication and prompt input limits.
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private String workDir = "./data/work";
    private String language = "";
    private double transcriptWindowSeconds = 5.0;
    private int maxKeywords = 15;
    private int hashSize = 16;
    private int dedupThreshold = 20;
    private int flowTranscriptChars = 8000;
    private int audioTranscriptChars = 10000;
    private int flowMaxFrames = 15;
    private Sampling sampling = new Sampling();

    public String getWorkDir() {
        return workDir;
    }

    public void setWorkDir(String workDir) {
        this.workDir = workDir;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public double getTranscriptWindowSeconds() {
        return transcriptWindowSeconds;
    }

    public void setTranscriptWindowSeconds(double transcriptWindowSeconds) {
        this.transcriptWindowSeconds = transcriptWindowSeconds;
    }

    public int getMaxKeywords() {
        return maxKeywords;
    }

    public void setMaxKeywords(int maxKeywords) {
        this.maxKeywords = maxKeywords;
    }

    public int getHashSize() {
        return hashSize;
    }

    public void setHashSize(int hashSize) {
        this.hashSize = hashSize;
    }

    public int getDedupThreshold() {
        return dedupThreshold;
    }

    public void setDedupThreshold(int dedupThreshold) {
        this.dedupThreshold = dedupThreshold;
    }

    public int getFlowTranscriptChars() {
        return flowTranscriptChars;
    }

    public void setFlowTranscriptChars(int flowTranscriptChars) {
        this.flowTranscriptChars = flowTranscriptChars;
    }

    public int getAudioTranscriptChars() {
        return audioTranscriptChars;
    }

    public void setAudioTranscriptChars(int audioTranscriptChars) {
        this.audioTranscriptChars = audioTranscriptChars;
    }

    public int getFlowMaxFrames() {
        return flowMaxFrames;
    }

    public void setFlowMaxFrames(int flowMaxFrames) {
        this.flowMaxFrames = flowMaxFrames;
    }

    public Sampling getSampling() {
        return sampling;
    }

    public void setSampling(Sampling sampling) {
        this.sampling = sampling;
    }

    public static class Sampling {
        private double intervalSeconds = 4.0;
        private int minFrames = 10;
        private int maxFrames = 50;
        private double sceneThreshold = 20.0;

        public double getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(double intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }

        public int getMinFrames() {
            return minFrames;
        }

        public void setMinFrames(int minFrames) {
            this.minFrames = minFrames;
        }

        public int getMaxFrames() {
            return maxFrames;
        }

        public void setMaxFrames(int maxFrames) {
            this.maxFrames = maxFrames;
        }

        public double getSceneThreshold() {
            return sceneThreshold;
        }

        public void setSceneThreshold(double sceneThreshold) {
            this.sceneThreshold = sceneThreshold;
        }

        public SamplingParams toParams() {
            return new SamplingParams(intervalSeconds, minFrames, maxFrames, sceneThreshold);
        }
    }
}
