package com.example.media_analyzer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ai")
public class AiProperties {

    private AiProvider transcriptionProvider = AiProvider.OPENAI;
    private AiProvider visionProvider = AiProvider.OPENAI;
    private AiProvider analysisProvider = AiProvider.OPENAI;
    private OpenAi openai = new OpenAi();
    private Ollama ollama = new Ollama();

    public AiProvider getTranscriptionProvider() {
        return transcriptionProvider;
    }

    public void setTranscriptionProvider(AiProvider transcriptionProvider) {
        this.transcriptionProvider = transcriptionProvider;
    }

    public AiProvider getVisionProvider() {
        return visionProvider;
    }

    public void setVisionProvider(AiProvider visionProvider) {
        this.visionProvider = visionProvider;
    }

    public AiProvider getAnalysisProvider() {
        return analysisProvider;
    }

    public void setAnalysisProvider(AiProvider analysisProvider) {
        this.analysisProvider = analysisProvider;
    }

    public OpenAi getOpenai() {
        return openai;
    }

    public void setOpenai(OpenAi openai) {
        this.openai = openai;
    }

    public Ollama getOllama() {
        return ollama;
    }

    public void setOllama(Ollama ollama) {
        this.ollama = ollama;
    }

    public static class OpenAi {
        private String baseUrl = "https://api.openai.com";
        private String apiKey = "";
        private String transcriptionModel = "whisper-1";
        private String visionModel = "gpt-4o";
        private String analysisModel = "gpt-4o";
        private int visionMaxTokens = 3000;
        private long timeoutSeconds = 120;
        private long transcriptionTimeoutSeconds = 900;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getTranscriptionModel() {
            return transcriptionModel;
        }

        public void setTranscriptionModel(String transcriptionModel) {
            this.transcriptionModel = transcriptionModel;
        }

        public String getVisionModel() {
            return visionModel;
        }

        public void setVisionModel(String visionModel) {
            this.visionModel = visionModel;
        }

        public String getAnalysisModel() {
            return analysisModel;
        }

        public void setAnalysisModel(String analysisModel) {
            this.analysisModel = analysisModel;
        }

        public int getVisionMaxTokens() {
            return visionMaxTokens;
        }

        public void setVisionMaxTokens(int visionMaxTokens) {
            this.visionMaxTokens = visionMaxTokens;
        }

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public long getTranscriptionTimeoutSeconds() {
            return transcriptionTimeoutSeconds;
        }

        public void setTranscriptionTimeoutSeconds(long transcriptionTimeoutSeconds) {
            this.transcriptionTimeoutSeconds = transcriptionTimeoutSeconds;
        }
    }

    public static class Ollama {
        private String baseUrl = "http://localhost:11434";
        private String visionModel = "llava:13b";
        private String analysisModel = "llama3.1:8b";
        private long timeoutSeconds = 120;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getVisionModel() {
            return visionModel;
        }

        public void setVisionModel(String visionModel) {
            this.visionModel = visionModel;
        }

        public String getAnalysisModel() {
            return analysisModel;
        }

        public void setAnalysisModel(String analysisModel) {
            this.analysisModel = analysisModel;
        }

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }
}
