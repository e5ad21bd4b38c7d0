package com.caserag.runtime;

import java.util.Map;
import java.util.function.Consumer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private StorageConfig storage = new StorageConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private CompletionConfig completion = new CompletionConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private ChunkingConfig chunking = new ChunkingConfig();

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public CompletionConfig getCompletion() {
        return completion;
    }

    public void setCompletion(CompletionConfig completion) {
        this.completion = completion == null ? new CompletionConfig() : completion;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    /**
     * Overlays values from environment variables onto this configuration. Unset or blank variables leave
     * the configured value in place; unparsable numbers are rejected.
     */
    public AppConfig applyEnvironment(Map<String, String> env) {
        ifPresent(env, "OPENAI_API_KEY", embedding::setApiKey);
        ifPresent(env, "EMBEDDING_MODEL", embedding::setModel);
        ifPresent(env, "ANTHROPIC_API_KEY", completion::setApiKey);
        ifPresent(env, "ANTHROPIC_MODEL", completion::setModel);
        ifPresent(env, "LLM_TEMPERATURE", value -> completion.setTemperature(parseDouble("LLM_TEMPERATURE", value)));
        ifPresent(env, "LLM_MAX_TOKENS", value -> completion.setMaxTokens(parseInt("LLM_MAX_TOKENS", value)));
        ifPresent(env, "CHUNK_SIZE", value -> chunking.setChunkSize(parseInt("CHUNK_SIZE", value)));
        ifPresent(env, "CHUNK_OVERLAP", value -> chunking.setChunkOverlap(parseInt("CHUNK_OVERLAP", value)));
        ifPresent(env, "TOP_K_RETRIEVAL", value -> retrieval.setTopK(parseInt("TOP_K_RETRIEVAL", value)));
        ifPresent(env, "DATA_DIR", storage::setCasesRoot);
        ifPresent(env, "VECTOR_STORE_DIR", storage::setVectorStorePath);
        return this;
    }

    private static void ifPresent(Map<String, String> env, String name, Consumer<String> setter) {
        String value = env.get(name);
        if (value != null && !value.isBlank()) {
            setter.accept(value.trim());
        }
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Environment variable " + name + " is not an integer: " + value, e);
        }
    }

    private static double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Environment variable " + name + " is not a number: " + value, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String casesRoot = "./data/cases";
        private String vectorStorePath = "./data/vector_store";
        private String collection = "forensic_cases";
        private String manifestPath = "./data/.ingestion_manifest.json";

        public String getCasesRoot() {
            return casesRoot;
        }

        public void setCasesRoot(String casesRoot) {
            this.casesRoot = casesRoot;
        }

        public String getVectorStorePath() {
            return vectorStorePath;
        }

        public void setVectorStorePath(String vectorStorePath) {
            this.vectorStorePath = vectorStorePath;
        }

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }

        public String getManifestPath() {
            return manifestPath;
        }

        public void setManifestPath(String manifestPath) {
            this.manifestPath = manifestPath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "openai";
        private String model = "text-embedding-3-small";
        private String apiKey;
        private String baseUrl = "https://api.openai.com";
        private int dimensions = 1536;
        private int timeoutMs = 30000;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getDimensions() {
            return dimensions;
        }

        public void setDimensions(int dimensions) {
            this.dimensions = dimensions;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CompletionConfig {
        private String provider = "anthropic";
        private String model = "claude-sonnet-4-5-20250929";
        private String apiKey;
        private String baseUrl = "https://api.anthropic.com";
        private double temperature = 0.3;
        private int maxTokens = 1000;
        private int timeoutMs = 30000;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int topK = 5;
        private int casePoolSize = 50;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public int getCasePoolSize() {
            return casePoolSize;
        }

        public void setCasePoolSize(int casePoolSize) {
            this.casePoolSize = casePoolSize;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private int chunkSize = 512;
        private int chunkOverlap = 50;

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getChunkOverlap() {
            return chunkOverlap;
        }

        public void setChunkOverlap(int chunkOverlap) {
            this.chunkOverlap = chunkOverlap;
        }
    }
}
