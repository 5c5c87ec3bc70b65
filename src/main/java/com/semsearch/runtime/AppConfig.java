package com.semsearch.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.semsearch.embedding.EmbeddingModel;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private StorageConfig storage = new StorageConfig();
    private ChunkingConfig chunking = new ChunkingConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private IndexConfig index = new IndexConfig();
    private QueryConfig query = new QueryConfig();

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public IndexConfig getIndex() {
        return index;
    }

    public void setIndex(IndexConfig index) {
        this.index = index == null ? new IndexConfig() : index;
    }

    public QueryConfig getQuery() {
        return query;
    }

    public void setQuery(QueryConfig query) {
        this.query = query == null ? new QueryConfig() : query;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String dataDir = "data";
        private String indexDir = "vector-store";

        public String getDataDir() {
            return dataDir;
        }

        public void setDataDir(String dataDir) {
            this.dataDir = dataDir;
        }

        public String getIndexDir() {
            return indexDir;
        }

        public void setIndexDir(String indexDir) {
            this.indexDir = indexDir;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private int chunkSize = 500;
        private int overlap = 50;

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String defaultModel = EmbeddingModel.DEFAULT.id();
        private String endpoint = "";
        private String apiKeyEnv = "SEMSEARCH_EMBEDDING_API_KEY";
        private int timeoutMs = 30000;

        public String getDefaultModel() {
            return defaultModel;
        }

        public void setDefaultModel(String defaultModel) {
            this.defaultModel = defaultModel;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint == null ? "" : endpoint;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexConfig {
        private String defaultBackend = "local-json";

        public String getDefaultBackend() {
            return defaultBackend;
        }

        public void setDefaultBackend(String defaultBackend) {
            this.defaultBackend = defaultBackend;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QueryConfig {
        private int defaultTopK = 5;
        private int timeoutMs = 10000;
        private int workerThreads = 4;

        public int getDefaultTopK() {
            return defaultTopK;
        }

        public void setDefaultTopK(int defaultTopK) {
            this.defaultTopK = defaultTopK;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }
    }
}
