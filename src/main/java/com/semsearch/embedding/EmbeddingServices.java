package com.semsearch.embedding;

import java.time.Duration;
import java.util.function.Function;

import com.semsearch.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    static final String ENDPOINT_ENV = "SEMSEARCH_EMBEDDING_URL";

    private EmbeddingServices() {
    }

    /**
     * Picks the remote endpoint when one is configured (the {@code SEMSEARCH_EMBEDDING_URL}
     * environment variable wins over the config file), otherwise the local encoder. A configured
     * endpoint that is not an http(s) URL fails here with {@code INVALID_CONFIGURATION}.
     */
    public static EmbeddingModelRegistry fromConfig(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        String endpoint = System.getenv(ENDPOINT_ENV);
        if (endpoint == null || endpoint.isBlank()) {
            endpoint = config.getEndpoint();
        }
        if (endpoint == null || endpoint.isBlank()) {
            return new EmbeddingModelRegistry();
        }
        RemoteEmbeddingService.parseEndpoint(endpoint);
        String apiKey = config.getApiKeyEnv() == null ? null : System.getenv(config.getApiKeyEnv());
        Duration timeout = Duration.ofMillis(Math.max(1, config.getTimeoutMs()));
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(timeout)
                .build();
        String url = endpoint;
        Function<EmbeddingModel, EmbeddingService> loader = model -> new RemoteEmbeddingService(client, url, apiKey, model);
        return new EmbeddingModelRegistry(loader);
    }
}
