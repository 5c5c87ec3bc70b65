package com.semsearch.embedding;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.semsearch.error.ErrorKind;
import com.semsearch.error.SemanticSearchException;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Calls an HTTP embedding endpoint. A batch is sent as one request
 * {@code {"model": ..., "input": [...]}} and answered with {@code {"embeddings": [[...], ...]}};
 * a single {@code {"embedding": [...]}} is accepted for one-element batches.
 */
public class RemoteEmbeddingService implements EmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(RemoteEmbeddingService.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final HttpUrl endpoint;
    private final String apiKey;
    private final EmbeddingModel model;

    public RemoteEmbeddingService(OkHttpClient httpClient, String endpoint, String apiKey, EmbeddingModel model) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = parseEndpoint(endpoint);
        this.apiKey = apiKey;
        this.model = model;
        log.info("Using remote embedding endpoint {} for model {}", endpoint, model.id());
    }

    @Override
    public EmbeddingModel model() {
        return model;
    }

    @Override
    public float[] embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model.id());
        body.put("input", texts);
        try {
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(mapper.writeValueAsString(body), JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                ResponseBody responseBody = response.body();
                if (!response.isSuccessful() || responseBody == null) {
                    throw unavailable("endpoint answered HTTP " + response.code(), null);
                }
                return parse(mapper.readTree(responseBody.string()), texts.size());
            }
        } catch (IOException e) {
            throw unavailable(e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            // OkHttp rejects malformed header values when the request is built
            throw unavailable("request rejected: " + e.getMessage(), e);
        }
    }

    /**
     * Parses an absolute http(s) endpoint URL.
     *
     * @throws SemanticSearchException {@code INVALID_CONFIGURATION} for anything else
     */
    public static HttpUrl parseEndpoint(String endpoint) {
        HttpUrl url = endpoint == null ? null : HttpUrl.parse(endpoint.strip());
        if (url == null) {
            throw SemanticSearchException.invalidConfiguration(
                    "Embedding endpoint must be an absolute http or https URL, got '" + endpoint + "'");
        }
        return url;
    }

    private List<float[]> parse(JsonNode root, int expectedCount) {
        List<JsonNode> vectorNodes = new ArrayList<>();
        JsonNode batch = root.path("embeddings");
        if (batch.isArray()) {
            batch.forEach(vectorNodes::add);
        } else if (root.path("embedding").isArray()) {
            vectorNodes.add(root.path("embedding"));
        }
        if (vectorNodes.size() != expectedCount) {
            throw unavailable("endpoint returned " + vectorNodes.size() + " vectors for " + expectedCount + " inputs", null);
        }

        List<float[]> vectors = new ArrayList<>(expectedCount);
        for (JsonNode vectorNode : vectorNodes) {
            if (vectorNode.size() != model.dimension()) {
                log.error("Embedding endpoint {} returned {} dimensions for {}", endpoint, vectorNode.size(), model.id());
                throw SemanticSearchException.dimensionMismatch(model.dimension(), vectorNode.size());
            }
            float[] out = new float[vectorNode.size()];
            for (int i = 0; i < vectorNode.size(); i++) {
                out[i] = (float) vectorNode.get(i).asDouble();
            }
            vectors.add(out);
        }
        return vectors;
    }

    private SemanticSearchException unavailable(String reason, Throwable cause) {
        return new SemanticSearchException(ErrorKind.MODEL_UNAVAILABLE,
                "Embedding model " + model.id() + " unavailable at " + endpoint + ": " + reason, cause);
    }
}
