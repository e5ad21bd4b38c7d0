package com.caserag.provider;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class OpenAiEmbeddingService implements EmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingService.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final String PROVIDER = "openai-embeddings";

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final int dimension;

    public OpenAiEmbeddingService(OkHttpClient httpClient, String baseUrl, String model, String apiKey, int dimension) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("An OpenAI API key is required for the openai embedding provider");
        }
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        long start = System.nanoTime();
        String payload;
        try {
            ObjectNode body = mapper.createObjectNode()
                    .put("model", model)
                    .put("input", text);
            payload = mapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new ProviderException(PROVIDER, "could not encode request", e);
        }
        Request request = new Request.Builder()
                .url(baseUrl + "/v1/embeddings")
                .header("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(payload, JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String content = responseBody == null ? "" : responseBody.string();
            if (!response.isSuccessful()) {
                throw new ProviderException(PROVIDER, "HTTP " + response.code() + ": " + content, response.code(), null);
            }
            JsonNode vectorNode = mapper.readTree(content).path("data").path(0).path("embedding");
            if (!vectorNode.isArray() || vectorNode.isEmpty()) {
                throw new ProviderException(PROVIDER, "response did not contain data[0].embedding");
            }
            float[] out = new float[vectorNode.size()];
            for (int i = 0; i < vectorNode.size(); i++) {
                out[i] = (float) vectorNode.get(i).asDouble();
            }
            log.debug("embed model={} dims={} textLen={} tookMs={}", model, out.length, text.length(),
                    (System.nanoTime() - start) / 1_000_000);
            return out;
        } catch (IOException e) {
            throw new ProviderException(PROVIDER, "request to " + baseUrl + " failed", e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }
}
