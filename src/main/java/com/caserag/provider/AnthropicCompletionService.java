package com.caserag.provider;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

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

/**
 * Completion backed by the Anthropic Messages API. The model's context window comes from
 * {@link ModelContextWindows}; contexts that would not fit next to the reserved output budget are dropped
 * from the tail.
 */
public class AnthropicCompletionService implements CompletionService {
    private static final Logger log = LoggerFactory.getLogger(AnthropicCompletionService.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final String PROVIDER = "anthropic";
    private static final String API_VERSION = "2023-06-01";
    private static final int CHARS_PER_TOKEN = 4;

    static final String SYSTEM_PROMPT = "You are an assistant for forensic case file analysis. "
            + "Answer using only the provided case excerpts. If the excerpts do not contain the answer, say so.";

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final double temperature;
    private final int maxTokens;
    private final int contextWindowTokens;

    public AnthropicCompletionService(OkHttpClient httpClient,
            String baseUrl,
            String model,
            String apiKey,
            double temperature,
            int maxTokens) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("An Anthropic API key is required for the anthropic completion provider");
        }
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.apiKey = apiKey;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.contextWindowTokens = ModelContextWindows.contextWindow(model);
    }

    @Override
    public List<String> fitContexts(String query, List<String> contexts) {
        return fitToWindow(query, contexts);
    }

    @Override
    public String complete(String query, List<String> contexts) {
        String prompt = buildPrompt(query, fitToWindow(query, contexts));
        String payload;
        try {
            ObjectNode body = mapper.createObjectNode()
                    .put("model", model)
                    .put("max_tokens", maxTokens)
                    .put("temperature", temperature)
                    .put("system", SYSTEM_PROMPT);
            ObjectNode message = body.putArray("messages").addObject();
            message.put("role", "user");
            message.put("content", prompt);
            payload = mapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new ProviderException(PROVIDER, "could not encode request", e);
        }

        Request request = new Request.Builder()
                .url(baseUrl + "/v1/messages")
                .header("x-api-key", apiKey)
                .header("anthropic-version", API_VERSION)
                .post(RequestBody.create(payload, JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String content = responseBody == null ? "" : responseBody.string();
            if (!response.isSuccessful()) {
                throw new ProviderException(PROVIDER, "HTTP " + response.code() + ": " + content, response.code(), null);
            }
            JsonNode blocks = mapper.readTree(content).path("content");
            StringBuilder answer = new StringBuilder();
            for (JsonNode block : blocks) {
                if ("text".equals(block.path("type").asText())) {
                    answer.append(block.path("text").asText());
                }
            }
            if (answer.length() == 0) {
                throw new ProviderException(PROVIDER, "response did not contain a text block");
            }
            return answer.toString();
        } catch (IOException e) {
            throw new ProviderException(PROVIDER, "request to " + baseUrl + " failed", e);
        }
    }

    List<String> fitToWindow(String query, List<String> contexts) {
        int budget = ModelContextWindows.contextWindow(model) - maxTokens - estimateTokens(buildPrompt(query, List.of()))
                - estimateTokens(SYSTEM_PROMPT);
        List<String> kept = new ArrayList<>();
        for (String context : contexts) {
            int cost = estimateTokens(context);
            if (cost > budget) {
                log.warn("Dropping {} of {} contexts to stay within the {} token window of {}",
                        contexts.size() - kept.size(), contexts.size(), contextWindowTokens, model);
                break;
            }
            budget -= cost;
            kept.add(context);
        }
        return kept;
    }

    static String buildPrompt(String query, List<String> contexts) {
        StringBuilder builder = new StringBuilder("Case excerpts:\n");
        if (contexts.isEmpty()) {
            builder.append("(none)\n");
        }
        for (int i = 0; i < contexts.size(); i++) {
            builder.append("[").append(i + 1).append("] ").append(contexts.get(i)).append("\n");
        }
        builder.append("\nQuestion:\n").append(query).append("\n");
        return builder.toString();
    }

    private static int estimateTokens(String text) {
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    public int contextWindowTokens() {
        return contextWindowTokens;
    }
}
