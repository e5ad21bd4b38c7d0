package com.caserag.provider;

import java.time.Duration;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.caserag.runtime.AppConfig;

import okhttp3.OkHttpClient;

/**
 * Builds the configured embedding and completion providers.
 */
public final class Providers {
    private static final Logger log = LoggerFactory.getLogger(Providers.class);

    private Providers() {
    }

    public static EmbeddingService embedding(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        String provider = normalize(config.getProvider());
        switch (provider) {
            case "openai":
                log.info("Embedding provider=openai model={}", config.getModel());
                return new OpenAiEmbeddingService(
                        withTimeout(httpClient, config.getTimeoutMs()),
                        config.getBaseUrl(),
                        config.getModel(),
                        config.getApiKey(),
                        config.getDimensions());
            case "hashing":
                log.info("Embedding provider=hashing dims={}", config.getDimensions());
                return new HashingEmbeddingService(config.getDimensions());
            default:
                throw new IllegalArgumentException("Unknown embedding provider: " + config.getProvider());
        }
    }

    public static CompletionService completion(AppConfig.CompletionConfig config, OkHttpClient httpClient) {
        String provider = normalize(config.getProvider());
        switch (provider) {
            case "anthropic":
                log.info("Completion provider=anthropic model={} contextWindowTokens={}",
                        config.getModel(), ModelContextWindows.find(config.getModel()).orElse(-1));
                return new AnthropicCompletionService(
                        withTimeout(httpClient, config.getTimeoutMs()),
                        config.getBaseUrl(),
                        config.getModel(),
                        config.getApiKey(),
                        config.getTemperature(),
                        config.getMaxTokens());
            case "extractive":
                log.info("Completion provider=extractive");
                return new ExtractiveCompletionService();
            default:
                throw new IllegalArgumentException("Unknown completion provider: " + config.getProvider());
        }
    }

    private static OkHttpClient withTimeout(OkHttpClient httpClient, int timeoutMs) {
        if (timeoutMs <= 0) {
            return httpClient;
        }
        return httpClient.newBuilder()
                .callTimeout(Duration.ofMillis(timeoutMs))
                .build();
    }

    private static String normalize(String provider) {
        return provider == null ? "" : provider.trim().toLowerCase(Locale.ROOT);
    }
}
