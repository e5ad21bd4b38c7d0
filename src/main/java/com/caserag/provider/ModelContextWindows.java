package com.caserag.provider;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Context window sizes in tokens, keyed by model name prefix. The longest matching prefix wins, so
 * dated releases such as {@code claude-sonnet-4-5-20250929} resolve through their family prefix.
 */
public final class ModelContextWindows {
    private static final Map<String, Integer> WINDOWS = new LinkedHashMap<>();

    static {
        WINDOWS.put("claude-opus-4", 200_000);
        WINDOWS.put("claude-sonnet-4", 200_000);
        WINDOWS.put("claude-haiku-4", 200_000);
        WINDOWS.put("claude-3-7-sonnet", 200_000);
        WINDOWS.put("claude-3-5-sonnet", 200_000);
        WINDOWS.put("claude-3-5-haiku", 200_000);
        WINDOWS.put("claude-3-opus", 200_000);
        WINDOWS.put("claude-3-sonnet", 200_000);
        WINDOWS.put("claude-3-haiku", 200_000);
        WINDOWS.put("claude-2.1", 200_000);
        WINDOWS.put("claude-2.0", 100_000);
        WINDOWS.put("claude-instant-1", 100_000);
    }

    private ModelContextWindows() {
    }

    public static Optional<Integer> find(String model) {
        if (model == null || model.isBlank()) {
            return Optional.empty();
        }
        String normalized = model.toLowerCase(Locale.ROOT);
        String best = null;
        for (String prefix : WINDOWS.keySet()) {
            if (normalized.startsWith(prefix) && (best == null || prefix.length() > best.length())) {
                best = prefix;
            }
        }
        return best == null ? Optional.empty() : Optional.of(WINDOWS.get(best));
    }

    public static int contextWindow(String model) {
        return find(model).orElseThrow(() -> new IllegalArgumentException("Unknown model for context window lookup: " + model));
    }
}
