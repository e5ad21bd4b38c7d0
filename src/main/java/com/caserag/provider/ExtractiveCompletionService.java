package com.caserag.provider;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Offline completion that answers by quoting, for each context, the first sentence sharing a keyword
 * with the query.
 */
public class ExtractiveCompletionService implements CompletionService {
    private static final int MAX_QUOTES = 3;

    @Override
    public String complete(String query, List<String> contexts) {
        if (contexts.isEmpty()) {
            return "No relevant case documents were found for this question. Ingestion may be required.";
        }
        Set<String> keywords = keywords(query);
        StringBuilder builder = new StringBuilder("Based on the retrieved case documents:");
        int quoted = 0;
        for (String context : contexts) {
            if (quoted == MAX_QUOTES) {
                break;
            }
            String sentence = firstMatchingSentence(context, keywords);
            if (sentence.isEmpty()) {
                continue;
            }
            builder.append("\n[").append(quoted + 1).append("] ").append(sentence);
            quoted++;
        }
        return builder.toString();
    }

    private static Set<String> keywords(String input) {
        return Arrays.stream(input.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(token -> token.length() > 2)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static String firstMatchingSentence(String text, Set<String> keywords) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String[] sentences = text.strip().split("(?<=[.!?])\\s+");
        for (String sentence : sentences) {
            String lower = sentence.toLowerCase(Locale.ROOT);
            if (keywords.stream().anyMatch(lower::contains)) {
                return sentence.strip();
            }
        }
        return sentences[0].strip();
    }
}
