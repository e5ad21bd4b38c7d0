package com.caserag.provider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class ExtractiveCompletionServiceTest {

    private final ExtractiveCompletionService service = new ExtractiveCompletionService();

    @Test
    void shouldQuoteSentencesSharingAKeyword() {
        String answer = service.complete("competent finding?", List.of(
                "The hearing was delayed. The defendant was found competent in May.",
                "Risk assessment scored low. He remained competent after treatment.",
                "Unrelated first sentence. Another one."));

        assertEquals("Based on the retrieved case documents:"
                + "\n[1] The defendant was found competent in May."
                + "\n[2] He remained competent after treatment."
                + "\n[3] Unrelated first sentence.", answer);
    }

    @Test
    void noContextsMeansNoAnswer() {
        assertTrue(service.complete("anything", List.of()).startsWith("No relevant case documents"));
    }
}
