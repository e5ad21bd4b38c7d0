package com.caserag.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.caserag.provider.CompletionService;
import com.caserag.provider.EmbeddingService;
import com.caserag.provider.ProviderException;
import com.caserag.runtime.InvalidRequestException;
import com.caserag.store.LocalJsonVectorStore;

class QueryEngineTest {

    @TempDir
    Path tempDir;

    private final AtomicInteger embedCalls = new AtomicInteger();
    private final List<String> seenContexts = new ArrayList<>();
    private LocalJsonVectorStore store;

    private final EmbeddingService origin = new EmbeddingService() {
        @Override
        public float[] embed(String text) {
            embedCalls.incrementAndGet();
            return new float[] { 0f, 0f };
        }

        @Override
        public int dimension() {
            return 2;
        }
    };

    private final CompletionService recording = (query, contexts) -> {
        seenContexts.addAll(contexts);
        return "answer to " + query;
    };

    @BeforeEach
    void setUp() {
        store = LocalJsonVectorStore.open(tempDir, "cases");
        store.insert("x".repeat(250), Map.of("case_id", "case_003", "file_name", "long.txt"), new float[] { 1f, 0f });
        store.insert("short text", Map.of("case_id", "case_003", "file_name", "short.txt"), new float[] { 0f, 0f });
        store.insert("other case", Map.of("case_id", "case_004", "file_name", "other.txt"), new float[] { 0.1f, 0f });
        store.insert("no file name", Map.of("case_id", "case_005"), new float[] { 3f, 0f });
    }

    @Test
    void shouldCiteRetrievedFragmentsWithStoreSimilarity() {
        QueryEngine engine = new QueryEngine(origin, recording, store, 3);

        QueryResult result = engine.answer("what happened?", null);

        assertEquals("answer to what happened?", result.answer());
        assertEquals(3, result.sources().size());
        assertEquals(3, result.metadata().totalChunksRetrieved());
        assertTrue(result.metadata().processingTimeMs() >= 0);

        SourceCitation best = result.sources().get(0);
        assertEquals("short.txt", best.documentId());
        assertEquals("short text", best.snippet());
        assertEquals(1.0d, best.relevanceScore());
        assertEquals(1.0d / 1.1d, result.sources().get(1).relevanceScore(), 1e-6);
        assertEquals(List.of("short text", "other case", "x".repeat(250)), seenContexts);
    }

    @Test
    void caseFilterShouldRestrictSources() {
        QueryEngine engine = new QueryEngine(origin, recording, store, 5);

        QueryResult result = engine.answer("question", "case_003");

        assertEquals(2, result.sources().size());
        for (String context : seenContexts) {
            assertTrue(context.equals("short text") || context.startsWith("xxx"));
        }
    }

    @Test
    void blankFilterMeansNoFilter() {
        QueryResult result = new QueryEngine(origin, recording, store, 5).answer("question", "  ");

        assertEquals(4, result.sources().size());
        assertEquals("unknown", result.sources().get(3).documentId());
    }

    @Test
    void contextsDroppedByTheProviderShouldNotBeCited() {
        CompletionService windowOfOne = new CompletionService() {
            @Override
            public List<String> fitContexts(String query, List<String> contexts) {
                return contexts.subList(0, 1);
            }

            @Override
            public String complete(String query, List<String> contexts) {
                seenContexts.addAll(contexts);
                return "trimmed";
            }
        };

        QueryResult result = new QueryEngine(origin, windowOfOne, store, 3).answer("question", null);

        assertEquals(List.of("short text"), seenContexts);
        assertEquals(1, result.sources().size());
        assertEquals("short.txt", result.sources().get(0).documentId());
        assertEquals(1, result.metadata().totalChunksRetrieved());
    }

    @Test
    void snippetShouldBeCutAt200WithMarker() {
        String cut = QueryEngine.snippet("y".repeat(201));

        assertEquals(203, cut.length());
        assertTrue(cut.endsWith("..."));
        assertEquals("y".repeat(200), QueryEngine.snippet("y".repeat(200)));
    }

    @Test
    void blankQueryIsRejectedBeforeAnyProviderCall() {
        QueryEngine engine = new QueryEngine(origin, recording, store, 5);

        assertThrows(InvalidRequestException.class, () -> engine.answer("   ", null));
        assertThrows(InvalidRequestException.class, () -> engine.answer(null, null));
        assertEquals(0, embedCalls.get());
    }

    @Test
    void completionFailureShouldPropagate() {
        CompletionService failing = (query, contexts) -> {
            throw new ProviderException("anthropic", "overloaded", 529, null);
        };
        QueryEngine engine = new QueryEngine(origin, failing, store, 5);

        assertThrows(ProviderException.class, () -> engine.answer("question", null));
    }
}
