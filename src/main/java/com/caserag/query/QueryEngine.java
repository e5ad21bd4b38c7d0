package com.caserag.query;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.caserag.provider.CompletionService;
import com.caserag.provider.EmbeddingService;
import com.caserag.runtime.InvalidRequestException;
import com.caserag.store.FragmentHit;
import com.caserag.store.MetadataFilter;
import com.caserag.store.StoredFragment;
import com.caserag.store.VectorStore;

/**
 * Answers a question from the nearest stored fragments, optionally restricted to one case, and cites
 * every fragment handed to the completion provider. Fragments the provider drops to fit its context
 * window are not cited.
 */
public class QueryEngine {
    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    static final int SNIPPET_LENGTH = 200;
    static final String TRUNCATION_MARKER = "...";

    private final EmbeddingService embeddingService;
    private final CompletionService completionService;
    private final VectorStore vectorStore;
    private final int topK;

    public QueryEngine(EmbeddingService embeddingService, CompletionService completionService, VectorStore vectorStore,
            int topK) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
        this.embeddingService = embeddingService;
        this.completionService = completionService;
        this.vectorStore = vectorStore;
        this.topK = topK;
    }

    public QueryResult answer(String queryText, String caseIdFilter) {
        if (queryText == null || queryText.isBlank()) {
            throw new InvalidRequestException("Query cannot be empty");
        }
        long start = System.nanoTime();

        Optional<MetadataFilter> filter = caseIdFilter == null || caseIdFilter.isBlank()
                ? Optional.empty()
                : Optional.of(MetadataFilter.caseId(caseIdFilter));
        float[] embedding = embeddingService.embed(queryText);
        List<FragmentHit> hits = vectorStore.query(embedding, topK, filter);

        List<String> contexts = completionService.fitContexts(queryText,
                hits.stream().map(hit -> hit.fragment().text()).toList());
        List<SourceCitation> sources = hits.subList(0, contexts.size()).stream()
                .map(QueryEngine::toCitation)
                .toList();
        if (contexts.size() < hits.size()) {
            log.debug("Context window kept {} of {} retrieved fragments", contexts.size(), hits.size());
        }
        String answer = completionService.complete(queryText, contexts);

        long processingTimeMs = (System.nanoTime() - start) / 1_000_000;
        log.info("query.telemetry caseFilter={} retrieved={} processingMs={}",
                filter.map(MetadataFilter::value).orElse("none"), hits.size(), processingTimeMs);
        return new QueryResult(answer, sources, new QueryMetadata(sources.size(), processingTimeMs));
    }

    static SourceCitation toCitation(FragmentHit hit) {
        StoredFragment fragment = hit.fragment();
        return new SourceCitation(fragment.id(), fragment.fileName(), snippet(fragment.text()), hit.similarity());
    }

    static String snippet(String text) {
        if (text.length() <= SNIPPET_LENGTH) {
            return text;
        }
        return text.substring(0, SNIPPET_LENGTH) + TRUNCATION_MARKER;
    }
}
