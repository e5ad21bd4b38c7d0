package com.caserag.cases;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.caserag.provider.EmbeddingService;
import com.caserag.runtime.InvalidRequestException;
import com.caserag.store.FragmentHit;
import com.caserag.store.Similarity;
import com.caserag.store.VectorStore;

/**
 * Ranks whole cases against a free-text description. A wide pool of nearest fragments is collapsed to
 * one hit per case, keeping the best similarity, and the survivors are joined with case metadata.
 */
public class CaseAggregator {
    private static final Logger log = LoggerFactory.getLogger(CaseAggregator.class);

    static final int SUMMARY_LENGTH = 300;
    static final int MAX_KEY_FINDINGS = 5;

    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;
    private final CaseMetadataRepository metadataRepository;
    private final int poolSize;

    public CaseAggregator(EmbeddingService embeddingService, VectorStore vectorStore,
            CaseMetadataRepository metadataRepository, int poolSize) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive");
        }
        this.embeddingService = embeddingService;
        this.vectorStore = vectorStore;
        this.metadataRepository = metadataRepository;
        this.poolSize = poolSize;
    }

    public List<CaseAggregateResult> rankCases(String description, int topN) {
        if (description == null || description.isBlank()) {
            throw new InvalidRequestException("Description cannot be empty");
        }
        if (topN < 1) {
            throw new InvalidRequestException("topN must be at least 1");
        }
        int stored = vectorStore.count();
        if (stored == 0) {
            return List.of();
        }

        float[] embedding = embeddingService.embed(description);
        List<FragmentHit> pool = vectorStore.query(embedding, Math.min(poolSize, stored), Optional.empty());

        // Ordered on the reported score so equal scores list case ids ascending.
        List<CaseCandidate> ranked = bestHitPerCase(pool).stream()
                .sorted(Comparator.comparingDouble(CaseCandidate::score).reversed()
                        .thenComparing(CaseCandidate::caseId))
                .limit(topN)
                .toList();

        List<CaseAggregateResult> results = new ArrayList<>(ranked.size());
        for (CaseCandidate candidate : ranked) {
            results.add(toResult(candidate));
        }
        log.info("rank.telemetry pool={} distinctCases={} returned={}", pool.size(), ranked.size(), results.size());
        return results;
    }

    static List<CaseCandidate> bestHitPerCase(List<FragmentHit> pool) {
        Map<String, CaseCandidate> best = new LinkedHashMap<>();
        for (FragmentHit hit : pool) {
            String caseId = hit.fragment().caseId();
            if (caseId == null || caseId.isBlank()) {
                continue;
            }
            double similarity = hit.similarity();
            CaseCandidate current = best.get(caseId);
            // Strictly greater: on an exact tie the first hit seen is kept.
            if (current == null || similarity > current.similarity()) {
                best.put(caseId, new CaseCandidate(caseId, similarity, hit.fragment().text()));
            }
        }
        return new ArrayList<>(best.values());
    }

    private CaseAggregateResult toResult(CaseCandidate candidate) {
        String caseId = candidate.caseId();
        String title = caseId;
        String summary = truncate(candidate.fragmentText(), SUMMARY_LENGTH);
        List<String> keyFindings = List.of();
        int documentCount = 0;

        CaseLookup lookup = metadataRepository.lookup(caseId);
        Optional<CaseMetadata> found = lookup.metadataIfFound();
        if (found.isPresent()) {
            CaseMetadata metadata = found.get();
            if (metadata.title() != null && !metadata.title().isBlank()) {
                title = metadata.title();
            }
            if (metadata.summary() != null && !metadata.summary().isBlank()) {
                summary = metadata.summary();
            }
            keyFindings = metadata.keyFindings().stream().limit(MAX_KEY_FINDINGS).toList();
            documentCount = metadata.documents().size();
        } else {
            log.debug("Metadata fallback for case {} reason={} detail={}", caseId, lookup.fallbackReason(), lookup.detail());
        }
        if (documentCount == 0) {
            documentCount = metadataRepository.countContentFiles(caseId);
        }

        return new CaseAggregateResult(caseId, title, candidate.score(), summary, keyFindings, documentCount);
    }

    private static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }

    record CaseCandidate(String caseId, double similarity, String fragmentText) {

        double score() {
            return Similarity.toPercent(similarity);
        }
    }
}
