package com.caserag.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.caserag.provider.EmbeddingService;
import com.caserag.store.StoredFragment;
import com.caserag.store.VectorStore;

/**
 * Turns the content files of a case directory into stored fragments, consulting the manifest so that a
 * (case, file) pair is only ingested once unless a forced re-ingest is requested.
 *
 * <p>The manifest is read once at the start of a run and merged back once at the end. Both steps run
 * under a process-wide lock so that runs for different cases can proceed concurrently; runs for the same
 * case must be serialized by the caller.
 */
public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final CaseDocumentReader documentReader;
    private final Chunker chunker;
    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;
    private final IngestionManifest manifest;
    private final ReentrantLock manifestLock = new ReentrantLock();

    public IngestionService(CaseDocumentReader documentReader,
            Chunker chunker,
            EmbeddingService embeddingService,
            VectorStore vectorStore,
            IngestionManifest manifest) {
        this.documentReader = documentReader;
        this.chunker = chunker;
        this.embeddingService = embeddingService;
        this.vectorStore = vectorStore;
        this.manifest = manifest;
    }

    public IngestionReport ingest(Path caseDirectory, String caseId, Map<String, String> extraMetadata,
            boolean forceReingest) throws IOException {
        if (!Files.isDirectory(caseDirectory)) {
            throw new IllegalArgumentException("Case directory not found: " + caseDirectory);
        }
        List<Path> files = documentReader.listContentFiles(caseDirectory);
        if (files.isEmpty()) {
            log.warn("No content files in {}, nothing to ingest for case {}", caseDirectory, caseId);
            return IngestionReport.nothingToIngest(caseId);
        }

        Set<String> alreadyIngested = snapshotKeys();
        Map<String, ManifestEntry> completed = new LinkedHashMap<>();
        int ingested = 0;
        int skipped = 0;

        try {
            for (Path file : files) {
                String fileName = file.getFileName().toString();
                String key = IngestionManifest.key(caseId, fileName);
                List<DocumentFragment> fragments = fragmentsOf(file);

                if (alreadyIngested.contains(key) && !forceReingest) {
                    log.debug("Skipping {} ({} fragments, already ingested)", fileName, fragments.size());
                    skipped += fragments.size();
                    continue;
                }

                for (DocumentFragment fragment : fragments) {
                    Map<String, String> metadata = new HashMap<>(fragment.metadata());
                    if (extraMetadata != null) {
                        metadata.putAll(extraMetadata);
                    }
                    metadata.put(StoredFragment.CASE_ID, caseId);
                    vectorStore.insert(fragment.text(), metadata, embeddingService.embed(fragment.text()));
                    ingested++;
                }
                completed.put(key, new ManifestEntry(caseId, fileName, Instant.now().toString(),
                        caseDirectory.toString()));
                log.info("Ingested {} ({} fragments)", fileName, fragments.size());
            }
        } finally {
            vectorStore.flush();
            mergeIntoManifest(completed);
        }

        log.info("ingest.case caseId={} files={} ingested={} skipped={} force={}",
                caseId, files.size(), ingested, skipped, forceReingest);
        return new IngestionReport(caseId, files.size(), ingested, skipped);
    }

    /**
     * Removes the manifest entries of one case and returns how many were removed.
     */
    public int forgetCase(String caseId) throws IOException {
        manifestLock.lock();
        try {
            manifest.load();
            int removed = manifest.removeByCasePrefix(caseId);
            if (removed > 0) {
                manifest.save();
            }
            return removed;
        } finally {
            manifestLock.unlock();
        }
    }

    public void forgetAll() throws IOException {
        manifestLock.lock();
        try {
            manifest.clear();
        } finally {
            manifestLock.unlock();
        }
    }

    private List<DocumentFragment> fragmentsOf(Path file) throws IOException {
        List<DocumentFragment> fragments = new ArrayList<>();
        for (SourceDocument document : documentReader.load(file)) {
            fragments.addAll(chunker.chunk(document));
        }
        return fragments;
    }

    private Set<String> snapshotKeys() throws IOException {
        manifestLock.lock();
        try {
            manifest.load();
            return manifest.keys();
        } finally {
            manifestLock.unlock();
        }
    }

    private void mergeIntoManifest(Map<String, ManifestEntry> completed) throws IOException {
        if (completed.isEmpty()) {
            return;
        }
        manifestLock.lock();
        try {
            manifest.load();
            completed.forEach(manifest::record);
            manifest.save();
        } finally {
            manifestLock.unlock();
        }
    }
}
