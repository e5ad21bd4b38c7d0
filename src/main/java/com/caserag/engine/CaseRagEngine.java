package com.caserag.engine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.caserag.cases.CaseAggregateResult;
import com.caserag.cases.CaseAggregator;
import com.caserag.cases.CaseDirectoryValidator;
import com.caserag.cases.CaseMetadataRepository;
import com.caserag.cases.CaseSummary;
import com.caserag.cases.CaseValidationReport;
import com.caserag.ingest.CaseDocumentReader;
import com.caserag.ingest.Chunker;
import com.caserag.ingest.IngestionManifest;
import com.caserag.ingest.IngestionReport;
import com.caserag.ingest.IngestionService;
import com.caserag.provider.CompletionService;
import com.caserag.provider.EmbeddingService;
import com.caserag.provider.Providers;
import com.caserag.query.QueryEngine;
import com.caserag.query.QueryResult;
import com.caserag.runtime.AppConfig;
import com.caserag.runtime.EngineNotInitializedException;
import com.caserag.runtime.InvalidRequestException;
import com.caserag.store.LocalJsonVectorStore;
import com.caserag.store.MetadataFilter;
import com.caserag.store.VectorStore;

import okhttp3.OkHttpClient;

/**
 * Long-lived context object owning the providers, the vector store, the manifest and the services built
 * on them. Created once per process, initialized once, and passed to whatever serves requests.
 *
 * <p>Queries, rankings and ingestion share the storage lock; clearing takes it exclusively. Ingestion of
 * the same case is serialized by a per-case lock, always acquired before the storage lock.
 */
public class CaseRagEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CaseRagEngine.class);

    private final AppConfig config;
    private final BiFunction<AppConfig.EmbeddingConfig, OkHttpClient, EmbeddingService> embeddingFactory;
    private final BiFunction<AppConfig.CompletionConfig, OkHttpClient, CompletionService> completionFactory;
    private final BiFunction<Path, String, VectorStore> storeOpener;
    private final OkHttpClient httpClient = new OkHttpClient();
    private final ReentrantReadWriteLock storageLock = new ReentrantReadWriteLock(true);
    private final ConcurrentMap<String, ReentrantLock> caseLocks = new ConcurrentHashMap<>();

    private volatile Components components;

    public CaseRagEngine(AppConfig config) {
        this(config, Providers::embedding, Providers::completion, LocalJsonVectorStore::open);
    }

    CaseRagEngine(AppConfig config,
            BiFunction<AppConfig.EmbeddingConfig, OkHttpClient, EmbeddingService> embeddingFactory,
            BiFunction<AppConfig.CompletionConfig, OkHttpClient, CompletionService> completionFactory,
            BiFunction<Path, String, VectorStore> storeOpener) {
        this.config = config;
        this.embeddingFactory = embeddingFactory;
        this.completionFactory = completionFactory;
        this.storeOpener = storeOpener;
    }

    /**
     * Configures the providers and opens the vector store. A second call is a no-op.
     */
    public synchronized void initialize() {
        if (components != null) {
            log.debug("Engine already initialized");
            return;
        }
        AppConfig.StorageConfig storage = config.getStorage();
        EmbeddingService embeddingService = embeddingFactory.apply(config.getEmbedding(), httpClient);
        CompletionService completionService = completionFactory.apply(config.getCompletion(), httpClient);
        VectorStore vectorStore = storeOpener.apply(Path.of(storage.getVectorStorePath()), storage.getCollection());

        CaseDocumentReader documentReader = new CaseDocumentReader();
        CaseMetadataRepository repository = new CaseMetadataRepository(Path.of(storage.getCasesRoot()));
        AppConfig.ChunkingConfig chunking = config.getChunking();
        IngestionService ingestionService = new IngestionService(
                documentReader,
                new Chunker(chunking.getChunkSize(), chunking.getChunkOverlap()),
                embeddingService,
                vectorStore,
                new IngestionManifest(Path.of(storage.getManifestPath())));
        AppConfig.RetrievalConfig retrieval = config.getRetrieval();

        components = new Components(
                vectorStore,
                ingestionService,
                new QueryEngine(embeddingService, completionService, vectorStore, retrieval.getTopK()),
                new CaseAggregator(embeddingService, vectorStore, repository, retrieval.getCasePoolSize()),
                repository,
                new CaseDirectoryValidator(documentReader));
        log.info("Engine initialized casesRoot={} vectorStore={} collection={} fragments={}",
                storage.getCasesRoot(), storage.getVectorStorePath(), storage.getCollection(), vectorStore.count());
    }

    public boolean isInitialized() {
        return components != null;
    }

    /**
     * Flushes the store and returns the engine to the uninitialized state.
     */
    public synchronized void shutdown() {
        Components current = components;
        if (current == null) {
            return;
        }
        storageLock.writeLock().lock();
        try {
            current.vectorStore().flush();
            components = null;
        } finally {
            storageLock.writeLock().unlock();
        }
        httpClient.connectionPool().evictAll();
        log.info("Engine shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    public QueryResult query(String text, String caseIdFilter) {
        Components current = components();
        storageLock.readLock().lock();
        try {
            return current.queryEngine().answer(text, caseIdFilter);
        } finally {
            storageLock.readLock().unlock();
        }
    }

    public List<CaseAggregateResult> rankCases(String description, int topN) {
        Components current = components();
        storageLock.readLock().lock();
        try {
            return current.caseAggregator().rankCases(description, topN);
        } finally {
            storageLock.readLock().unlock();
        }
    }

    public IngestionReport ingest(Path caseDirectory, String caseId, Map<String, String> metadata, boolean force)
            throws IOException {
        Components current = components();
        requireCaseId(caseId);
        if (caseDirectory == null || !Files.isDirectory(caseDirectory)) {
            throw new InvalidRequestException("Case directory not found: " + caseDirectory);
        }
        Lock caseLock = caseLock(caseId);
        caseLock.lock();
        try {
            storageLock.readLock().lock();
            try {
                return current.ingestionService().ingest(caseDirectory, caseId, metadata, force);
            } finally {
                storageLock.readLock().unlock();
            }
        } finally {
            caseLock.unlock();
        }
    }

    /**
     * Ingests {@code <casesRoot>/<caseId>}, optionally clearing the case's fragments and manifest entries
     * first.
     */
    public IngestionReport ingestCase(String caseId, Map<String, String> metadata, boolean force, boolean clearFirst)
            throws IOException {
        Components current = components();
        requireCaseId(caseId);
        Path caseDirectory = current.repository().caseDirectory(caseId);
        if (!Files.isDirectory(caseDirectory)) {
            throw new InvalidRequestException("Case directory not found: " + caseDirectory);
        }
        Lock caseLock = caseLock(caseId);
        caseLock.lock();
        try {
            if (clearFirst) {
                clearCase(caseId);
            }
            return ingest(caseDirectory, caseId, metadata, force);
        } finally {
            caseLock.unlock();
        }
    }

    public int documentCount() {
        Components current = components();
        storageLock.readLock().lock();
        try {
            return current.vectorStore().count();
        } finally {
            storageLock.readLock().unlock();
        }
    }

    /**
     * Deletes every stored fragment and the manifest. Returns {@code false} if either step failed; the
     * failure is logged.
     */
    public boolean clearAll() {
        Components current = components();
        storageLock.writeLock().lock();
        try {
            int before = current.vectorStore().count();
            current.vectorStore().deleteAll();
            current.ingestionService().forgetAll();
            log.info("clear.all fragmentsRemoved={}", before);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Error clearing documents: {}", e.getMessage(), e);
            return false;
        } finally {
            storageLock.writeLock().unlock();
        }
    }

    /**
     * Removes one case's fragments and manifest entries. Returns the number of manifest entries removed.
     */
    public int clearCase(String caseId) throws IOException {
        Components current = components();
        requireCaseId(caseId);
        Lock caseLock = caseLock(caseId);
        caseLock.lock();
        try {
            storageLock.writeLock().lock();
            try {
                int fragments = current.vectorStore().deleteWhere(MetadataFilter.caseId(caseId));
                int entries = current.ingestionService().forgetCase(caseId);
                log.info("clear.case caseId={} fragmentsRemoved={} manifestEntriesRemoved={}", caseId, fragments, entries);
                return entries;
            } finally {
                storageLock.writeLock().unlock();
            }
        } finally {
            caseLock.unlock();
        }
    }

    public List<CaseSummary> listCases() throws IOException {
        return components().repository().listCases();
    }

    public List<String> caseIds() throws IOException {
        return components().repository().caseIds();
    }

    public CaseValidationReport validateCase(String caseId) {
        Components current = components();
        requireCaseId(caseId);
        return current.validator().validate(current.repository().caseDirectory(caseId), caseId);
    }

    public AppConfig config() {
        return config;
    }

    private Components components() {
        Components current = components;
        if (current == null) {
            throw new EngineNotInitializedException();
        }
        return current;
    }

    private Lock caseLock(String caseId) {
        return caseLocks.computeIfAbsent(caseId, id -> new ReentrantLock());
    }

    private static void requireCaseId(String caseId) {
        if (caseId == null || caseId.isBlank()) {
            throw new InvalidRequestException("Case id cannot be empty");
        }
    }

    private record Components(
            VectorStore vectorStore,
            IngestionService ingestionService,
            QueryEngine queryEngine,
            CaseAggregator caseAggregator,
            CaseMetadataRepository repository,
            CaseDirectoryValidator validator) {
    }
}
