package com.caserag.ingest;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Ledger of (case, source file) pairs that have already been turned into stored fragments. Not
 * thread-safe; callers serialize access.
 */
public class IngestionManifest {
    private static final Logger log = LoggerFactory.getLogger(IngestionManifest.class);
    private static final String SEPARATOR = "_";

    private final Path path;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, ManifestEntry> entries = new LinkedHashMap<>();

    public IngestionManifest(Path path) {
        this.path = path;
    }

    public static String key(String caseId, String fileName) {
        return caseId + SEPARATOR + fileName;
    }

    /**
     * Replaces the in-memory ledger with the file contents. A missing file is an empty ledger; a
     * malformed one is logged and also treated as empty.
     */
    public void load() throws IOException {
        entries.clear();
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return;
        }
        try {
            Map<String, ManifestEntry> loaded = mapper.readValue(path.toFile(),
                    new TypeReference<LinkedHashMap<String, ManifestEntry>>() {
                    });
            if (loaded != null) {
                entries.putAll(loaded);
            }
        } catch (JsonProcessingException e) {
            log.warn("Ingestion manifest {} is malformed, continuing with an empty manifest: {}",
                    path, e.getOriginalMessage());
        }
    }

    public boolean has(String key) {
        return entries.containsKey(key);
    }

    public void record(String key, ManifestEntry entry) {
        entries.put(key, entry);
    }

    public int removeByCasePrefix(String caseId) {
        String prefix = caseId + SEPARATOR;
        int removed = 0;
        Iterator<Map.Entry<String, ManifestEntry>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, ManifestEntry> entry = iterator.next();
            String entryCase = entry.getValue() == null ? null : entry.getValue().caseId();
            boolean belongs = entryCase != null ? entryCase.equals(caseId) : entry.getKey().startsWith(prefix);
            if (belongs) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    public void save() throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), entries);
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public void clear() throws IOException {
        entries.clear();
        Files.deleteIfExists(path);
    }

    public Set<String> keys() {
        return Set.copyOf(entries.keySet());
    }

    public ManifestEntry get(String key) {
        return entries.get(key);
    }

    public int size() {
        return entries.size();
    }

    public Path path() {
        return path;
    }
}
