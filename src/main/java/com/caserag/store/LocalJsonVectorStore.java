package com.caserag.store;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * File-backed collection of fragments kept fully in memory. Search is an exact scan using Euclidean
 * distance; the collection is written back as one JSON document on {@link #flush()}.
 */
public class LocalJsonVectorStore implements VectorStore {
    private static final Logger log = LoggerFactory.getLogger(LocalJsonVectorStore.class);

    private final Path file;
    private final List<StoredFragment> fragments = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .build();
    private long nextSequence;
    private boolean dirty;

    private LocalJsonVectorStore(Path file) {
        this.file = file;
    }

    public static LocalJsonVectorStore open(Path directory, String collection) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new VectorStoreException("Vector store directory is not usable: " + directory, e);
        }
        LocalJsonVectorStore store = new LocalJsonVectorStore(directory.resolve(collection + ".json"));
        store.load();
        log.info("Opened vector store file={} fragments={}", store.file, store.fragments.size());
        return store;
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            if (Files.size(file) == 0L) {
                return;
            }
            List<StoredFragment> loaded = objectMapper.readValue(file.toFile(), new TypeReference<List<StoredFragment>>() {
            });
            loaded.sort(Comparator.comparingLong(StoredFragment::sequence));
            fragments.addAll(loaded);
            nextSequence = loaded.isEmpty() ? 0L : loaded.get(loaded.size() - 1).sequence() + 1;
        } catch (IOException e) {
            throw new VectorStoreException("Vector store file is unreadable: " + file, e);
        }
    }

    @Override
    public String insert(String text, Map<String, String> metadata, float[] embedding) {
        if (embedding == null || embedding.length == 0) {
            throw new IllegalArgumentException("Embedding must not be empty");
        }
        lock.writeLock().lock();
        try {
            String id = UUID.randomUUID().toString();
            fragments.add(new StoredFragment(id, nextSequence++, text, metadata, embedding.clone()));
            dirty = true;
            return id;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<FragmentHit> query(float[] embedding, int k, Optional<MetadataFilter> filter) {
        if (k <= 0) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            List<FragmentHit> hits = new ArrayList<>();
            for (StoredFragment fragment : fragments) {
                if (filter.isPresent() && !filter.get().matches(fragment.metadata())) {
                    continue;
                }
                hits.add(new FragmentHit(fragment, distance(embedding, fragment)));
            }
            // List.sort is stable, so equal distances keep insertion order.
            hits.sort(Comparator.comparingDouble(FragmentHit::distance));
            return hits.size() > k ? List.copyOf(hits.subList(0, k)) : List.copyOf(hits);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int count() {
        lock.readLock().lock();
        try {
            return fragments.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void deleteAll() {
        lock.writeLock().lock();
        try {
            fragments.clear();
            dirty = true;
            writeFile();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int deleteWhere(MetadataFilter filter) {
        lock.writeLock().lock();
        try {
            int removed = 0;
            Iterator<StoredFragment> iterator = fragments.iterator();
            while (iterator.hasNext()) {
                if (filter.matches(iterator.next().metadata())) {
                    iterator.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                dirty = true;
                writeFile();
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void flush() {
        lock.writeLock().lock();
        try {
            if (dirty) {
                writeFile();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void writeFile() {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            objectMapper.writeValue(tmp.toFile(), fragments);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            dirty = false;
            log.debug("Flushed vector store file={} fragments={}", file, fragments.size());
        } catch (IOException e) {
            throw new VectorStoreException("Failed to write vector store file " + file, e);
        }
    }

    private static double distance(float[] query, StoredFragment fragment) {
        float[] stored = fragment.embedding();
        if (stored.length != query.length) {
            throw new VectorStoreException("Embedding dimension mismatch: query=" + query.length
                    + " stored=" + stored.length + " fragment=" + fragment.id());
        }
        double sum = 0d;
        for (int i = 0; i < query.length; i++) {
            double delta = (double) query[i] - stored[i];
            sum += delta * delta;
        }
        return Math.sqrt(sum);
    }
}
