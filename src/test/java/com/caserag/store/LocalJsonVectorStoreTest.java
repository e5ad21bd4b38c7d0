package com.caserag.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalJsonVectorStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void freshStoreCountsZeroAndQueriesEmpty() {
        LocalJsonVectorStore store = LocalJsonVectorStore.open(tempDir.resolve("vs"), "cases");

        assertEquals(0, store.count());
        assertTrue(store.query(new float[] { 1f, 0f }, 5, Optional.empty()).isEmpty());
        assertTrue(Files.isDirectory(tempDir.resolve("vs")));
    }

    @Test
    void shouldOrderByDistanceAndBreakTiesByInsertionOrder() {
        LocalJsonVectorStore store = LocalJsonVectorStore.open(tempDir, "cases");
        String far = store.insert("far", Map.of("case_id", "case_001"), new float[] { 3f, 0f });
        String tieFirst = store.insert("tie first", Map.of("case_id", "case_001"), new float[] { 0f, 1f });
        String exact = store.insert("exact", Map.of("case_id", "case_002"), new float[] { 0f, 0f });
        String tieSecond = store.insert("tie second", Map.of("case_id", "case_002"), new float[] { 1f, 0f });

        List<FragmentHit> hits = store.query(new float[] { 0f, 0f }, 10, Optional.empty());

        assertEquals(List.of(exact, tieFirst, tieSecond, far), hits.stream().map(hit -> hit.fragment().id()).toList());
        assertEquals(0.0d, hits.get(0).distance());
        assertEquals(1.0d, hits.get(0).similarity());
        assertEquals(3.0d, hits.get(3).distance(), 1e-9);
    }

    @Test
    void shouldReturnAtMostKAndAllWhenFewerEligible() {
        LocalJsonVectorStore store = LocalJsonVectorStore.open(tempDir, "cases");
        for (int i = 0; i < 4; i++) {
            store.insert("text " + i, Map.of("case_id", "case_00" + (i % 2)), new float[] { i, 0f });
        }

        assertEquals(2, store.query(new float[] { 0f, 0f }, 2, Optional.empty()).size());
        assertEquals(4, store.query(new float[] { 0f, 0f }, 50, Optional.empty()).size());
        assertTrue(store.query(new float[] { 0f, 0f }, 0, Optional.empty()).isEmpty());
    }

    @Test
    void filterShouldOnlyReturnMatchingCase() {
        LocalJsonVectorStore store = LocalJsonVectorStore.open(tempDir, "cases");
        store.insert("a", Map.of("case_id", "case_003"), new float[] { 5f, 5f });
        store.insert("b", Map.of("case_id", "case_004"), new float[] { 0f, 0f });
        store.insert("c", Map.of("case_id", "case_003"), new float[] { 1f, 1f });
        store.insert("d", Map.of("file_name", "no-case.txt"), new float[] { 0f, 0f });

        List<FragmentHit> hits = store.query(new float[] { 0f, 0f }, 10, Optional.of(MetadataFilter.caseId("case_003")));

        assertEquals(2, hits.size());
        for (FragmentHit hit : hits) {
            assertEquals("case_003", hit.fragment().caseId());
        }
        assertEquals("c", hits.get(0).fragment().text());
    }

    @Test
    void shouldNotRejectDuplicateContent() {
        LocalJsonVectorStore store = LocalJsonVectorStore.open(tempDir, "cases");
        String first = store.insert("same", Map.of(), new float[] { 1f });
        String second = store.insert("same", Map.of(), new float[] { 1f });

        assertNotEquals(first, second);
        assertEquals(2, store.count());
    }

    @Test
    void flushedFragmentsSurviveReopenWithInsertionOrder() {
        LocalJsonVectorStore store = LocalJsonVectorStore.open(tempDir, "cases");
        store.insert("one", Map.of("case_id", "case_001", "file_name", "report.txt"), new float[] { 1f, 1f });
        store.insert("two", Map.of("case_id", "case_001"), new float[] { 1f, 1f });
        store.flush();

        LocalJsonVectorStore reopened = LocalJsonVectorStore.open(tempDir, "cases");
        List<FragmentHit> hits = reopened.query(new float[] { 1f, 1f }, 5, Optional.empty());

        assertEquals(2, reopened.count());
        assertEquals("one", hits.get(0).fragment().text());
        assertEquals("report.txt", hits.get(0).fragment().fileName());
        assertEquals("unknown", hits.get(1).fragment().fileName());

        reopened.insert("three", Map.of(), new float[] { 1f, 1f });
        assertEquals("three", reopened.query(new float[] { 1f, 1f }, 5, Optional.empty()).get(2).fragment().text());
        assertFalse(Files.exists(tempDir.resolve("cases.json.tmp")));
    }

    @Test
    void deleteAllAndDeleteWhereArePersisted() {
        LocalJsonVectorStore store = LocalJsonVectorStore.open(tempDir, "cases");
        store.insert("a", Map.of("case_id", "case_1"), new float[] { 1f });
        store.insert("b", Map.of("case_id", "case_10"), new float[] { 1f });
        store.insert("c", Map.of("case_id", "case_1"), new float[] { 1f });
        store.flush();

        assertEquals(2, store.deleteWhere(MetadataFilter.caseId("case_1")));
        assertEquals(1, LocalJsonVectorStore.open(tempDir, "cases").count());

        store.deleteAll();
        assertEquals(0, store.count());
        assertEquals(0, LocalJsonVectorStore.open(tempDir, "cases").count());
        assertTrue(store.query(new float[] { 1f }, 3, Optional.empty()).isEmpty());
    }

    @Test
    void dimensionMismatchSurfacesAsStoreError() {
        LocalJsonVectorStore store = LocalJsonVectorStore.open(tempDir, "cases");
        store.insert("a", Map.of(), new float[] { 1f, 2f, 3f });

        assertThrows(VectorStoreException.class, () -> store.query(new float[] { 1f, 2f }, 1, Optional.empty()));
    }

    @Test
    void unreadableStoreFileFailsAtOpen() throws Exception {
        Files.writeString(tempDir.resolve("cases.json"), "{not json");

        assertThrows(VectorStoreException.class, () -> LocalJsonVectorStore.open(tempDir, "cases"));
    }

    @Test
    void unusableDirectoryFailsAtOpen() throws Exception {
        Path blocker = tempDir.resolve("file");
        Files.writeString(blocker, "x");

        assertThrows(VectorStoreException.class, () -> LocalJsonVectorStore.open(blocker.resolve("vs"), "cases"));
    }
}
