package com.caserag.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ChunkerTest {

    @Test
    void shouldSplitIntoOverlappingWordWindows() {
        Chunker chunker = new Chunker(4, 1);
        SourceDocument document = new SourceDocument("report.txt", "w0 w1 w2 w3\nw4  w5 w6 w7 w8 w9",
                Map.of("page_label", "2"));

        List<DocumentFragment> fragments = chunker.chunk(document);

        assertEquals(3, fragments.size());
        assertEquals("w0 w1 w2 w3", fragments.get(0).text());
        assertEquals("w3 w4 w5 w6", fragments.get(1).text());
        assertEquals("w6 w7 w8 w9", fragments.get(2).text());
        assertEquals("2", fragments.get(2).metadata().get("chunk_index"));
        assertEquals("report.txt", fragments.get(1).metadata().get("file_name"));
        assertEquals("2", fragments.get(0).metadata().get("page_label"));
    }

    @Test
    void shortDocumentIsOneFragment() {
        List<DocumentFragment> fragments = new Chunker(512, 50).chunk(new SourceDocument("a.txt", "just a few words", Map.of()));

        assertEquals(1, fragments.size());
        assertEquals(0, fragments.get(0).chunkIndex());
    }

    @Test
    void blankDocumentYieldsNothing() {
        assertTrue(new Chunker(10, 2).chunk(new SourceDocument("a.txt", "  \n\t ", Map.of())).isEmpty());
        assertTrue(new Chunker(10, 2).chunk(new SourceDocument("a.txt", null, Map.of())).isEmpty());
    }

    @Test
    void shouldRejectOverlapNotSmallerThanWindow() {
        assertThrows(IllegalArgumentException.class, () -> new Chunker(5, 5));
        assertThrows(IllegalArgumentException.class, () -> new Chunker(0, 0));
        assertThrows(IllegalArgumentException.class, () -> new Chunker(5, -1));
    }
}
