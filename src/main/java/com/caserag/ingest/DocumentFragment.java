package com.caserag.ingest;

import java.util.Map;

public record DocumentFragment(String fileName, int chunkIndex, String text, Map<String, String> metadata) {
}
