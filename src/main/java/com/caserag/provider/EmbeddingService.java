package com.caserag.provider;

public interface EmbeddingService {
    float[] embed(String text);

    int dimension();
}
