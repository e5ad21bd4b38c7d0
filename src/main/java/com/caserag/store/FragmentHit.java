package com.caserag.store;

public record FragmentHit(StoredFragment fragment, double distance) {

    public double similarity() {
        return Similarity.fromDistance(distance);
    }
}
