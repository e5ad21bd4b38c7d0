package com.caserag.store;

/**
 * Converts store distances into relevance scores. Every score the system reports is derived here, so
 * similarity stays in (0, 1], is strictly decreasing in distance, and a zero distance maps to exactly 1.
 */
public final class Similarity {
    private Similarity() {
    }

    public static double fromDistance(double distance) {
        if (Double.isNaN(distance) || distance < 0d) {
            throw new IllegalArgumentException("Distance must be a non-negative number: " + distance);
        }
        return 1.0d / (1.0d + distance);
    }

    /**
     * Similarity on a 0-100 scale rounded to one decimal place.
     */
    public static double toPercent(double similarity) {
        return Math.round(similarity * 1000.0d) / 10.0d;
    }
}
