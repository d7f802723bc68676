package com.tailorai.infrastructure.ai.validation;

final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity of two vectors. Zero when either vector has zero magnitude.
     */
    static double cosineSimilarity(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0;
        double magA = 0;
        double magB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            magA += a[i] * a[i];
            magB += b[i] * b[i];
        }
        if (magA == 0 || magB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(magA) * Math.sqrt(magB));
    }
}
