package com.dcruver.beliefgraph.index;

/**
 * Vector helpers for cosine similarity.
 */
public final class VectorMath {

    private VectorMath() {
    }

    public static double norm(float[] vector) {
        double sum = 0.0;
        for (float v : vector) {
            sum += (double) v * v;
        }
        return Math.sqrt(sum);
    }

    /**
     * L2-normalized copy. A zero vector is returned as a zero copy.
     */
    public static float[] normalize(float[] vector) {
        double norm = norm(vector);
        float[] result = new float[vector.length];
        if (norm == 0.0) {
            return result;
        }
        for (int i = 0; i < vector.length; i++) {
            result[i] = (float) (vector[i] / norm);
        }
        return result;
    }

    public static double dot(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    /**
     * Cosine similarity, or NaN when either vector has zero norm.
     */
    static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors must have same dimension");
        }
        double normA = norm(a);
        double normB = norm(b);
        if (normA == 0.0 || normB == 0.0) {
            return Double.NaN;
        }
        return clamp(dot(a, b) / (normA * normB));
    }

    static double clamp(double score) {
        return Math.max(-1.0, Math.min(1.0, score));
    }
}
