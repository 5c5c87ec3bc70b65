package com.semsearch.embedding;

public final class Vectors {
    private Vectors() {
    }

    /**
     * Returns an L2-normalised copy. Zero vectors are returned as zeros.
     */
    public static float[] normalized(float[] vector) {
        float[] copy = vector.clone();
        normalizeInPlace(copy);
        return copy;
    }

    public static void normalizeInPlace(float[] vector) {
        double norm = 0d;
        for (float value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        if (norm <= 0d) {
            return;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) (vector[i] / norm);
        }
    }

    public static float dot(float[] a, float[] b) {
        float sum = 0f;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
