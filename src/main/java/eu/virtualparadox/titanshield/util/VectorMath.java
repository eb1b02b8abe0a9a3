package eu.virtualparadox.titanshield.util;

/**
 * Small dense-vector helpers shared by the safety matrix and the embedding clients.
 */
public final class VectorMath {

    private VectorMath() {
        // prevent instantiation
    }

    /**
     * Cosine similarity of two vectors of equal length.
     *
     * @return similarity in {@code [-1, 1]}, or {@link Double#NaN} if either vector has zero norm
     * @throws IllegalArgumentException if the dimensions differ
     */
    public static double cosine(final float[] a, final float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimensions must match: " + a.length + " != " + b.length);
        }

        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return Double.NaN;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Returns an L2-normalised copy of the vector. A zero vector is returned unchanged (as a copy).
     */
    public static float[] normalize(final float[] vector) {
        double norm = 0.0;
        for (final float v : vector) {
            norm += (double) v * v;
        }
        norm = Math.sqrt(norm);

        final float[] normalized = vector.clone();
        if (norm > 0.0) {
            for (int i = 0; i < normalized.length; i++) {
                normalized[i] = (float) (normalized[i] / norm);
            }
        }
        return normalized;
    }

    /**
     * True if the vector is non-empty, contains only finite values and is not all zeros.
     * Lucene's cosine similarity rejects zero vectors, so such vectors are unusable for search.
     */
    public static boolean isUsable(final float[] vector) {
        if (vector == null || vector.length == 0) {
            return false;
        }
        boolean nonZero = false;
        for (final float v : vector) {
            if (!Float.isFinite(v)) {
                return false;
            }
            if (v != 0.0f) {
                nonZero = true;
            }
        }
        return nonZero;
    }
}
