package eu.virtualparadox.titanshield.safety;

import eu.virtualparadox.titanshield.knowledge.store.KnowledgeStoreConfigurationException;
import eu.virtualparadox.titanshield.util.VectorMath;

/**
 * Fixed set of "unsafe intent" vectors, L2-normalised on construction and never modified afterwards.
 */
public final class UnsafeIntentMatrix {

    private final float[][] rows;
    private final int dimension;

    /**
     * @param rows raw vectors; copied
     * @throws KnowledgeStoreConfigurationException if rows differ in length or a row has no direction
     */
    public UnsafeIntentMatrix(final float[][] rows) {
        this.dimension = rows.length == 0 ? 0 : rows[0].length;
        this.rows = new float[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i] == null || rows[i].length != dimension) {
                throw new KnowledgeStoreConfigurationException(
                        "Unsafe-intent matrix is ragged: row " + i + " differs from dimension " + dimension);
            }
            if (!VectorMath.isUsable(rows[i])) {
                throw new KnowledgeStoreConfigurationException("Unsafe-intent matrix row " + i + " is not usable");
            }
            this.rows[i] = VectorMath.normalize(rows[i]);
        }
    }

    public static UnsafeIntentMatrix empty() {
        return new UnsafeIntentMatrix(new float[0][]);
    }

    /**
     * Highest cosine similarity between {@code query} and any row.
     *
     * @return maximum similarity, or {@link Double#NaN} for an empty matrix or a zero query
     * @throws IllegalArgumentException if the query dimension differs from {@link #dimension()}
     */
    public double maxSimilarity(final float[] query) {
        if (rows.length == 0) {
            return Double.NaN;
        }
        if (query.length != dimension) {
            throw new IllegalArgumentException("Query dimension " + query.length + " != matrix dimension " + dimension);
        }
        final float[] q = VectorMath.normalize(query);
        if (!VectorMath.isUsable(q)) {
            return Double.NaN;
        }

        double max = Double.NEGATIVE_INFINITY;
        for (final float[] row : rows) {
            double dot = 0.0;
            for (int i = 0; i < dimension; i++) {
                dot += (double) row[i] * q[i];
            }
            max = Math.max(max, dot);
        }
        return max;
    }

    public boolean isEmpty() {
        return rows.length == 0;
    }

    public int size() {
        return rows.length;
    }

    public int dimension() {
        return dimension;
    }
}
