package com.projectkb.store;

/**
 * Cosine distance on L2-normalized vectors. Both stored and query vectors go through
 * {@link #normalized(float[])} so distance is {@code 1 - dot}.
 */
public final class VectorMath {
    private VectorMath() {
    }

    public static float[] normalized(float[] vector) {
        float[] out = vector.clone();
        double norm = 0d;
        for (float value : out) {
            norm += (double) value * value;
        }
        norm = Math.sqrt(norm);
        if (norm == 0d) {
            return out;
        }
        for (int i = 0; i < out.length; i++) {
            out[i] = (float) (out[i] / norm);
        }
        return out;
    }

    /** Zero vectors have no direction; they sit at distance 1 from everything. */
    public static double cosineDistance(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0d;
        double aNorm = 0d;
        double bNorm = 0d;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            aNorm += (double) a[i] * a[i];
            bNorm += (double) b[i] * b[i];
        }
        if (aNorm == 0d || bNorm == 0d) {
            return 1.0;
        }
        return 1.0 - dot / Math.sqrt(aNorm * bNorm);
    }
}
