package com.example.codeintel.util;

public class VectorMath {

    private VectorMath() {
    }

    /**
     * Similitud coseno entre dos embeddings.
     * Vectores nulos, vacios, de distinta dimension o de norma cero puntuan 0.
     */
    public static double cosine(double[] a, double[] b) {
        if (a == null || b == null || a.length != b.length || a.length == 0) return 0.0;

        double dot = 0.0, na = 0.0, nb = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) return 0.0;
        double score = dot / (Math.sqrt(na) * Math.sqrt(nb));
        return Double.isFinite(score) ? score : 0.0;
    }
}
