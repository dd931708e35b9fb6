package it.aw.readingqueue.analysis;

import java.util.List;

/**
 * Operazioni vettoriali condivise da vettorizzazione, ricerca e analisi.
 */
public final class VectorMath {

    private VectorMath() {
    }

    /** Similarità coseno; 0 se uno dei due vettori è nullo. */
    public static double cosine(float[] a, float[] b) {
        requireSameDimension(a.length, b.length);
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na  += (double) a[i] * a[i];
            nb  += (double) b[i] * b[i];
        }
        if (na == 0 || nb == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }

    /** Media componente per componente, senza rinormalizzazione. */
    public static float[] mean(List<float[]> vectors) {
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("Media di un insieme vuoto di vettori");
        }
        int dim = vectors.get(0).length;
        double[] sum = new double[dim];
        for (float[] v : vectors) {
            requireSameDimension(dim, v.length);
            for (int i = 0; i < dim; i++) sum[i] += v[i];
        }
        float[] mean = new float[dim];
        for (int i = 0; i < dim; i++) mean[i] = (float) (sum[i] / vectors.size());
        return mean;
    }

    /**
     * Matrice n×d con le righe normalizzate L2. Le righe nulle restano nulle.
     */
    public static double[][] normalizeRows(List<float[]> vectors) {
        int n = vectors.size();
        double[][] rows = new double[n][];
        int dim = n == 0 ? 0 : vectors.get(0).length;
        for (int r = 0; r < n; r++) {
            float[] v = vectors.get(r);
            requireSameDimension(dim, v.length);
            double norm = 0;
            for (float x : v) norm += (double) x * x;
            norm = Math.sqrt(norm);
            double[] row = new double[dim];
            for (int i = 0; i < dim; i++) row[i] = norm == 0 ? 0 : v[i] / norm;
            rows[r] = row;
        }
        return rows;
    }

    public static double dot(double[] a, double[] b) {
        double s = 0;
        for (int i = 0; i < a.length; i++) s += a[i] * b[i];
        return s;
    }

    public static double squaredEuclidean(double[] a, double[] b) {
        double s = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            s += d * d;
        }
        return s;
    }

    /** Distanza coseno tra righe già normalizzate, limitata a [0, 2]. */
    public static double cosineDistance(double[] a, double[] b) {
        return Math.max(0.0, Math.min(2.0, 1.0 - dot(a, b)));
    }

    /** Matrice simmetrica delle distanze coseno tra righe normalizzate. */
    public static double[][] cosineDistances(double[][] rows) {
        int n = rows.length;
        double[][] d = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                d[i][j] = d[j][i] = cosineDistance(rows[i], rows[j]);
            }
        }
        return d;
    }

    private static void requireSameDimension(int expected, int actual) {
        if (expected != actual) {
            throw new IllegalArgumentException(
                    "Dimensioni dei vettori incompatibili: " + expected + " vs " + actual);
        }
    }
}
