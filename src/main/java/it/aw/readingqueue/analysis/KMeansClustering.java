package it.aw.readingqueue.analysis;

import it.aw.readingqueue.model.AnalysisParams;
import it.aw.readingqueue.model.ClusteringMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * k-means (Lloyd) con inizializzazione k-means++ e 10 ripartenze: vince quella
 * con inerzia minore. Con il seme di default (42) il risultato è riproducibile.
 * I cluster rimasti vuoti non compaiono nell'output.
 */
@Component
public class KMeansClustering implements Clusterer {

    private static final Logger log = LoggerFactory.getLogger(KMeansClustering.class);

    static final long DEFAULT_SEED = 42L;
    static final int  RESTARTS = 10;
    static final int  MAX_ITERATIONS = 300;

    @Override
    public ClusteringMethod method() {
        return ClusteringMethod.KMEANS;
    }

    @Override
    public int[] cluster(double[][] rows, AnalysisParams params) {
        int k = params.clusterCount();
        Random random = new Random(params.seed() != null ? params.seed() : DEFAULT_SEED);

        int[] best = null;
        double bestInertia = Double.MAX_VALUE;
        for (int run = 0; run < RESTARTS; run++) {
            double[][] centers = initCenters(rows, k, random);
            int[] labels = lloyd(rows, centers);
            double inertia = inertia(rows, centers, labels);
            if (inertia < bestInertia) {
                bestInertia = inertia;
                best = labels;
            }
        }
        log.debug("k-means: n={}, k={}, inerzia={}", rows.length, k, bestInertia);
        return ClusterIds.compact(best);
    }

    /** k-means++: ogni nuovo centro è scelto con probabilità proporzionale a D². */
    static double[][] initCenters(double[][] rows, int k, Random random) {
        int n = rows.length;
        double[][] centers = new double[k][];
        centers[0] = rows[random.nextInt(n)].clone();
        double[] minDist = new double[n];
        for (int i = 0; i < n; i++) minDist[i] = VectorMath.squaredEuclidean(rows[i], centers[0]);

        for (int c = 1; c < k; c++) {
            double total = 0;
            for (double d : minDist) total += d;
            int chosen;
            if (total <= 0) {
                chosen = random.nextInt(n);
            } else {
                double r = random.nextDouble() * total;
                chosen = n - 1;
                for (int i = 0; i < n; i++) {
                    r -= minDist[i];
                    if (r <= 0) {
                        chosen = i;
                        break;
                    }
                }
            }
            centers[c] = rows[chosen].clone();
            for (int i = 0; i < n; i++) {
                minDist[i] = Math.min(minDist[i], VectorMath.squaredEuclidean(rows[i], centers[c]));
            }
        }
        return centers;
    }

    private static int[] lloyd(double[][] rows, double[][] centers) {
        int n = rows.length;
        int dim = rows[0].length;
        int[] labels = new int[n];
        java.util.Arrays.fill(labels, -1);

        for (int it = 0; it < MAX_ITERATIONS; it++) {
            boolean changed = false;
            for (int i = 0; i < n; i++) {
                int nearest = nearest(rows[i], centers);
                if (nearest != labels[i]) {
                    labels[i] = nearest;
                    changed = true;
                }
            }
            if (!changed) {
                break;
            }
            double[][] sums = new double[centers.length][dim];
            int[] counts = new int[centers.length];
            for (int i = 0; i < n; i++) {
                counts[labels[i]]++;
                for (int d = 0; d < dim; d++) sums[labels[i]][d] += rows[i][d];
            }
            for (int c = 0; c < centers.length; c++) {
                // un centro senza punti resta dov'è
                if (counts[c] == 0) continue;
                for (int d = 0; d < dim; d++) centers[c][d] = sums[c][d] / counts[c];
            }
        }
        return labels;
    }

    private static int nearest(double[] row, double[][] centers) {
        int best = 0;
        double bestDist = Double.MAX_VALUE;
        for (int c = 0; c < centers.length; c++) {
            double d = VectorMath.squaredEuclidean(row, centers[c]);
            if (d < bestDist) {
                bestDist = d;
                best = c;
            }
        }
        return best;
    }

    private static double inertia(double[][] rows, double[][] centers, int[] labels) {
        double sum = 0;
        for (int i = 0; i < rows.length; i++) sum += VectorMath.squaredEuclidean(rows[i], centers[labels[i]]);
        return sum;
    }
}
