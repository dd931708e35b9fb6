package it.aw.readingqueue.analysis;

import it.aw.readingqueue.model.AnalysisParams;
import it.aw.readingqueue.model.ClusterAssignment;
import it.aw.readingqueue.model.ClusteringMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * DBSCAN su distanza coseno. Un punto è core se il suo intorno di raggio eps
 * (lui compreso) contiene almeno {@code minSamples} punti, default {@code min(3, n)}.
 * I punti non raggiungibili da alcun core sono rumore ({@link ClusterAssignment#UNCLUSTERED}).
 * <p>
 * Senza eps esplicito si usa l'80° percentile della distanza dal vicino più prossimo.
 */
@Component
public class DbscanClustering implements Clusterer {

    private static final Logger log = LoggerFactory.getLogger(DbscanClustering.class);

    static final double MIN_EPS = 0.01;
    static final double MAX_EPS = 1.0;
    static final double AUTO_EPS_PERCENTILE = 80.0;

    @Override
    public ClusteringMethod method() {
        return ClusteringMethod.DBSCAN;
    }

    @Override
    public int[] cluster(double[][] rows, AnalysisParams params) {
        int n = rows.length;
        double[][] dist = VectorMath.cosineDistances(rows);
        double eps = params.eps() != null ? params.eps() : autoEps(dist);
        int minSamples = params.minSamples() != null ? params.minSamples() : Math.min(3, n);
        log.debug("DBSCAN: n={}, eps={}, minSamples={}", n, eps, minSamples);

        List<List<Integer>> neighborhoods = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            List<Integer> hood = new ArrayList<>();
            for (int j = 0; j < n; j++) {
                if (dist[i][j] <= eps) hood.add(j);
            }
            neighborhoods.add(hood);
        }

        int[] labels = new int[n];
        Arrays.fill(labels, ClusterAssignment.UNCLUSTERED);
        int nextCluster = 0;
        for (int i = 0; i < n; i++) {
            if (labels[i] != ClusterAssignment.UNCLUSTERED || neighborhoods.get(i).size() < minSamples) {
                continue;
            }
            int cluster = nextCluster++;
            Deque<Integer> queue = new ArrayDeque<>();
            labels[i] = cluster;
            queue.add(i);
            while (!queue.isEmpty()) {
                int p = queue.poll();
                if (neighborhoods.get(p).size() < minSamples) {
                    continue; // punto di bordo: non espande
                }
                for (int q : neighborhoods.get(p)) {
                    if (labels[q] == ClusterAssignment.UNCLUSTERED) {
                        labels[q] = cluster;
                        queue.add(q);
                    }
                }
            }
        }
        return labels;
    }

    static double autoEps(double[][] dist) {
        int n = dist.length;
        double[] nearest = new double[n];
        for (int i = 0; i < n; i++) {
            double min = Double.MAX_VALUE;
            for (int j = 0; j < n; j++) {
                if (j != i) min = Math.min(min, dist[i][j]);
            }
            nearest[i] = min;
        }
        Arrays.sort(nearest);
        double rank = AUTO_EPS_PERCENTILE / 100.0 * (n - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        double eps = nearest[lo] + (nearest[hi] - nearest[lo]) * (rank - lo);
        return Math.max(MIN_EPS, Math.min(MAX_EPS, eps));
    }
}
