package it.aw.readingqueue.analysis;

import it.aw.readingqueue.model.AnalysisParams;
import it.aw.readingqueue.model.ClusteringMethod;
import org.springframework.stereotype.Component;

/**
 * Clustering agglomerativo, average linkage su distanza coseno, tagliato a
 * esattamente {@code clusterCount} gruppi.
 * <p>
 * A ogni passo si fondono i due gruppi a distanza minima; a parità di distanza
 * vince la coppia con indici più bassi (ogni gruppo è rappresentato dal suo
 * elemento di indice minore). Le distanze sono aggiornate con Lance-Williams.
 */
@Component
public class HierarchicalClustering implements Clusterer {

    @Override
    public ClusteringMethod method() {
        return ClusteringMethod.HIERARCHICAL;
    }

    @Override
    public int[] cluster(double[][] rows, AnalysisParams params) {
        int n = rows.length;
        int k = params.clusterCount();
        double[][] dist = VectorMath.cosineDistances(rows);
        int[] size = new int[n];
        int[] parent = new int[n];
        boolean[] active = new boolean[n];
        for (int i = 0; i < n; i++) {
            size[i] = 1;
            parent[i] = i;
            active[i] = true;
        }

        for (int groups = n; groups > k; groups--) {
            int bi = -1, bj = -1;
            double best = Double.MAX_VALUE;
            for (int i = 0; i < n; i++) {
                if (!active[i]) continue;
                for (int j = i + 1; j < n; j++) {
                    if (active[j] && dist[i][j] < best) {
                        best = dist[i][j];
                        bi = i;
                        bj = j;
                    }
                }
            }
            // average linkage: d(k, i∪j) = (|i|·d(k,i) + |j|·d(k,j)) / (|i| + |j|)
            for (int m = 0; m < n; m++) {
                if (!active[m] || m == bi || m == bj) continue;
                double merged = (size[bi] * dist[bi][m] + size[bj] * dist[bj][m]) / (size[bi] + size[bj]);
                dist[bi][m] = dist[m][bi] = merged;
            }
            size[bi] += size[bj];
            active[bj] = false;
            for (int m = 0; m < n; m++) {
                if (parent[m] == bj) parent[m] = bi;
            }
        }
        return ClusterIds.compact(parent);
    }
}
