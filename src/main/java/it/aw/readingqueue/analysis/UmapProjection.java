package it.aw.readingqueue.analysis;

import it.aw.readingqueue.model.AnalysisParams;
import it.aw.readingqueue.model.ProjectionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * UMAP semplificato su distanza coseno.
 * <ol>
 *   <li>grafo kNN con distanze locali (rho, sigma) calibrate su log2(k)</li>
 *   <li>unione fuzzy dei pesi diretti: {@code w = a + b - a·b}</li>
 *   <li>layout iniziale PCA scalato a 10, poi SGD con campionamento negativo</li>
 * </ol>
 * Con meno di 3 item ricade su t-SNE. Senza seme il layout non è riproducibile.
 */
@Component
public class UmapProjection implements Projection {

    private static final Logger log = LoggerFactory.getLogger(UmapProjection.class);

    static final int    MIN_ITEMS = 3;
    static final int    DEFAULT_NEIGHBORS = 15;
    static final double DEFAULT_MIN_DIST = 0.1;
    static final double SPREAD = 1.0;
    static final int    EPOCHS = 200;
    static final int    NEGATIVE_SAMPLES = 5;
    private static final double GRADIENT_CLIP = 4.0;
    private static final double INIT_SCALE = 10.0;
    private static final int    SIGMA_SEARCH_STEPS = 64;

    private final PcaProjection pca;
    private final TsneProjection tsne;

    public UmapProjection(PcaProjection pca, TsneProjection tsne) {
        this.pca = pca;
        this.tsne = tsne;
    }

    @Override
    public ProjectionMethod method() {
        return ProjectionMethod.UMAP;
    }

    @Override
    public double[][] project(double[][] rows, AnalysisParams params) {
        int n = rows.length;
        if (n < MIN_ITEMS) {
            log.debug("UMAP: {} item, ricado su t-SNE", n);
            return tsne.project(rows, params);
        }
        int k = neighborsFor(n, params.neighbors());
        double minDist = params.minDist() != null ? params.minDist() : DEFAULT_MIN_DIST;
        Random random = params.seed() != null ? new Random(params.seed()) : new Random();
        double[] ab = fitCurve(SPREAD, minDist);
        log.debug("UMAP: n={}, neighbors={}, minDist={}, a={}, b={}", n, k, minDist, ab[0], ab[1]);

        double[][] graph = fuzzyGraph(VectorMath.cosineDistances(rows), k);
        double[][] y = initialLayout(rows, random);
        optimize(y, graph, ab[0], ab[1], random);
        return y;
    }

    static int neighborsFor(int n, Integer requested) {
        int k = requested != null ? requested : Math.min(DEFAULT_NEIGHBORS, n - 1);
        return Math.max(2, Math.min(k, n - 1));
    }

    /** Pesi simmetrici del grafo fuzzy (matrice densa, zero = nessun arco). */
    static double[][] fuzzyGraph(double[][] distances, int k) {
        int n = distances.length;
        double target = Math.log(k) / Math.log(2);
        double[][] directed = new double[n][n];

        for (int i = 0; i < n; i++) {
            final int row = i;
            Integer[] order = new Integer[n - 1];
            for (int j = 0, c = 0; j < n; j++) {
                if (j != i) order[c++] = j;
            }
            Arrays.sort(order, Comparator.comparingDouble(j -> distances[row][j]));
            int[] neighbors = new int[k];
            for (int c = 0; c < k; c++) neighbors[c] = order[c];

            double rho = 0;
            for (int j : neighbors) {
                if (distances[i][j] > 0) {
                    rho = distances[i][j];
                    break;
                }
            }

            double lo = 0, hi = Double.POSITIVE_INFINITY, sigma = 1.0;
            for (int step = 0; step < SIGMA_SEARCH_STEPS; step++) {
                double sum = 0;
                for (int j : neighbors) {
                    sum += Math.exp(-Math.max(0, distances[i][j] - rho) / sigma);
                }
                if (Math.abs(sum - target) < 1e-5) {
                    break;
                }
                if (sum > target) {
                    hi = sigma;
                    sigma = (lo + hi) / 2;
                } else {
                    lo = sigma;
                    sigma = hi == Double.POSITIVE_INFINITY ? sigma * 2 : (lo + hi) / 2;
                }
            }
            sigma = Math.max(sigma, 1e-3 * meanDistance(distances[i], neighbors));

            for (int j : neighbors) {
                directed[i][j] = sigma > 0 ? Math.exp(-Math.max(0, distances[i][j] - rho) / sigma) : 1.0;
            }
        }

        double[][] graph = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                double a = directed[i][j], b = directed[j][i];
                graph[i][j] = a + b - a * b;
            }
        }
        return graph;
    }

    private static double meanDistance(double[] row, int[] neighbors) {
        double sum = 0;
        for (int j : neighbors) sum += row[j];
        return neighbors.length == 0 ? 0 : sum / neighbors.length;
    }

    private double[][] initialLayout(double[][] rows, Random random) {
        double[][] y = pca.project(rows, 2);
        double maxAbs = 0;
        for (double[] p : y) {
            maxAbs = Math.max(maxAbs, Math.max(Math.abs(p[0]), Math.abs(p[1])));
        }
        double scale = maxAbs > 0 ? INIT_SCALE / maxAbs : 1.0;
        for (double[] p : y) {
            p[0] = p[0] * scale + random.nextGaussian() * 1e-4;
            p[1] = p[1] * scale + random.nextGaussian() * 1e-4;
        }
        return y;
    }

    /**
     * Parametri a, b della curva {@code 1 / (1 + a·d^(2b))} che approssima la
     * similarità target data da spread e minDist (ricerca a griglia, poi raffinamento).
     */
    static double[] fitCurve(double spread, double minDist) {
        int samples = 300;
        double[] xs = new double[samples];
        double[] ys = new double[samples];
        for (int i = 0; i < samples; i++) {
            xs[i] = 3 * spread * (i + 1) / samples;
            ys[i] = xs[i] < minDist ? 1.0 : Math.exp(-(xs[i] - minDist) / spread);
        }
        double bestA = 1, bestB = 1, bestErr = Double.MAX_VALUE;
        for (double a = 0.05; a <= 5.0; a += 0.05) {
            for (double b = 0.3; b <= 2.0; b += 0.02) {
                double err = curveError(xs, ys, a, b);
                if (err < bestErr) {
                    bestErr = err; bestA = a; bestB = b;
                }
            }
        }
        double a0 = bestA, b0 = bestB;
        for (double a = Math.max(0.001, a0 - 0.05); a <= a0 + 0.05; a += 0.002) {
            for (double b = Math.max(0.01, b0 - 0.02); b <= b0 + 0.02; b += 0.001) {
                double err = curveError(xs, ys, a, b);
                if (err < bestErr) {
                    bestErr = err; bestA = a; bestB = b;
                }
            }
        }
        return new double[]{bestA, bestB};
    }

    private static double curveError(double[] xs, double[] ys, double a, double b) {
        double err = 0;
        for (int i = 0; i < xs.length; i++) {
            double f = 1.0 / (1.0 + a * Math.pow(xs[i], 2 * b));
            err += (f - ys[i]) * (f - ys[i]);
        }
        return err;
    }

    private static void optimize(double[][] y, double[][] graph, double a, double b, Random random) {
        int n = y.length;
        List<int[]> edges = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        double maxWeight = 0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i != j && graph[i][j] > 0) {
                    edges.add(new int[]{i, j});
                    weights.add(graph[i][j]);
                    maxWeight = Math.max(maxWeight, graph[i][j]);
                }
            }
        }
        int m = edges.size();
        double[] epochsPerSample = new double[m];
        double[] nextSample = new double[m];
        for (int e = 0; e < m; e++) {
            epochsPerSample[e] = maxWeight / weights.get(e);
            nextSample[e] = epochsPerSample[e];
        }

        for (int epoch = 1; epoch <= EPOCHS; epoch++) {
            double alpha = 1.0 - (epoch - 1) / (double) EPOCHS;
            for (int e = 0; e < m; e++) {
                if (nextSample[e] > epoch) {
                    continue;
                }
                int i = edges.get(e)[0];
                int j = edges.get(e)[1];
                double dist2 = squaredDistance(y[i], y[j]);
                if (dist2 > 0) {
                    double coeff = (-2.0 * a * b * Math.pow(dist2, b - 1.0)) / (a * Math.pow(dist2, b) + 1.0);
                    for (int d = 0; d < 2; d++) {
                        double g = clip(coeff * (y[i][d] - y[j][d]));
                        y[i][d] += g * alpha;
                        y[j][d] -= g * alpha;
                    }
                }
                for (int s = 0; s < NEGATIVE_SAMPLES; s++) {
                    int k = random.nextInt(n);
                    if (k == i) {
                        continue;
                    }
                    double negDist2 = squaredDistance(y[i], y[k]);
                    double coeff = negDist2 > 0
                            ? (2.0 * b) / ((0.001 + negDist2) * (a * Math.pow(negDist2, b) + 1.0))
                            : 0.0;
                    for (int d = 0; d < 2; d++) {
                        double g = coeff > 0 ? clip(coeff * (y[i][d] - y[k][d])) : GRADIENT_CLIP;
                        y[i][d] += g * alpha;
                    }
                }
                nextSample[e] += epochsPerSample[e];
            }
        }
    }

    private static double squaredDistance(double[] p, double[] q) {
        double dx = p[0] - q[0], dy = p[1] - q[1];
        return dx * dx + dy * dy;
    }

    private static double clip(double v) {
        return Math.max(-GRADIENT_CLIP, Math.min(GRADIENT_CLIP, v));
    }
}
