package it.aw.readingqueue.analysis;

import it.aw.readingqueue.model.AnalysisParams;
import it.aw.readingqueue.model.ProjectionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * t-SNE esatto (O(n²) per iterazione) su distanza coseno.
 * <p>
 * Perplessità di default {@code min(30, max(1, n/4))}, limitata a [1, n-1].
 * Early exaggeration 12 per le prime 250 iterazioni, learning rate
 * {@code max(n / 12 / 4, 50)}, momentum 0.5 poi 0.8, guadagni adattivi.
 * Inizializzazione gaussiana (σ = 1e-4) dal seme richiesto, 42 se assente.
 */
@Component
public class TsneProjection implements Projection {

    private static final Logger log = LoggerFactory.getLogger(TsneProjection.class);

    static final long   DEFAULT_SEED = 42L;
    static final int    ITERATIONS = 1000;
    static final int    EXAGGERATION_ITERATIONS = 250;
    static final double EARLY_EXAGGERATION = 12.0;
    private static final double MIN_GAIN = 0.01;
    private static final double MIN_PROBABILITY = 1e-12;
    private static final int    BINARY_SEARCH_STEPS = 100;
    private static final double ENTROPY_TOLERANCE = 1e-5;

    @Override
    public ProjectionMethod method() {
        return ProjectionMethod.TSNE;
    }

    @Override
    public double[][] project(double[][] rows, AnalysisParams params) {
        int n = rows.length;
        double perplexity = perplexityFor(n, params.perplexity());
        long seed = params.seed() != null ? params.seed() : DEFAULT_SEED;
        log.debug("t-SNE: n={}, perplexity={}, seed={}", n, perplexity, seed);

        double[][] p = jointProbabilities(VectorMath.cosineDistances(rows), perplexity);
        return optimize(p, new Random(seed));
    }

    static double perplexityFor(int n, Double requested) {
        double perplexity = requested != null ? requested : Math.min(30, Math.max(1, n / 4));
        return Math.max(1, Math.min(perplexity, n - 1));
    }

    /** Probabilità condizionate con ricerca binaria su beta, poi simmetrizzate. */
    static double[][] jointProbabilities(double[][] distances, double perplexity) {
        int n = distances.length;
        double targetEntropy = Math.log(perplexity);
        double[][] p = new double[n][n];

        for (int i = 0; i < n; i++) {
            double beta = 1.0, betaMin = Double.NEGATIVE_INFINITY, betaMax = Double.POSITIVE_INFINITY;
            for (int step = 0; step < BINARY_SEARCH_STEPS; step++) {
                double sum = 0, weighted = 0;
                for (int j = 0; j < n; j++) {
                    if (j == i) {
                        p[i][j] = 0;
                        continue;
                    }
                    p[i][j] = Math.exp(-distances[i][j] * beta);
                    sum += p[i][j];
                }
                if (sum == 0) {
                    sum = 1e-8;
                }
                for (int j = 0; j < n; j++) {
                    p[i][j] /= sum;
                    weighted += distances[i][j] * p[i][j];
                }
                double entropy = Math.log(sum) + beta * weighted;
                double diff = entropy - targetEntropy;
                if (Math.abs(diff) <= ENTROPY_TOLERANCE) {
                    break;
                }
                if (diff > 0) {
                    betaMin = beta;
                    beta = betaMax == Double.POSITIVE_INFINITY ? beta * 2 : (beta + betaMax) / 2;
                } else {
                    betaMax = beta;
                    beta = betaMin == Double.NEGATIVE_INFINITY ? beta / 2 : (beta + betaMin) / 2;
                }
            }
        }

        double total = 0;
        double[][] joint = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                joint[i][j] = p[i][j] + p[j][i];
                total += joint[i][j];
            }
        }
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                joint[i][j] = Math.max(joint[i][j] / total, MIN_PROBABILITY);
            }
        }
        return joint;
    }

    private static double[][] optimize(double[][] p, Random random) {
        int n = p.length;
        double learningRate = Math.max(n / EARLY_EXAGGERATION / 4.0, 50.0);
        double[][] y = new double[n][2];
        double[][] update = new double[n][2];
        double[][] gains = new double[n][2];
        for (int i = 0; i < n; i++) {
            y[i][0] = random.nextGaussian() * 1e-4;
            y[i][1] = random.nextGaussian() * 1e-4;
            gains[i][0] = gains[i][1] = 1.0;
        }

        double[][] num = new double[n][n];
        double[][] grad = new double[n][2];
        for (int it = 0; it < ITERATIONS; it++) {
            boolean early = it < EXAGGERATION_ITERATIONS;
            double exaggeration = early ? EARLY_EXAGGERATION : 1.0;
            double momentum = early ? 0.5 : 0.8;

            double sumNum = 0;
            for (int i = 0; i < n; i++) {
                for (int j = i + 1; j < n; j++) {
                    double dx = y[i][0] - y[j][0];
                    double dy = y[i][1] - y[j][1];
                    double q = 1.0 / (1.0 + dx * dx + dy * dy);
                    num[i][j] = num[j][i] = q;
                    sumNum += 2 * q;
                }
            }
            for (int i = 0; i < n; i++) {
                double gx = 0, gy = 0;
                for (int j = 0; j < n; j++) {
                    if (i == j) continue;
                    double q = Math.max(num[i][j] / sumNum, MIN_PROBABILITY);
                    double mult = (exaggeration * p[i][j] - q) * num[i][j];
                    gx += mult * (y[i][0] - y[j][0]);
                    gy += mult * (y[i][1] - y[j][1]);
                }
                grad[i][0] = 4 * gx;
                grad[i][1] = 4 * gy;
            }
            for (int i = 0; i < n; i++) {
                for (int d = 0; d < 2; d++) {
                    boolean sameDirection = update[i][d] * grad[i][d] >= 0;
                    gains[i][d] = sameDirection ? gains[i][d] * 0.8 : gains[i][d] + 0.2;
                    gains[i][d] = Math.max(gains[i][d], MIN_GAIN);
                    update[i][d] = momentum * update[i][d] - learningRate * gains[i][d] * grad[i][d];
                    y[i][d] += update[i][d];
                }
            }
        }
        return y;
    }
}
