package it.aw.readingqueue.model;

/**
 * Parametri opzionali dell'analisi. I campi null assumono i default calcolati
 * sulla dimensione dell'input (vedi i singoli algoritmi).
 *
 * @param clusterCount numero di cluster per k-means e gerarchico, in [2, 24]
 * @param eps          raggio DBSCAN in distanza coseno, in [0.01, 1.0]
 * @param minSamples   punti minimi (incluso il punto stesso) per un core point DBSCAN
 * @param perplexity   perplessità t-SNE
 * @param neighbors    vicini UMAP
 * @param minDist      distanza minima UMAP nel layout
 * @param seed         seme per gli algoritmi stocastici; null = non deterministico
 */
public record AnalysisParams(
        Integer clusterCount,
        Double  eps,
        Integer minSamples,
        Double  perplexity,
        Integer neighbors,
        Double  minDist,
        Long    seed
) {
    public static AnalysisParams defaults() {
        return new AnalysisParams(null, null, null, null, null, null, null);
    }

    public static AnalysisParams withClusterCount(int k) {
        return new AnalysisParams(k, null, null, null, null, null, null);
    }

    public static AnalysisParams withEps(double eps) {
        return new AnalysisParams(null, eps, null, null, null, null, null);
    }

    public AnalysisParams seeded(long newSeed) {
        return new AnalysisParams(clusterCount, eps, minSamples, perplexity, neighbors, minDist, newSeed);
    }
}
