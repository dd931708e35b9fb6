package it.aw.readingqueue.analysis;

import it.aw.readingqueue.model.AnalysisParams;
import it.aw.readingqueue.model.ClusteringMethod;

/**
 * Partizione di vettori già normalizzati L2.
 */
public interface Clusterer {

    ClusteringMethod method();

    /**
     * @return un id di cluster per riga; id compatti da 0 in ordine di prima
     *         apparizione, {@code ClusterAssignment.UNCLUSTERED} per il rumore
     */
    int[] cluster(double[][] rows, AnalysisParams params);
}
