package it.aw.readingqueue.analysis;

import it.aw.readingqueue.model.AnalysisParams;
import it.aw.readingqueue.model.ProjectionMethod;

/**
 * Riduzione a due dimensioni di vettori già normalizzati L2.
 * Le implementazioni sono senza stato: ogni chiamata ricalcola da zero.
 */
public interface Projection {

    ProjectionMethod method();

    /**
     * @param rows   matrice n×d, righe normalizzate L2, n ≥ 2
     * @param params parametri già validati
     * @return matrice n×2, nello stesso ordine delle righe
     */
    double[][] project(double[][] rows, AnalysisParams params);
}
