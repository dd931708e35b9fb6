package it.aw.readingqueue.provider;

import java.util.List;

/**
 * Cross-encoder: assegna un punteggio di rilevanza a ogni coppia (query, candidato).
 */
public interface RerankProvider {

    /** Punteggi nello stesso ordine dei candidati, più alto = più rilevante. */
    List<Double> rerank(String query, List<String> candidates);

    boolean isAvailable();
}
