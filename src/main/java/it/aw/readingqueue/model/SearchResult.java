package it.aw.readingqueue.model;

/**
 * Risultato di una ricerca.
 * Contiene il riferimento all'item, il punteggio usato per l'ordinamento e
 * un'anteprima del testo dell'unità che ha prodotto il match (item o chunk).
 */
public record SearchResult(
        String      itemId,
        String      title,
        String      url,
        String      preview,
        Double      score,          // rilevanza finale: rerank se attivo, altrimenti coseno o BM25
        Double      distance,       // distanza coseno (solo semantica, null per lessicale)
        SearchScope matchedUnit,
        Integer     chunkPosition   // posizione del chunk migliore (null per scope items)
) {
    public SearchResult withScore(double newScore) {
        return new SearchResult(itemId, title, url, preview, newScore, distance, matchedUnit, chunkPosition);
    }
}
