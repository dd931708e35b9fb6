package it.aw.readingqueue.model;

import java.util.List;

/**
 * Output del Vectorizer.
 *
 * @param fullEmbedding embedding del documento intero
 * @param chunks        chunk in ordine di posizione, ciascuno col proprio embedding
 * @param pooled        true se {@code fullEmbedding} è la media dei chunk (testo oltre il limite)
 * @param tokenCount    token stimati del testo completo
 */
public record Vectorization(float[] fullEmbedding, List<ChunkEmbedding> chunks, boolean pooled, int tokenCount) {}
