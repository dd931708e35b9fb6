package it.aw.readingqueue.model;

/**
 * Vettore per l'indice semantico: l'embedding di un item ({@code chunkPosition} null)
 * oppure di uno dei suoi chunk, con il testo che rappresenta.
 */
public record IndexedVector(String userId, String itemId, Integer chunkPosition, String text, float[] vector) {

    public boolean isChunk() {
        return chunkPosition != null;
    }
}
