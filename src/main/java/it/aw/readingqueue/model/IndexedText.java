package it.aw.readingqueue.model;

import java.time.LocalDateTime;

/**
 * Unità di testo per l'indice lessicale: il testo completo di un item
 * ({@code chunkPosition} null) oppure uno dei suoi chunk.
 */
public record IndexedText(String userId, String itemId, Integer chunkPosition, String text, LocalDateTime createdAt) {

    public boolean isChunk() {
        return chunkPosition != null;
    }
}
