package it.aw.readingqueue.model;

/**
 * Statistiche aggregate sullo stato dello store.
 */
public record StoreStats(
        int totalItems,
        int embeddedItems,
        int totalChunks,
        String storeType,
        String embeddingModel
) {}
