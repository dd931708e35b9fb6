package it.aw.readingqueue.model;

/**
 * Item con la priorità calcolata in lettura. {@code priority} è null finché
 * l'item non ha un expiry score.
 */
public record QueueEntry(Item item, Double priority) {}
