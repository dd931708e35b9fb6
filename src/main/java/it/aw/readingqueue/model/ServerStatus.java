package it.aw.readingqueue.model;

import java.util.Locale;

/**
 * Avanzamento della pipeline di ingestione. L'ordine delle costanti è l'ordine
 * degli stadi: la ripresa dopo un errore riparte dal primo stadio non completato.
 */
public enum ServerStatus {
    SAVED, EXTRACTED, SUMMARISED, EMBEDDED, CLASSIFIED;

    public boolean isAtLeast(ServerStatus other) {
        return ordinal() >= other.ordinal();
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ServerStatus fromDb(String value) {
        return value == null ? SAVED : valueOf(value.toUpperCase(Locale.ROOT));
    }
}
