package it.aw.readingqueue.model;

import java.util.Locale;

/** Stato dell'item visto dall'utente (card nella UI). */
public enum ClientStatus {
    ADDING, QUEUED, PAUSED, COMPLETED, BOOKMARK, ERROR;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ClientStatus fromDb(String value) {
        return value == null ? null : valueOf(value.toUpperCase(Locale.ROOT));
    }
}
