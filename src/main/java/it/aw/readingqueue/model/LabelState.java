package it.aw.readingqueue.model;

public enum LabelState {
    /** Assegnazione nota, etichetta ancora in calcolo. */
    PENDING,
    LABELED,
    /** Etichettatura fallita: si usa l'etichetta di ripiego. */
    FALLBACK
}
