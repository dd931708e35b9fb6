package it.aw.readingqueue.model;

/** Unità su cui si cerca: l'item intero o i suoi chunk (risultati poi raggruppati per item). */
public enum SearchScope { ITEMS, CHUNKS }
