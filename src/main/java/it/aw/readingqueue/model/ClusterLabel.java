package it.aw.readingqueue.model;

/**
 * Etichetta di un cluster. Il colore deriva dal testo dell'etichetta, non
 * dall'id del cluster, che non è stabile tra richieste.
 */
public record ClusterLabel(int clusterId, String label, String color, LabelState state) {}
