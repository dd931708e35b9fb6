package it.aw.readingqueue.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Risposta strutturata dell'LLM per l'etichetta di un cluster. */
public record LabelData(@JsonProperty("label") String label) {}
