package it.aw.readingqueue.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Risposta strutturata dell'LLM per lo stadio di sintesi. */
public record SummaryData(
        @JsonProperty("summary")      String summary,
        @JsonProperty("expiry_score") Double expiryScore
) {}
