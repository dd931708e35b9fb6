package it.aw.readingqueue.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.readingqueue.error.ValidationException;

/**
 * Decodifica tipizzata delle risposte strutturate dell'LLM.
 * <p>
 * Accetta anche JSON racchiuso in un blocco ```json, che alcuni modelli
 * restituiscono nonostante il response format. Qualsiasi errore di parsing
 * diventa {@link ValidationException}: il codice a valle non vede mai JSON grezzo.
 */
public class StructuredOutputDecoder {

    private final ObjectMapper objectMapper;

    public StructuredOutputDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public <T> T decode(String raw, Class<T> type) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Risposta vuota dal modello, atteso " + type.getSimpleName());
        }
        try {
            T value = objectMapper.readValue(stripFences(raw), type);
            if (value == null) {
                throw new ValidationException("Risposta null dal modello, atteso " + type.getSimpleName());
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new ValidationException(
                    "Risposta non conforme allo schema " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    static String stripFences(String raw) {
        String s = raw.strip();
        if (s.startsWith("```")) {
            int firstNewline = s.indexOf('\n');
            int lastFence = s.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                s = s.substring(firstNewline + 1, lastFence).strip();
            }
        }
        return s;
    }
}
