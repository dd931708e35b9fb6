package it.aw.readingqueue.provider;

import java.util.List;

/**
 * Servizio di embedding testo → vettore a dimensione fissa.
 * <p>
 * I vettori sono restituiti come li produce il modello, senza normalizzazione:
 * tutti i confronti nel motore usano la similarità coseno.
 */
public interface EmbeddingProvider {

    float[] embed(String text);

    List<float[]> embedAll(List<String> texts);

    /** Limite di token in input del modello. */
    int maxInputTokens();

    String modelName();
}
