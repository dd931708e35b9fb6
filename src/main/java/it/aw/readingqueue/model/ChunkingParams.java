package it.aw.readingqueue.model;

/**
 * Parametri di chunking per la vettorizzazione, espressi in token.
 * <p>
 * La dimensione del chunk non può superare il limite di input del modello di
 * embedding: {@link #fitTo(int)} la riduce se necessario mantenendo la stessa
 * frazione di overlap.
 */
public record ChunkingParams(int chunkTokens, double overlapRatio) {

    public static final int    DEFAULT_CHUNK_TOKENS  = 200;
    public static final double DEFAULT_OVERLAP_RATIO = 0.15;

    /** Costruttore compatto con validazione. */
    public ChunkingParams {
        if (chunkTokens < 8) {
            throw new IllegalArgumentException("chunkTokens deve essere >= 8 (ricevuto: " + chunkTokens + ")");
        }
        if (overlapRatio < 0.0 || overlapRatio >= 0.5) {
            throw new IllegalArgumentException(
                    "overlapRatio deve essere in [0, 0.5) (ricevuto: " + overlapRatio + ")");
        }
    }

    public static ChunkingParams defaults() {
        return new ChunkingParams(DEFAULT_CHUNK_TOKENS, DEFAULT_OVERLAP_RATIO);
    }

    public int overlapTokens() {
        return (int) Math.round(chunkTokens * overlapRatio);
    }

    public ChunkingParams fitTo(int maxInputTokens) {
        return chunkTokens <= maxInputTokens
                ? this
                : new ChunkingParams(maxInputTokens, overlapRatio);
    }
}
