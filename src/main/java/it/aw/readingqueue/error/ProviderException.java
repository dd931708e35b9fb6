package it.aw.readingqueue.error;

/**
 * Il provider esterno (LLM, embedding, rerank) ha rifiutato la richiesta.
 * <p>
 * {@code transientFailure} è true per rate limit e errori 5xx: la pipeline di
 * ingestione li ritenta, tutti gli altri sono terminali.
 */
public class ProviderException extends ReadingQueueException {

    private final boolean transientFailure;

    public ProviderException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public ProviderException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
