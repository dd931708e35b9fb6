package it.aw.readingqueue.error;

/**
 * Radice della gerarchia di errori del motore.
 * <p>
 * Tutte le eccezioni sono unchecked: i servizi le propagano fino al controller,
 * che le traduce in risposte HTTP tramite {@code ApiExceptionHandler}.
 */
public abstract class ReadingQueueException extends RuntimeException {

    protected ReadingQueueException(String message) {
        super(message);
    }

    protected ReadingQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
