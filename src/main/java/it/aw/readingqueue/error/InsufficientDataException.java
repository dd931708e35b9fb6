package it.aw.readingqueue.error;

/** Troppi pochi punti per l'algoritmo o i parametri richiesti. */
public class InsufficientDataException extends ReadingQueueException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
