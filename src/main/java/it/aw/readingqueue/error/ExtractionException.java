package it.aw.readingqueue.error;

/** Nessun contenuto estraibile dalla pagina, oppure errore di rete durante il download. */
public class ExtractionException extends ReadingQueueException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
