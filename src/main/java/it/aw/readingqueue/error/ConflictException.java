package it.aw.readingqueue.error;

/** L'utente ha già salvato lo stesso URL (o lo stesso URL canonico). */
public class ConflictException extends ReadingQueueException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
