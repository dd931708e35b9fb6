package it.aw.readingqueue.error;

/** Parametro fuori intervallo o risposta strutturata del provider non conforme allo schema. */
public class ValidationException extends ReadingQueueException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
