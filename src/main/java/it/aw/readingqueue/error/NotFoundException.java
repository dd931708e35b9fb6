package it.aw.readingqueue.error;

public class NotFoundException extends ReadingQueueException {

    public NotFoundException(String message) {
        super(message);
    }
}
