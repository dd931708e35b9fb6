package it.aw.readingqueue.error;

import java.time.Duration;

/** Il provider non ha risposto entro il timeout configurato. */
public class ProviderTimeoutException extends ReadingQueueException {

    public ProviderTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(operation + ": nessuna risposta entro " + timeout.toMillis() + " ms", cause);
    }
}
