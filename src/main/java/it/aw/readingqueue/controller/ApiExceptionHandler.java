package it.aw.readingqueue.controller;

import it.aw.readingqueue.error.ConflictException;
import it.aw.readingqueue.error.ExtractionException;
import it.aw.readingqueue.error.InsufficientDataException;
import it.aw.readingqueue.error.NotFoundException;
import it.aw.readingqueue.error.ProviderException;
import it.aw.readingqueue.error.ProviderTimeoutException;
import it.aw.readingqueue.error.ReadingQueueException;
import it.aw.readingqueue.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Traduce le eccezioni del motore in risposte HTTP con corpo {@code {status, error, message}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ReadingQueueException.class)
    public ResponseEntity<Map<String, Object>> handle(ReadingQueueException e) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.warn("Errore provider: {}", e.getMessage());
        } else {
            log.debug("Richiesta rifiutata ({}): {}", status.value(), e.getMessage());
        }
        return body(status, e.getMessage());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, Object>> handleMissingUser(MissingRequestHeaderException e) {
        return body(HttpStatus.UNAUTHORIZED, "Header " + e.getHeaderName() + " mancante");
    }

    static HttpStatus statusOf(ReadingQueueException e) {
        if (e instanceof ValidationException) return HttpStatus.BAD_REQUEST;
        if (e instanceof NotFoundException) return HttpStatus.NOT_FOUND;
        if (e instanceof ConflictException) return HttpStatus.CONFLICT;
        if (e instanceof InsufficientDataException) return HttpStatus.UNPROCESSABLE_ENTITY;
        if (e instanceof ProviderTimeoutException) return HttpStatus.GATEWAY_TIMEOUT;
        if (e instanceof ProviderException || e instanceof ExtractionException) return HttpStatus.BAD_GATEWAY;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "status", status.value(),
                "error", status.getReasonPhrase(),
                "message", message == null ? "" : message));
    }
}
