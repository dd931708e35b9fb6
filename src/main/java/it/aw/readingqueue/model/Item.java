package it.aw.readingqueue.model;

import java.time.LocalDateTime;

/**
 * Articolo salvato da un utente.
 * <p>
 * L'embedding dell'intero documento non fa parte del record: si legge a parte
 * tramite {@code ItemStore.getItemVectors}. {@code embedded} indica solo se è presente.
 */
public record Item(
        String        id,
        String        userId,
        String        url,
        String        canonicalUrl,     // chiave di deduplica, null finché non estratto
        String        title,
        String        sourceSite,
        LocalDateTime publicationDate,
        String        faviconUrl,
        String        contentText,
        String        contentMarkdown,
        Integer       tokenCount,
        ClientStatus  clientStatus,
        ServerStatus  serverStatus,
        String        summary,
        Double        expiryScore,      // 0.0 evergreen, 1.0 notizia che scade subito
        String        errorMessage,
        boolean       embedded,
        LocalDateTime createdAt,
        LocalDateTime clientStatusAt,
        LocalDateTime serverStatusAt
) {}
