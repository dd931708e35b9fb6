package it.aw.readingqueue.model;

import java.time.LocalDateTime;

/** Risultato dell'estrazione di una pagina web. */
public record ArticleContent(
        String        url,
        String        canonicalUrl,
        String        title,
        String        sourceSite,
        LocalDateTime publicationDate,
        String        faviconUrl,
        String        contentText,
        String        contentMarkdown
) {
    /** URL usato per la deduplica: il canonico se la pagina lo dichiara, altrimenti quello richiesto. */
    public String dedupKey() {
        return canonicalUrl != null ? canonicalUrl : url;
    }
}
