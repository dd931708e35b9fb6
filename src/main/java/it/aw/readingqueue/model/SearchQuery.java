package it.aw.readingqueue.model;

/**
 * Richiesta di ricerca. {@code rerank} si applica solo alla modalità semantica.
 */
public record SearchQuery(String userId, String text, SearchMode mode, SearchScope scope, int limit, boolean rerank) {

    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT     = 100;

    public SearchQuery {
        mode  = mode  == null ? SearchMode.LEXICAL : mode;
        scope = scope == null ? SearchScope.ITEMS  : scope;
    }

    public boolean isBlank() {
        return text == null || text.isBlank();
    }
}
