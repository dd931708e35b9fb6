package it.aw.readingqueue.provider;

import it.aw.readingqueue.model.ArticleContent;

/**
 * Estrae il contenuto leggibile di una pagina web.
 * Lancia {@code ExtractionException} se la pagina non contiene testo utile
 * o non è raggiungibile, {@code ProviderTimeoutException} oltre il timeout.
 */
public interface ContentExtractor {

    ArticleContent extract(String url);
}
