package it.aw.readingqueue.registry;

import it.aw.readingqueue.model.ArticleContent;
import it.aw.readingqueue.model.ChunkEmbedding;
import it.aw.readingqueue.model.ChunkVector;
import it.aw.readingqueue.model.ClientStatus;
import it.aw.readingqueue.model.IndexedText;
import it.aw.readingqueue.model.IndexedVector;
import it.aw.readingqueue.model.Item;
import it.aw.readingqueue.model.ItemFilter;
import it.aw.readingqueue.model.ItemSummary;
import it.aw.readingqueue.model.ItemVector;
import it.aw.readingqueue.model.ServerStatus;
import it.aw.readingqueue.model.SummaryData;
import it.aw.readingqueue.model.Vectorization;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Accesso ai dati usato dal motore. Ogni operazione è limitata a un solo
 * utente: nessun vettore di un utente è mai visibile a un altro.
 */
public interface ItemStore {

    /** Crea l'item in stato adding/saved. {@code ConflictException} se l'URL è già salvato. */
    Item createItem(String userId, String url);

    Optional<Item> findItem(String userId, String itemId);

    List<Item> listItems(String userId, ItemFilter filter);

    /** Item per id, nell'ordine richiesto; gli id inesistenti sono ignorati. */
    List<Item> findItems(String userId, Collection<String> itemIds);

    /**
     * Riserva l'URL canonico per l'item (insert-or-conflict sullo store).
     * Idempotente per lo stesso item; {@code ConflictException} se appartiene a un altro item.
     */
    void claimCanonicalUrl(String userId, String canonicalUrl, String itemId);

    Item applyExtraction(String userId, String itemId, ArticleContent content);

    Item applySummary(String userId, String itemId, SummaryData summary);

    /**
     * Sostituisce i chunk e scrive l'embedding dell'item in un'unica transazione,
     * portando l'item in stato embedded/queued.
     */
    void saveEmbedding(String userId, String itemId, Vectorization vectorization);

    /** Sostituisce tutti i chunk dell'item in un'unica transazione. */
    void insertChunks(String userId, String itemId, List<ChunkEmbedding> chunks);

    void updateServerStatus(String userId, String itemId, ServerStatus status);

    boolean updateClientStatus(String userId, String itemId, ClientStatus status);

    void markError(String userId, String itemId, String message);

    /** Elimina item, chunk e chiave canonica. */
    boolean deleteItem(String userId, String itemId);

    /** Vettori degli item che corrispondono al filtro e hanno un embedding. */
    List<ItemVector> getItemVectors(String userId, ItemFilter filter);

    List<ChunkVector> getChunkVectors(String userId, String itemId);

    List<ItemSummary> getItemSummaries(String userId, Collection<String> itemIds);

    /** Testi da indicizzare lessicalmente, per tutti gli utenti (ricostruzione all'avvio). */
    List<IndexedText> loadIndexableTexts();

    /** Testi di un singolo item (testo completo + chunk). */
    List<IndexedText> loadIndexableTexts(String userId, String itemId);

    /** Vettori di item e chunk per l'indice semantico, per tutti gli utenti (ricostruzione all'avvio). */
    List<IndexedVector> loadIndexableVectors();

    /** Vettori di un singolo item (embedding dell'item + chunk). */
    List<IndexedVector> loadIndexableVectors(String userId, String itemId);

    int totalItems();

    int embeddedItems();

    int totalChunks();
}
