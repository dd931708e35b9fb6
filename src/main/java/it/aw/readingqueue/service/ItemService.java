package it.aw.readingqueue.service;

import it.aw.readingqueue.error.NotFoundException;
import it.aw.readingqueue.error.ValidationException;
import it.aw.readingqueue.model.ClientStatus;
import it.aw.readingqueue.model.Item;
import it.aw.readingqueue.model.ItemFilter;
import it.aw.readingqueue.model.QueueEntry;
import it.aw.readingqueue.model.StoreStats;
import it.aw.readingqueue.provider.EmbeddingProvider;
import it.aw.readingqueue.registry.ItemStore;
import it.aw.readingqueue.registry.LexicalIndex;
import it.aw.readingqueue.registry.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

/**
 * Operazioni CRUD sugli item intorno al motore: coda ordinata per data o per
 * priorità, dettaglio, cancellazione, cambio di stato e statistiche.
 */
@Service
public class ItemService {

    private static final Logger log = LoggerFactory.getLogger(ItemService.class);

    /** Stati che l'utente può impostare a mano; adding ed error sono gestiti dalla pipeline. */
    static final Set<ClientStatus> USER_STATUSES =
            Set.of(ClientStatus.QUEUED, ClientStatus.PAUSED, ClientStatus.COMPLETED, ClientStatus.BOOKMARK);

    public enum QueueOrder { CREATED, PRIORITY }

    private final ItemStore store;
    private final LexicalIndex lexicalIndex;
    private final VectorIndex vectorIndex;
    private final PriorityScorer priorityScorer;
    private final EmbeddingProvider embeddingProvider;

    public ItemService(ItemStore store,
                       LexicalIndex lexicalIndex,
                       VectorIndex vectorIndex,
                       PriorityScorer priorityScorer,
                       EmbeddingProvider embeddingProvider) {
        this.store = store;
        this.lexicalIndex = lexicalIndex;
        this.vectorIndex = vectorIndex;
        this.priorityScorer = priorityScorer;
        this.embeddingProvider = embeddingProvider;
    }

    public List<QueueEntry> list(String userId, Set<ClientStatus> statuses, QueueOrder order) {
        List<Item> items = store.listItems(userId, new ItemFilter(statuses, List.of()));
        LocalDateTime now = LocalDateTime.now();
        return order == QueueOrder.PRIORITY
                ? priorityScorer.rank(items, now)
                : priorityScorer.annotate(items, now);
    }

    public QueueEntry get(String userId, String itemId) {
        Item item = store.findItem(userId, itemId)
                .orElseThrow(() -> new NotFoundException("Item non trovato: " + itemId));
        return new QueueEntry(item, priorityScorer.priorityOf(item, LocalDateTime.now()));
    }

    public void delete(String userId, String itemId) {
        if (!store.deleteItem(userId, itemId)) {
            throw new NotFoundException("Item non trovato: " + itemId);
        }
        lexicalIndex.removeItem(userId, itemId);
        vectorIndex.removeItem(userId, itemId);
        log.info("Item {} eliminato", itemId);
    }

    public QueueEntry updateStatus(String userId, String itemId, ClientStatus status) {
        if (status == null || !USER_STATUSES.contains(status)) {
            throw new ValidationException("Stato non impostabile manualmente: " + status);
        }
        if (!store.updateClientStatus(userId, itemId, status)) {
            throw new NotFoundException("Item non trovato: " + itemId);
        }
        return get(userId, itemId);
    }

    public StoreStats stats() {
        return new StoreStats(
                store.totalItems(),
                store.embeddedItems(),
                store.totalChunks(),
                "DuckDB + Lucene (in-memory)",
                embeddingProvider.modelName());
    }
}
