package it.aw.readingqueue.config;

import it.aw.readingqueue.registry.ItemStore;
import it.aw.readingqueue.registry.LexicalIndex;
import it.aw.readingqueue.registry.VectorIndex;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Ciclo di vita degli store.
 * <p>
 * DuckDB persiste automaticamente; l'indice lessicale e quello semantico vivono
 * in memoria e vanno ricostruiti dal contenuto del registro a ogni avvio.
 */
@Component
public class StoreLifecycle {

    private static final Logger log = LoggerFactory.getLogger(StoreLifecycle.class);

    private final ItemStore store;
    private final LexicalIndex lexicalIndex;
    private final VectorIndex vectorIndex;

    public StoreLifecycle(ItemStore store, LexicalIndex lexicalIndex, VectorIndex vectorIndex) {
        this.store = store;
        this.lexicalIndex = lexicalIndex;
        this.vectorIndex = vectorIndex;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void rebuildIndexes() {
        log.info("Avvio: ricostruzione indici lessicale e semantico da DuckDB...");
        lexicalIndex.rebuild(store.loadIndexableTexts());
        vectorIndex.rebuild(store.loadIndexableVectors());
        log.info("Store pronti: {} item ({} con embedding), {} chunk",
                store.totalItems(), store.embeddedItems(), store.totalChunks());
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutdown: {} item, {} unità nell'indice lessicale", store.totalItems(), lexicalIndex.size());
    }
}
