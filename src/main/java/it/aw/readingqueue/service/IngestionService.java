package it.aw.readingqueue.service;

import io.github.resilience4j.retry.Retry;
import it.aw.readingqueue.config.MdcAwareExecutor;
import it.aw.readingqueue.error.ConflictException;
import it.aw.readingqueue.error.NotFoundException;
import it.aw.readingqueue.error.ReadingQueueException;
import it.aw.readingqueue.model.ArticleContent;
import it.aw.readingqueue.model.ClientStatus;
import it.aw.readingqueue.model.Item;
import it.aw.readingqueue.model.ServerStatus;
import it.aw.readingqueue.model.SummaryData;
import it.aw.readingqueue.model.Vectorization;
import it.aw.readingqueue.provider.ContentExtractor;
import it.aw.readingqueue.registry.ItemStore;
import it.aw.readingqueue.registry.LexicalIndex;
import it.aw.readingqueue.registry.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Pipeline di ingestione di un articolo.
 * <p>
 * Stadi, in ordine e ciascuno ripristinabile:
 * <ol>
 *   <li>saved → extracted: estrazione del contenuto e riserva dell'URL canonico</li>
 *   <li>extracted → summarised: sintesi ed expiry score dall'LLM</li>
 *   <li>summarised → embedded: vettorizzazione; chunk ed embedding salvati in una
 *       transazione, l'item passa in coda (adding → queued) e entra nell'indice lessicale</li>
 *   <li>embedded → classified: pronto per clustering e ricerca</li>
 * </ol>
 * Timeout ed errori transitori dei provider sono ritentati con backoff esponenziale
 * (Resilience4j); gli altri errori chiudono l'item in stato error con il messaggio.
 * Un URL canonico già salvato dall'utente elimina il nuovo item e segnala il conflitto.
 * Se l'item viene cancellato durante l'elaborazione la pipeline si ferma senza errori.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final ItemStore store;
    private final LexicalIndex lexicalIndex;
    private final VectorIndex vectorIndex;
    private final ContentExtractor extractor;
    private final SummaryService summaryService;
    private final Vectorizer vectorizer;
    private final Retry retry;
    private final Executor executor;

    @Autowired
    public IngestionService(ItemStore store,
                            LexicalIndex lexicalIndex,
                            VectorIndex vectorIndex,
                            ContentExtractor extractor,
                            SummaryService summaryService,
                            Vectorizer vectorizer,
                            Retry ingestionRetry,
                            @Qualifier("ingestionExecutor") ExecutorService ingestionExecutor) {
        this(store, lexicalIndex, vectorIndex, extractor, summaryService, vectorizer, ingestionRetry,
                (Executor) new MdcAwareExecutor(ingestionExecutor));
    }

    IngestionService(ItemStore store,
                     LexicalIndex lexicalIndex,
                     VectorIndex vectorIndex,
                     ContentExtractor extractor,
                     SummaryService summaryService,
                     Vectorizer vectorizer,
                     Retry retry,
                     Executor executor) {
        this.store = store;
        this.lexicalIndex = lexicalIndex;
        this.vectorIndex = vectorIndex;
        this.extractor = extractor;
        this.summaryService = summaryService;
        this.vectorizer = vectorizer;
        this.retry = retry;
        this.executor = executor;
    }

    /**
     * Salva l'URL e avvia la pipeline in background.
     *
     * @return l'item appena creato (adding/saved)
     * @throws ConflictException se l'utente ha già salvato lo stesso URL
     */
    public Item submit(String userId, String rawUrl) {
        Item item = store.createItem(userId, UrlPreparer.prepare(rawUrl));
        log.info("Item {} creato per {}", item.id(), item.url());
        executor.execute(() -> processQuietly(userId, item.id()));
        return item;
    }

    /** Come {@link #submit} ma esegue la pipeline nel thread chiamante e ne propaga gli errori. */
    public Item ingest(String userId, String rawUrl) {
        Item item = store.createItem(userId, UrlPreparer.prepare(rawUrl));
        log.info("Item {} creato per {}", item.id(), item.url());
        return process(userId, item.id());
    }

    /**
     * Riprende la pipeline di un item dal primo stadio non completato.
     * Un item già classificato e non in errore è restituito così com'è.
     */
    public Item retry(String userId, String itemId) {
        Item item = store.findItem(userId, itemId)
                .orElseThrow(() -> new NotFoundException("Item non trovato: " + itemId));
        if (item.serverStatus() == ServerStatus.CLASSIFIED && item.clientStatus() != ClientStatus.ERROR) {
            return item;
        }
        if (item.clientStatus() == ClientStatus.ERROR) {
            store.updateClientStatus(userId, itemId, ClientStatus.ADDING);
        }
        log.info("Retry item {} da stadio {}", itemId, item.serverStatus());
        executor.execute(() -> processQuietly(userId, itemId));
        return store.findItem(userId, itemId).orElse(item);
    }

    void processQuietly(String userId, String itemId) {
        try {
            process(userId, itemId);
        } catch (ReadingQueueException e) {
            // già registrato sull'item (o item rimosso per conflitto)
            log.debug("Pipeline item {} terminata con {}", itemId, e.getClass().getSimpleName());
        } catch (RuntimeException e) {
            log.error("Errore inatteso nella pipeline dell'item {}", itemId, e);
            store.markError(userId, itemId, "Errore interno durante l'elaborazione");
        }
    }

    /**
     * Esegue gli stadi mancanti.
     *
     * @return l'item aggiornato, oppure null se è stato cancellato durante l'elaborazione
     */
    Item process(String userId, String itemId) {
        MDC.put("itemId", itemId);
        MDC.put("userId", userId);
        try {
            return runStages(userId, itemId);
        } catch (NotFoundException e) {
            log.info("Item {} rimosso durante l'elaborazione: pipeline interrotta", itemId);
            return null;
        } finally {
            MDC.remove("itemId");
            MDC.remove("userId");
        }
    }

    private Item runStages(String userId, String itemId) {
        Item item = current(userId, itemId);

        if (!item.serverStatus().isAtLeast(ServerStatus.EXTRACTED)) {
            final Item saved = item;
            ArticleContent content = stage(userId, itemId, "estrazione", () -> extractor.extract(saved.url()));
            current(userId, itemId);
            claim(userId, itemId, content.dedupKey());
            try {
                item = store.applyExtraction(userId, itemId, content);
            } catch (NotFoundException e) {
                store.deleteItem(userId, itemId);
                throw e;
            }
            log.info("Item {} estratto: '{}'", itemId, item.title());
        }

        if (!item.serverStatus().isAtLeast(ServerStatus.SUMMARISED)) {
            final Item extracted = item;
            SummaryData summary = stage(userId, itemId, "sintesi", () -> summaryService.summarise(extracted));
            item = store.applySummary(userId, itemId, summary);
            log.info("Item {} sintetizzato (expiry={})", itemId, item.expiryScore());
        }

        if (!item.serverStatus().isAtLeast(ServerStatus.EMBEDDED)) {
            final String text = item.contentText();
            Vectorization vectorization = stage(userId, itemId, "embedding", () -> vectorizer.vectorize(text));
            current(userId, itemId);
            store.saveEmbedding(userId, itemId, vectorization);
            lexicalIndex.replaceItem(userId, itemId, store.loadIndexableTexts(userId, itemId));
            vectorIndex.replaceItem(userId, itemId, store.loadIndexableVectors(userId, itemId));
            log.info("Item {} vettorizzato: {} chunk", itemId, vectorization.chunks().size());
        }

        item = current(userId, itemId);
        if (item.clientStatus() == ClientStatus.ADDING) {
            store.updateClientStatus(userId, itemId, ClientStatus.QUEUED);
        }
        if (!item.serverStatus().isAtLeast(ServerStatus.CLASSIFIED)) {
            store.updateServerStatus(userId, itemId, ServerStatus.CLASSIFIED);
        }
        log.info("Item {} pronto", itemId);
        return current(userId, itemId);
    }

    /** Esegue uno stadio con retry; un errore definitivo viene registrato sull'item. */
    private <T> T stage(String userId, String itemId, String name, Supplier<T> work) {
        try {
            return Retry.decorateSupplier(retry, work).get();
        } catch (NotFoundException e) {
            throw e;
        } catch (ReadingQueueException e) {
            log.error("Stadio di {} fallito per item {}: {}", name, itemId, e.getMessage(), e);
            store.markError(userId, itemId, e.getMessage());
            throw e;
        }
    }

    private void claim(String userId, String itemId, String canonicalUrl) {
        try {
            store.claimCanonicalUrl(userId, canonicalUrl, itemId);
        } catch (ConflictException e) {
            log.warn("Item {} duplicato di un articolo già salvato ({}): rimosso", itemId, canonicalUrl);
            store.deleteItem(userId, itemId);
            throw e;
        }
    }

    private Item current(String userId, String itemId) {
        return store.findItem(userId, itemId)
                .orElseThrow(() -> new NotFoundException("Item non trovato: " + itemId));
    }
}
