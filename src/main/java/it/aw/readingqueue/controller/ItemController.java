package it.aw.readingqueue.controller;

import it.aw.readingqueue.error.ValidationException;
import it.aw.readingqueue.model.ClientStatus;
import it.aw.readingqueue.model.Item;
import it.aw.readingqueue.model.QueueEntry;
import it.aw.readingqueue.model.SearchMode;
import it.aw.readingqueue.model.SearchQuery;
import it.aw.readingqueue.model.SearchResult;
import it.aw.readingqueue.model.SearchScope;
import it.aw.readingqueue.model.StoreStats;
import it.aw.readingqueue.service.IngestionService;
import it.aw.readingqueue.service.ItemService;
import it.aw.readingqueue.service.SearchService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Espone le operazioni sugli item della coda di lettura e la ricerca.
 *
 * Endpoint disponibili:
 *   POST   /api/items                    — salva un URL e avvia l'ingestione in background
 *   GET    /api/items?status=&sort=      — coda filtrata per stato, per data o per priorità
 *   GET    /api/items/search?q=&mode=&scope=&limit=&rerank= — ricerca lessicale o semantica
 *   GET    /api/items/stats              — statistiche aggregate dello store
 *   GET    /api/items/{id}               — dettaglio di un item
 *   DELETE /api/items/{id}               — elimina item e chunk
 *   PATCH  /api/items/{id}/status        — cambia lo stato client
 *   POST   /api/items/{id}/retry         — riprende la pipeline dal primo stadio incompleto
 *
 * L'utente è identificato dall'header X-User-Id. Gli errori sono tradotti da ApiExceptionHandler.
 */
@RestController
@RequestMapping("/api/items")
public class ItemController {

    static final String USER_HEADER = "X-User-Id";

    private final IngestionService ingestionService;
    private final ItemService itemService;
    private final SearchService searchService;

    public ItemController(IngestionService ingestionService,
                          ItemService itemService,
                          SearchService searchService) {
        this.ingestionService = ingestionService;
        this.itemService = itemService;
        this.searchService = searchService;
    }

    public record AddItemRequest(String url) {}

    public record StatusRequest(String status) {}

    // -------------------------------------------------------------------------
    // POST /api/items
    // -------------------------------------------------------------------------

    /**
     * Salva un articolo. La risposta arriva subito; lo stato avanza in background.
     *
     * Esempio:
     *   curl -X POST http://localhost:8889/api/items -H "X-User-Id: u1" \
     *        -H "Content-Type: application/json" -d '{"url":"example.com/post"}'
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> add(@RequestHeader(USER_HEADER) String userId,
                                                   @RequestBody AddItemRequest request) {
        Item item = ingestionService.submit(userId, request.url());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("itemId", item.id()));
    }

    // -------------------------------------------------------------------------
    // GET /api/items?status=queued&sort=priority
    // -------------------------------------------------------------------------

    @GetMapping
    public ResponseEntity<List<QueueEntry>> list(@RequestHeader(USER_HEADER) String userId,
                                                 @RequestParam(value = "status", required = false) List<String> status,
                                                 @RequestParam(value = "sort", defaultValue = "created") String sort) {
        Set<ClientStatus> statuses = status == null ? null : status.stream()
                .map(s -> enumParam(ClientStatus.class, "status", s))
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(ClientStatus.class)));
        return ResponseEntity.ok(itemService.list(userId, statuses, enumParam(ItemService.QueueOrder.class, "sort", sort)));
    }

    // -------------------------------------------------------------------------
    // GET /api/items/search?q=...&mode=SEMANTIC&scope=CHUNKS&limit=10&rerank=true
    // -------------------------------------------------------------------------

    /**
     * Esempio:
     *   curl "http://localhost:8889/api/items/search?q=vector+databases&mode=SEMANTIC" -H "X-User-Id: u1"
     */
    @GetMapping("/search")
    public ResponseEntity<List<SearchResult>> search(@RequestHeader(USER_HEADER) String userId,
                                                     @RequestParam(value = "q", defaultValue = "") String q,
                                                     @RequestParam(value = "mode", defaultValue = "lexical") String mode,
                                                     @RequestParam(value = "scope", defaultValue = "items") String scope,
                                                     @RequestParam(value = "limit", defaultValue = "" + SearchQuery.DEFAULT_LIMIT) int limit,
                                                     @RequestParam(value = "rerank", defaultValue = "false") boolean rerank) {
        SearchQuery query = new SearchQuery(userId, q,
                enumParam(SearchMode.class, "mode", mode),
                enumParam(SearchScope.class, "scope", scope),
                limit, rerank);
        return ResponseEntity.ok(searchService.search(query));
    }

    // -------------------------------------------------------------------------
    // GET /api/items/stats
    // -------------------------------------------------------------------------

    @GetMapping("/stats")
    public ResponseEntity<StoreStats> stats() {
        return ResponseEntity.ok(itemService.stats());
    }

    // -------------------------------------------------------------------------
    // /api/items/{id}
    // -------------------------------------------------------------------------

    @GetMapping("/{id}")
    public ResponseEntity<QueueEntry> get(@RequestHeader(USER_HEADER) String userId, @PathVariable String id) {
        return ResponseEntity.ok(itemService.get(userId, id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@RequestHeader(USER_HEADER) String userId, @PathVariable String id) {
        itemService.delete(userId, id);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<QueueEntry> updateStatus(@RequestHeader(USER_HEADER) String userId,
                                                   @PathVariable String id,
                                                   @RequestBody StatusRequest request) {
        return ResponseEntity.ok(itemService.updateStatus(userId, id,
                enumParam(ClientStatus.class, "status", request.status())));
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<Item> retry(@RequestHeader(USER_HEADER) String userId, @PathVariable String id) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ingestionService.retry(userId, id));
    }

    /** I parametri enum si accettano in minuscolo, come nei valori salvati. */
    static <E extends Enum<E>> E enumParam(Class<E> type, String name, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Parametro '" + name + "' mancante");
        }
        try {
            return Enum.valueOf(type, value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Valore non valido per '" + name + "': " + value, e);
        }
    }
}
