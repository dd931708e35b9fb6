package it.aw.readingqueue.service;

import it.aw.readingqueue.error.ValidationException;
import it.aw.readingqueue.model.Item;
import it.aw.readingqueue.model.SearchMode;
import it.aw.readingqueue.model.SearchQuery;
import it.aw.readingqueue.model.SearchResult;
import it.aw.readingqueue.model.SearchScope;
import it.aw.readingqueue.provider.RerankProvider;
import it.aw.readingqueue.registry.ItemStore;
import it.aw.readingqueue.registry.LexicalIndex;
import it.aw.readingqueue.registry.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ricerca ibrida sugli item di un utente.
 * <p>
 * Lessicale: BM25 sull'indice Lucene. Semantica: similarità coseno tra l'embedding
 * della query e gli embedding di item o chunk nel {@link VectorIndex}, filtrati per
 * utente e soglia direttamente nello store; per i chunk si tiene il migliore per
 * item, così un item non compare mai due volte. I candidati sotto soglia sono
 * scartati; se richiesto, i sopravvissuti sono riordinati dal cross-encoder e
 * filtrati di nuovo sul suo punteggio. Gli slot rimasti liberi sono riempiti con
 * la ricerca lessicale sullo stesso scope.
 * <p>
 * Recupera {@code limit × FETCH_MULTIPLIER} candidati prima di soglia e rerank.
 */
@Service
public class SearchService {

    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    static final int RERANK_TEXT_LIMIT = 1000;

    private final ItemStore store;
    private final LexicalIndex lexicalIndex;
    private final VectorIndex vectorIndex;
    private final Vectorizer vectorizer;
    private final RerankProvider reranker;
    private final double semanticThreshold;
    private final double rerankThreshold;
    private final int fetchMultiplier;
    private final boolean lexicalBackfill;
    private final int previewLength;

    public SearchService(ItemStore store,
                         LexicalIndex lexicalIndex,
                         VectorIndex vectorIndex,
                         Vectorizer vectorizer,
                         RerankProvider reranker,
                         @Value("${app.search.semantic-threshold:0.35}") double semanticThreshold,
                         @Value("${app.search.rerank-threshold:0.35}") double rerankThreshold,
                         @Value("${app.search.fetch-multiplier:4}") int fetchMultiplier,
                         @Value("${app.search.lexical-backfill:true}") boolean lexicalBackfill,
                         @Value("${app.search.preview-length:200}") int previewLength) {
        this.store = store;
        this.lexicalIndex = lexicalIndex;
        this.vectorIndex = vectorIndex;
        this.vectorizer = vectorizer;
        this.reranker = reranker;
        this.semanticThreshold = semanticThreshold;
        this.rerankThreshold = rerankThreshold;
        this.fetchMultiplier = fetchMultiplier;
        this.lexicalBackfill = lexicalBackfill;
        this.previewLength = previewLength;
    }

    /**
     * Esegue la ricerca. Una query vuota restituisce una lista vuota senza
     * chiamare alcun provider.
     *
     * @return risultati dal più rilevante, al massimo {@code query.limit()}
     */
    public List<SearchResult> search(SearchQuery query) {
        if (query.limit() < 1 || query.limit() > SearchQuery.MAX_LIMIT) {
            throw new ValidationException("limit deve essere in [1, " + SearchQuery.MAX_LIMIT + "]: " + query.limit());
        }
        if (query.isBlank()) {
            return List.of();
        }
        String text = query.text().strip();
        List<SearchResult> results = query.mode() == SearchMode.SEMANTIC
                ? semantic(query.userId(), text, query.scope(), query.limit(), query.rerank())
                : lexical(query.userId(), text, query.scope(), query.limit(), Set.of());
        log.debug("Ricerca {}/{} '{}': {} risultati", query.mode(), query.scope(), text, results.size());
        return results;
    }

    // ── Lessicale ────────────────────────────────────────────────────────────

    private List<SearchResult> lexical(String userId, String text, SearchScope scope, int limit, Set<String> exclude) {
        int fetch = (limit + exclude.size()) * (scope == SearchScope.CHUNKS ? fetchMultiplier : 1);
        Map<String, LexicalIndex.Hit> bestPerItem = new LinkedHashMap<>();
        for (LexicalIndex.Hit hit : lexicalIndex.search(userId, text, scope, fetch)) {
            if (!exclude.contains(hit.itemId())) {
                bestPerItem.putIfAbsent(hit.itemId(), hit);
            }
        }
        List<String> ids = bestPerItem.keySet().stream().limit(limit).toList();
        Map<String, Item> items = itemsById(userId, ids);

        List<SearchResult> results = new ArrayList<>(ids.size());
        for (String id : ids) {
            Item item = items.get(id);
            if (item == null) {
                continue;
            }
            LexicalIndex.Hit hit = bestPerItem.get(id);
            results.add(new SearchResult(id, item.title(), item.url(), preview(hit.text()),
                    hit.score(), null, scope, hit.chunkPosition()));
        }
        return results;
    }

    // ── Semantica ────────────────────────────────────────────────────────────

    private List<SearchResult> semantic(String userId, String text, SearchScope scope, int limit, boolean rerank) {
        float[] queryVector = vectorizer.embedQuery(text);
        int fetch = limit * fetchMultiplier;
        List<VectorIndex.Hit> hits = vectorIndex.search(userId, queryVector, scope,
                scope == SearchScope.CHUNKS ? fetch * fetchMultiplier : fetch, semanticThreshold);

        // per i chunk resta il migliore di ogni item: i risultati arrivano già ordinati
        Map<String, VectorIndex.Hit> bestPerItem = new LinkedHashMap<>();
        for (VectorIndex.Hit hit : hits) {
            bestPerItem.putIfAbsent(hit.itemId(), hit);
        }
        List<VectorIndex.Hit> top = bestPerItem.values().stream().limit(fetch).toList();

        Map<String, Item> items = itemsById(userId, top.stream().map(VectorIndex.Hit::itemId).toList());
        List<SearchResult> results = new ArrayList<>(top.size());
        for (VectorIndex.Hit hit : top) {
            Item item = items.get(hit.itemId());
            if (item == null) {
                continue;
            }
            String previewSource = hit.chunkPosition() != null ? hit.text() : itemPreviewSource(item);
            results.add(new SearchResult(item.id(), item.title(), item.url(), preview(previewSource),
                    hit.similarity(), 1.0 - hit.similarity(), scope, hit.chunkPosition()));
        }

        if (rerank && !results.isEmpty()) {
            if (reranker.isAvailable()) {
                results = rerank(text, results, items);
            } else {
                log.debug("Rerank richiesto ma nessun reranker configurato: ordino per coseno");
            }
        }
        if (results.size() > limit) {
            results = new ArrayList<>(results.subList(0, limit));
        }

        if (lexicalBackfill && results.size() < limit) {
            Set<String> seen = results.stream().map(SearchResult::itemId).collect(Collectors.toSet());
            List<SearchResult> backfill = lexical(userId, text, scope, limit - results.size(), seen);
            results = new ArrayList<>(results);
            results.addAll(backfill);
        }
        return results;
    }

    private List<SearchResult> rerank(String query, List<SearchResult> results, Map<String, Item> items) {
        List<String> texts = results.stream()
                .map(r -> rerankText(items.get(r.itemId()), r.preview()))
                .toList();
        List<Double> scores = reranker.rerank(query, texts);

        List<SearchResult> reranked = new ArrayList<>(results.size());
        for (int i = 0; i < results.size(); i++) {
            Double score = scores.get(i);
            if (score != null && Double.isFinite(score) && score >= rerankThreshold) {
                reranked.add(results.get(i).withScore(score));
            }
        }
        reranked.sort(Comparator.comparing(SearchResult::score).reversed());
        log.debug("Rerank: {} candidati, {} sopra soglia {}", results.size(), reranked.size(), rerankThreshold);
        return reranked;
    }

    static String rerankText(Item item, String preview) {
        StringBuilder sb = new StringBuilder();
        if (item.title() != null) sb.append(item.title()).append('\n');
        if (item.summary() != null) sb.append(item.summary()).append('\n');
        if (preview != null) sb.append(preview);
        String text = sb.toString().strip();
        return text.length() > RERANK_TEXT_LIMIT ? text.substring(0, RERANK_TEXT_LIMIT) : text;
    }

    private Map<String, Item> itemsById(String userId, List<String> ids) {
        return store.findItems(userId, new ArrayList<>(new HashSet<>(ids))).stream()
                .collect(Collectors.toMap(Item::id, Function.identity()));
    }

    private static String itemPreviewSource(Item item) {
        return item.summary() != null ? item.summary() : item.contentText();
    }

    private String preview(String text) {
        if (text == null) {
            return null;
        }
        String s = text.strip();
        return s.length() > previewLength ? s.substring(0, previewLength) + "…" : s;
    }
}
