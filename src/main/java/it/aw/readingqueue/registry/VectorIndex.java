package it.aw.readingqueue.registry;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.RelevanceScore;
import dev.langchain4j.store.embedding.filter.Filter;
import it.aw.readingqueue.model.IndexedVector;
import it.aw.readingqueue.model.SearchScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

/**
 * Indice semantico sugli embedding di item e chunk, sopra un {@link EmbeddingStore} LangChain4j.
 * <p>
 * Ogni segmento porta nei metadati utente, item, tipo (item o chunk) e posizione
 * del chunk; le ricerche filtrano sempre per utente e tipo. Lo store restituisce
 * relevance score in [0, 1]: qui si espone la similarità coseno.
 * L'indice non è persistito: viene ricostruito da DuckDB all'avvio (StoreLifecycle).
 */
@Component
public class VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(VectorIndex.class);

    static final String M_USER     = "userId";
    static final String M_ITEM     = "itemId";
    static final String M_TYPE     = "type";
    static final String M_POSITION = "position";

    static final String TYPE_ITEM  = "item";
    static final String TYPE_CHUNK = "chunk";

    private final EmbeddingStore<TextSegment> embeddingStore;

    public VectorIndex(EmbeddingStore<TextSegment> embeddingStore) {
        this.embeddingStore = embeddingStore;
    }

    /** Risultato: {@code chunkPosition} null per lo scope items. */
    public record Hit(String itemId, Integer chunkPosition, String text, double similarity) {}

    public synchronized void rebuild(Collection<IndexedVector> vectors) {
        embeddingStore.removeAll();
        add(vectors);
        log.info("Indice semantico ricostruito: {} vettori", vectors.size());
    }

    /** Sostituisce i vettori dell'item con quelli passati. */
    public synchronized void replaceItem(String userId, String itemId, Collection<IndexedVector> vectors) {
        embeddingStore.removeAll(ofItem(userId, itemId));
        add(vectors);
    }

    public synchronized void removeItem(String userId, String itemId) {
        embeddingStore.removeAll(ofItem(userId, itemId));
    }

    /**
     * Vettori dell'utente più simili alla query, in ordine di similarità decrescente.
     * Per lo scope chunks un item può comparire più volte.
     */
    public List<Hit> search(String userId, float[] query, SearchScope scope, int maxResults, double minSimilarity) {
        String type = scope == SearchScope.CHUNKS ? TYPE_CHUNK : TYPE_ITEM;
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(Embedding.from(query))
                .maxResults(maxResults)
                .minScore(RelevanceScore.fromCosineSimilarity(minSimilarity))
                .filter(metadataKey(M_USER).isEqualTo(userId).and(metadataKey(M_TYPE).isEqualTo(type)))
                .build();

        List<Hit> hits = new ArrayList<>();
        for (EmbeddingMatch<TextSegment> match : embeddingStore.search(request).matches()) {
            Metadata metadata = match.embedded().metadata();
            hits.add(new Hit(
                    metadata.getString(M_ITEM),
                    metadata.getInteger(M_POSITION),
                    match.embedded().text(),
                    CosineSimilarity.fromRelevanceScore(match.score())));
        }
        return hits;
    }

    private void add(Collection<IndexedVector> vectors) {
        if (vectors.isEmpty()) {
            return;
        }
        List<Embedding> embeddings = new ArrayList<>(vectors.size());
        List<TextSegment> segments = new ArrayList<>(vectors.size());
        for (IndexedVector v : vectors) {
            Metadata metadata = new Metadata()
                    .put(M_USER, v.userId())
                    .put(M_ITEM, v.itemId())
                    .put(M_TYPE, v.isChunk() ? TYPE_CHUNK : TYPE_ITEM);
            if (v.isChunk()) {
                metadata.put(M_POSITION, v.chunkPosition());
            }
            embeddings.add(Embedding.from(v.vector()));
            segments.add(TextSegment.from(v.text(), metadata));
        }
        embeddingStore.addAll(embeddings, segments);
    }

    private static Filter ofItem(String userId, String itemId) {
        return metadataKey(M_USER).isEqualTo(userId).and(metadataKey(M_ITEM).isEqualTo(itemId));
    }
}
