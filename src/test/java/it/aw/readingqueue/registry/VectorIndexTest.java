package it.aw.readingqueue.registry;

import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import it.aw.readingqueue.model.IndexedVector;
import it.aw.readingqueue.model.SearchScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VectorIndexTest {

    private static final float[] QUERY = {1f, 0f};

    private VectorIndex index;

    @BeforeEach
    void setUp() {
        index = new VectorIndex(new InMemoryEmbeddingStore<>());
        index.rebuild(List.of(
                new IndexedVector("u1", "rust", null, "Rust release notes", new float[]{1f, 0f}),
                new IndexedVector("u1", "rust", 0, "compiler internals", new float[]{0.8f, 0.6f}),
                new IndexedVector("u1", "rust", 1, "incremental builds", new float[]{1f, 0.1f}),
                new IndexedVector("u1", "garden", null, "Growing tomatoes", new float[]{0f, 1f}),
                new IndexedVector("u2", "other", null, "Rust for another user", new float[]{1f, 0f})));
    }

    @Test
    @DisplayName("scope item: solo gli embedding degli item, con la similarità coseno")
    void itemScope() {
        List<VectorIndex.Hit> hits = index.search("u1", QUERY, SearchScope.ITEMS, 10, -1.0);

        assertThat(hits).extracting(VectorIndex.Hit::itemId).containsExactly("rust", "garden");
        assertThat(hits.get(0).chunkPosition()).isNull();
        assertThat(hits.get(0).similarity()).isCloseTo(1.0, within(1e-6));
        assertThat(hits.get(1).similarity()).isCloseTo(0.0, within(1e-6));
    }

    @Test
    @DisplayName("scope chunk: tutti i chunk, dal più simile, con testo e posizione")
    void chunkScope() {
        List<VectorIndex.Hit> hits = index.search("u1", QUERY, SearchScope.CHUNKS, 10, 0.0);

        assertThat(hits).extracting(VectorIndex.Hit::chunkPosition).containsExactly(1, 0);
        assertThat(hits.get(1).text()).isEqualTo("compiler internals");
        assertThat(hits.get(1).similarity()).isCloseTo(0.8, within(1e-6));
    }

    @Test
    @DisplayName("la soglia minima di similarità è applicata dallo store")
    void minSimilarity() {
        assertThat(index.search("u1", QUERY, SearchScope.ITEMS, 10, 0.35))
                .extracting(VectorIndex.Hit::itemId).containsExactly("rust");
        assertThat(index.search("u1", QUERY, SearchScope.CHUNKS, 10, 0.9))
                .extracting(VectorIndex.Hit::chunkPosition).containsExactly(1);
    }

    @Test
    @DisplayName("isolamento per utente")
    void userIsolation() {
        assertThat(index.search("u2", QUERY, SearchScope.ITEMS, 10, 0.0))
                .extracting(VectorIndex.Hit::itemId).containsExactly("other");
        assertThat(index.search("u2", QUERY, SearchScope.CHUNKS, 10, 0.0)).isEmpty();
        assertThat(index.search("u3", QUERY, SearchScope.ITEMS, 10, 0.0)).isEmpty();
    }

    @Test
    @DisplayName("replaceItem sostituisce solo i vettori di quell'item, removeItem li toglie")
    void replaceAndRemove() {
        index.replaceItem("u1", "rust", List.of(
                new IndexedVector("u1", "rust", null, "Rust 2.0", new float[]{0.6f, 0.8f})));

        assertThat(index.search("u1", QUERY, SearchScope.CHUNKS, 10, -1.0)).isEmpty();
        List<VectorIndex.Hit> items = index.search("u1", QUERY, SearchScope.ITEMS, 10, -1.0);
        assertThat(items).extracting(VectorIndex.Hit::text).containsExactly("Rust 2.0", "Growing tomatoes");
        assertThat(index.search("u2", QUERY, SearchScope.ITEMS, 10, 0.0)).hasSize(1);

        index.removeItem("u1", "rust");
        assertThat(index.search("u1", QUERY, SearchScope.ITEMS, 10, -1.0))
                .extracting(VectorIndex.Hit::itemId).containsExactly("garden");
    }

    @Test
    @DisplayName("rebuild scarta il contenuto precedente")
    void rebuildReplacesEverything() {
        index.rebuild(List.of(new IndexedVector("u1", "garden", null, "Growing tomatoes", new float[]{0f, 1f})));

        assertThat(index.search("u1", QUERY, SearchScope.ITEMS, 10, -1.0))
                .extracting(VectorIndex.Hit::itemId).containsExactly("garden");
        assertThat(index.search("u2", QUERY, SearchScope.ITEMS, 10, -1.0)).isEmpty();
    }
}
