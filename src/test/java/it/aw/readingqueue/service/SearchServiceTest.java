package it.aw.readingqueue.service;

import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import it.aw.readingqueue.error.ProviderException;
import it.aw.readingqueue.error.ValidationException;
import it.aw.readingqueue.model.IndexedText;
import it.aw.readingqueue.model.IndexedVector;
import it.aw.readingqueue.model.Item;
import it.aw.readingqueue.model.SearchMode;
import it.aw.readingqueue.model.SearchQuery;
import it.aw.readingqueue.model.SearchResult;
import it.aw.readingqueue.model.SearchScope;
import it.aw.readingqueue.provider.RerankProvider;
import it.aw.readingqueue.registry.ItemStore;
import it.aw.readingqueue.registry.LexicalIndex;
import it.aw.readingqueue.registry.VectorIndex;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SearchServiceTest {

    private static final String USER = "u1";

    private final ItemStore store = mock(ItemStore.class);
    private final Vectorizer vectorizer = mock(Vectorizer.class);
    private final RerankProvider reranker = mock(RerankProvider.class);
    private LexicalIndex lexicalIndex;
    private VectorIndex vectorIndex;

    private final Item rust = Items.classified("rust", "Rust 2.0", "A new Rust release.", 0.5, Items.NOW);
    private final Item garden = Items.classified("garden", "Tomatoes", "Growing tomatoes.", 0.1, Items.NOW.minusDays(1));
    private final Item cooking = Items.classified("cooking", "Pasta", "Cooking pasta at home.", 0.1, Items.NOW.minusDays(2));
    private final Map<String, Item> byId = Map.of("rust", rust, "garden", garden, "cooking", cooking);

    @BeforeEach
    void setUp() {
        lexicalIndex = new LexicalIndex();
        vectorIndex = new VectorIndex(new InMemoryEmbeddingStore<>());
        when(store.findItems(eq(USER), anyCollection())).thenAnswer(inv -> {
            Collection<String> ids = inv.getArgument(1);
            return ids.stream().filter(byId::containsKey).map(byId::get).toList();
        });
    }

    @AfterEach
    void tearDown() {
        lexicalIndex.close();
    }

    private SearchService service(boolean backfill) {
        return new SearchService(store, lexicalIndex, vectorIndex, vectorizer, reranker, 0.35, 0.35, 4, backfill, 200);
    }

    private static SearchQuery query(String text, SearchMode mode, SearchScope scope, int limit, boolean rerank) {
        return new SearchQuery(USER, text, mode, scope, limit, rerank);
    }

    @Nested
    @DisplayName("validazione")
    class Validation {

        @Test
        @DisplayName("query vuota: lista vuota senza chiamare provider né store")
        void blankQuery() {
            assertThat(service(true).search(query("   ", SearchMode.SEMANTIC, SearchScope.CHUNKS, 10, true))).isEmpty();
            verifyNoInteractions(vectorizer, reranker);
            verify(store, never()).findItems(anyString(), anyCollection());
        }

        @Test
        @DisplayName("limit fuori da [1, 100]: errore di validazione")
        void limitBounds() {
            assertThatThrownBy(() -> service(true).search(query("x", SearchMode.LEXICAL, SearchScope.ITEMS, 0, false)))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> service(true).search(query("x", SearchMode.LEXICAL, SearchScope.ITEMS, 101, false)))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("lessicale")
    class Lexical {

        @Test
        @DisplayName("scope chunk: un risultato per item, con il chunk migliore")
        void oneResultPerItem() {
            lexicalIndex.rebuild(List.of(
                    new IndexedText(USER, "rust", 0, "rust compiler and rust tooling", Items.NOW),
                    new IndexedText(USER, "rust", 1, "rust", Items.NOW),
                    new IndexedText(USER, "garden", 0, "no rust on my tomatoes, a long and unrelated sentence", Items.NOW)));

            List<SearchResult> results = service(true).search(query("rust", SearchMode.LEXICAL, SearchScope.CHUNKS, 10, false));

            assertThat(results).extracting(SearchResult::itemId).containsExactly("rust", "garden");
            assertThat(results.get(0).matchedUnit()).isEqualTo(SearchScope.CHUNKS);
            assertThat(results.get(0).distance()).isNull();
            verifyNoInteractions(vectorizer);
        }
    }

    @Nested
    @DisplayName("semantica")
    class Semantic {

        @BeforeEach
        void vectors() {
            when(vectorizer.embedQuery(anyString())).thenReturn(new float[]{1f, 0f});
            vectorIndex.rebuild(List.of(
                    itemVector("rust", 1f, 0.1f),
                    itemVector("garden", 0.6f, 0.8f),
                    itemVector("cooking", 0f, 1f),
                    new IndexedVector("u2", "foreign", null, "other user", new float[]{1f, 0f})));
        }

        private IndexedVector itemVector(String itemId, float x, float y) {
            return new IndexedVector(USER, itemId, null, byId.get(itemId).summary(), new float[]{x, y});
        }

        @Test
        @DisplayName("scope item: ordinati per coseno, sotto soglia scartati, distanza = 1 - coseno")
        void itemsByCosine() {
            List<SearchResult> results = service(false).search(query("rust", SearchMode.SEMANTIC, SearchScope.ITEMS, 10, false));

            // "foreign" appartiene a u2: mai restituito anche se identico alla query
            assertThat(results).extracting(SearchResult::itemId).containsExactly("rust", "garden");
            assertThat(results.get(1).score()).isCloseTo(0.6, within(1e-6));
            assertThat(results.get(1).distance()).isCloseTo(0.4, within(1e-6));
            assertThat(results.get(0).preview()).isEqualTo("A new Rust release.");
        }

        @Test
        @DisplayName("scope chunk: miglior chunk per item, gli item senza chunk non compaiono")
        void chunksBestPerItem() {
            vectorIndex.replaceItem(USER, "garden", List.of(
                    new IndexedVector(USER, "garden", 0, "weak chunk", new float[]{0.5f, 0.9f}),
                    new IndexedVector(USER, "garden", 1, "strong chunk", new float[]{0.9f, 0.2f})));
            vectorIndex.replaceItem(USER, "cooking", List.of(
                    new IndexedVector(USER, "cooking", 0, "off topic", new float[]{0f, 1f})));

            List<SearchResult> results = service(false).search(query("q", SearchMode.SEMANTIC, SearchScope.CHUNKS, 10, false));

            assertThat(results).hasSize(1);
            assertThat(results.get(0).itemId()).isEqualTo("garden");
            assertThat(results.get(0).chunkPosition()).isEqualTo(1);
            assertThat(results.get(0).preview()).isEqualTo("strong chunk");
        }

        @Test
        @DisplayName("rerank: riordina per punteggio del reranker e scarta sotto soglia")
        void rerank() {
            when(reranker.isAvailable()).thenReturn(true);
            when(reranker.rerank(eq("rust"), anyList())).thenReturn(List.of(0.4, 0.9));

            List<SearchResult> results = service(false).search(query("rust", SearchMode.SEMANTIC, SearchScope.ITEMS, 10, true));

            assertThat(results).extracting(SearchResult::itemId).containsExactly("garden", "rust");
            assertThat(results).extracting(SearchResult::score).containsExactly(0.9, 0.4);

            when(reranker.rerank(eq("rust"), anyList())).thenReturn(List.of(0.1, 0.9));
            assertThat(service(false).search(query("rust", SearchMode.SEMANTIC, SearchScope.ITEMS, 10, true)))
                    .extracting(SearchResult::itemId).containsExactly("garden");
        }

        @Test
        @DisplayName("rerank richiesto senza reranker configurato: ordine per coseno")
        void rerankUnavailable() {
            when(reranker.isAvailable()).thenReturn(false);

            List<SearchResult> results = service(false).search(query("rust", SearchMode.SEMANTIC, SearchScope.ITEMS, 10, true));

            assertThat(results).extracting(SearchResult::itemId).containsExactly("rust", "garden");
            verify(reranker, never()).rerank(anyString(), anyList());
        }

        @Test
        @DisplayName("errore del reranker: risale al chiamante")
        void rerankFailure() {
            when(reranker.isAvailable()).thenReturn(true);
            when(reranker.rerank(anyString(), anyList())).thenThrow(new ProviderException("rerank down", null));

            assertThatThrownBy(() -> service(false).search(query("rust", SearchMode.SEMANTIC, SearchScope.ITEMS, 10, true)))
                    .isInstanceOf(ProviderException.class);
        }

        @Test
        @DisplayName("slot liberi riempiti con la ricerca lessicale, senza duplicati")
        void lexicalBackfill() {
            lexicalIndex.rebuild(List.of(
                    new IndexedText(USER, "rust", null, "pasta with rust colored sauce", Items.NOW),
                    new IndexedText(USER, "cooking", null, "pasta recipes", Items.NOW)));

            List<SearchResult> results = service(true).search(query("pasta", SearchMode.SEMANTIC, SearchScope.ITEMS, 3, false));

            assertThat(results).extracting(SearchResult::itemId).containsExactly("rust", "garden", "cooking");
            assertThat(results.get(2).distance()).isNull();
        }

        @Test
        @DisplayName("il limit taglia i risultati semantici")
        void limit() {
            assertThat(service(true).search(query("rust", SearchMode.SEMANTIC, SearchScope.ITEMS, 1, false)))
                    .extracting(SearchResult::itemId).containsExactly("rust");
        }
    }

    @Test
    @DisplayName("testo per il reranker: titolo, sintesi e anteprima, al massimo 1000 caratteri")
    void rerankText() {
        assertThat(SearchService.rerankText(rust, "preview")).isEqualTo("Rust 2.0\nA new Rust release.\npreview");
        assertThat(SearchService.rerankText(rust, "p".repeat(2000))).hasSize(SearchService.RERANK_TEXT_LIMIT);
    }
}
