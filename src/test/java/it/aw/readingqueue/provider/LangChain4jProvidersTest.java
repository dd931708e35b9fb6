package it.aw.readingqueue.provider;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import it.aw.readingqueue.error.ProviderException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class LangChain4jProvidersTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final ProviderCalls calls = new ProviderCalls(executor, Duration.ofSeconds(5));

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("embedding")
    class Embeddings {

        private final EmbeddingModel model = mock(EmbeddingModel.class);
        private final LangChain4jEmbeddingProvider provider =
                new LangChain4jEmbeddingProvider(model, calls, 256, "all-minilm-l6-v2-q");

        @Test
        @DisplayName("batch: un vettore per testo, nell'ordine")
        void embedAll() {
            when(model.embedAll(anyList())).thenReturn(Response.from(List.of(
                    Embedding.from(new float[]{1f, 0f}), Embedding.from(new float[]{0f, 1f}))));

            List<float[]> vectors = provider.embedAll(List.of("uno", "due"));

            assertThat(vectors).containsExactly(new float[]{1f, 0f}, new float[]{0f, 1f});
        }

        @Test
        @DisplayName("lista vuota: nessuna chiamata al modello")
        void emptyBatch() {
            assertThat(provider.embedAll(List.of())).isEmpty();
            verifyNoInteractions(model);
        }

        @Test
        @DisplayName("numero di vettori diverso dai testi: errore del provider")
        void countMismatch() {
            when(model.embedAll(anyList())).thenReturn(Response.from(List.of(Embedding.from(new float[]{1f}))));

            assertThatThrownBy(() -> provider.embedAll(List.of("uno", "due")))
                    .isInstanceOf(ProviderException.class)
                    .hasMessageContaining("attesi 2");
        }
    }

    @Nested
    @DisplayName("rerank")
    class Rerank {

        private final ScoringModel model = mock(ScoringModel.class);

        @Test
        @DisplayName("senza scoring model il provider non è disponibile")
        void unavailable() {
            LangChain4jRerankProvider provider = new LangChain4jRerankProvider((ScoringModel) null, calls);

            assertThat(provider.isAvailable()).isFalse();
            assertThatThrownBy(() -> provider.rerank("q", List.of("a"))).isInstanceOf(ProviderException.class);
        }

        @Test
        @DisplayName("candidati oltre il batch massimo: più chiamate, punteggi nell'ordine")
        void batches() {
            int n = LangChain4jRerankProvider.MAX_BATCH_SIZE + 20;
            List<String> candidates = IntStream.range(0, n).mapToObj(i -> "doc " + i).toList();
            when(model.scoreAll(anyList(), eq("query"))).thenAnswer(inv -> {
                List<TextSegment> batch = inv.getArgument(0);
                return Response.from(batch.stream()
                        .map(s -> Double.parseDouble(s.text().substring(4)) / 1000.0)
                        .toList());
            });
            LangChain4jRerankProvider provider = new LangChain4jRerankProvider(model, calls);

            List<Double> scores = provider.rerank("query", candidates);

            assertThat(scores).hasSize(n);
            assertThat(scores.get(0)).isEqualTo(0.0);
            assertThat(scores.get(n - 1)).isEqualTo((n - 1) / 1000.0);
            verify(model, times(2)).scoreAll(anyList(), eq("query"));
        }

        @Test
        @DisplayName("punteggi mancanti: errore del provider")
        void mismatch() {
            when(model.scoreAll(anyList(), any())).thenReturn(Response.from(Collections.<Double>emptyList()));
            LangChain4jRerankProvider provider = new LangChain4jRerankProvider(model, calls);

            assertThatThrownBy(() -> provider.rerank("q", List.of("a", "b"))).isInstanceOf(ProviderException.class);
        }
    }

    @Test
    @DisplayName("completion: risposta JSON vincolata allo schema")
    void completionUsesJsonSchema() {
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("{\"label\":\"Rust\"}"))
                .build());
        JsonSchema schema = JsonSchema.builder()
                .name("ClusterLabel")
                .rootElement(JsonObjectSchema.builder().addStringProperty("label").required("label").build())
                .build();

        String raw = new LangChain4jCompletionProvider(chatModel, calls).complete("sistema", "utente", schema);

        assertThat(raw).isEqualTo("{\"label\":\"Rust\"}");
        ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(request.capture());
        assertThat(request.getValue().messages()).hasSize(2);
        assertThat(request.getValue().parameters().responseFormat().type()).isEqualTo(ResponseFormatType.JSON);
        assertThat(request.getValue().parameters().responseFormat().jsonSchema()).isSameAs(schema);
    }
}
