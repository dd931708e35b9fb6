package it.aw.readingqueue.service;

import it.aw.readingqueue.error.ProviderException;
import it.aw.readingqueue.error.ValidationException;
import it.aw.readingqueue.model.ChunkingParams;
import it.aw.readingqueue.model.Vectorization;
import it.aw.readingqueue.provider.EmbeddingProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VectorizerTest {

    @Mock
    private EmbeddingProvider provider;

    private Vectorizer vectorizer;

    @BeforeEach
    void setUp() {
        vectorizer = new Vectorizer(provider, new TextChunker(new CharTokenEstimator()), new ChunkingParams(10, 0.2));
    }

    /** Ogni chunk riceve un vettore diverso: [indice, 1]. */
    private void stubChunkVectors() {
        when(provider.embedAll(anyList())).thenAnswer(inv -> {
            List<String> texts = inv.getArgument(0);
            return java.util.stream.IntStream.range(0, texts.size())
                    .mapToObj(i -> new float[]{i, 1f})
                    .toList();
        });
    }

    @Test
    @DisplayName("testo entro il limite del modello: embedding diretto del testo intero")
    void directEmbedding() {
        stubChunkVectors();
        when(provider.embed("testo breve da vettorizzare")).thenReturn(new float[]{9f, 9f});

        Vectorization v = vectorizer.vectorize("testo breve da vettorizzare", 512);

        assertThat(v.pooled()).isFalse();
        assertThat(v.fullEmbedding()).containsExactly(9f, 9f);
        assertThat(v.chunks()).hasSize(1);
        assertThat(v.tokenCount()).isEqualTo(7);
    }

    @Test
    @DisplayName("testo oltre il limite: embedding del documento = media dei chunk")
    void pooledEmbedding() {
        stubChunkVectors();
        String text = "alpha beta gamma delta epsilon zeta eta theta iota kappa lambda mu nu xi omicron pi rho";

        Vectorization v = vectorizer.vectorize(text, 10);

        assertThat(v.pooled()).isTrue();
        assertThat(v.chunks().size()).isGreaterThan(1);
        float expectedX = (v.chunks().size() - 1) / 2f;
        assertThat(v.fullEmbedding()).containsExactly(expectedX, 1f);
        verify(provider, never()).embed(anyString());
    }

    @Test
    @DisplayName("la finestra di chunking si adatta a un modello con limite inferiore")
    void chunkSizeFitsModel() {
        stubChunkVectors();
        String text = "parola ".repeat(30).strip();

        Vectorization v = vectorizer.vectorize(text, 8);

        assertThat(v.chunks()).allSatisfy(c -> assertThat(c.chunk().text().length()).isLessThanOrEqualTo(32));
    }

    @Test
    @DisplayName("testo vuoto: errore di validazione senza chiamare il provider")
    void blankText() {
        assertThatThrownBy(() -> vectorizer.vectorize("  ", 512)).isInstanceOf(ValidationException.class);
        verifyNoInteractions(provider);
    }

    @Test
    @DisplayName("gli errori del provider risalgono senza retry")
    void providerErrorsPropagate() {
        when(provider.embedAll(anyList())).thenThrow(new ProviderException("down", null, true));
        assertThatThrownBy(() -> vectorizer.vectorize("qualcosa da dire", 512)).isInstanceOf(ProviderException.class);
        verify(provider).embedAll(anyList());
    }
}
