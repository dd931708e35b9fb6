package it.aw.readingqueue.provider;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import it.aw.readingqueue.error.ProviderException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@link EmbeddingProvider} sopra un {@link EmbeddingModel} LangChain4j
 * (AllMiniLM locale oppure endpoint OpenAI-compatibile, vedi LangChain4jConfig).
 */
@Component
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingModel embeddingModel;
    private final ProviderCalls calls;
    private final int maxInputTokens;
    private final String modelName;

    public LangChain4jEmbeddingProvider(EmbeddingModel embeddingModel,
                                        ProviderCalls calls,
                                        @Value("${app.embedding.max-input-tokens:256}") int maxInputTokens,
                                        @Value("${app.embedding.model:all-minilm-l6-v2-q}") String modelName) {
        this.embeddingModel = embeddingModel;
        this.calls = calls;
        this.maxInputTokens = maxInputTokens;
        this.modelName = modelName;
    }

    @Override
    public float[] embed(String text) {
        return calls.call("embedding", () -> embeddingModel.embed(text).content().vector());
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
        List<Embedding> embeddings = calls.call("embedding batch", () -> embeddingModel.embedAll(segments).content());
        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new ProviderException("embedding batch: attesi " + texts.size() + " vettori, ricevuti "
                    + (embeddings == null ? 0 : embeddings.size()), null);
        }
        return embeddings.stream().map(Embedding::vector).toList();
    }

    @Override
    public int maxInputTokens() {
        return maxInputTokens;
    }

    @Override
    public String modelName() {
        return modelName;
    }
}
