package it.aw.readingqueue.service;

import it.aw.readingqueue.analysis.VectorMath;
import it.aw.readingqueue.error.ValidationException;
import it.aw.readingqueue.model.ChunkEmbedding;
import it.aw.readingqueue.model.ChunkingParams;
import it.aw.readingqueue.model.TextChunk;
import it.aw.readingqueue.model.Vectorization;
import it.aw.readingqueue.provider.EmbeddingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Trasforma il testo di un articolo in un embedding del documento intero più
 * un embedding per ogni chunk.
 * <p>
 * Convenzione: i vettori restano quelli del provider (non normalizzati) e ogni
 * confronto usa la similarità coseno. Se il testo supera il limite di token del
 * modello (contati con il tokenizer del chunker), l'embedding del documento è la
 * media dei chunk.
 * <p>
 * Nessun retry qui: gli errori del provider risalgono alla pipeline.
 */
@Service
public class Vectorizer {

    private static final Logger log = LoggerFactory.getLogger(Vectorizer.class);

    private final EmbeddingProvider embeddingProvider;
    private final TextChunker chunker;
    private final ChunkingParams chunkingParams;

    @Autowired
    public Vectorizer(EmbeddingProvider embeddingProvider,
                      TextChunker chunker,
                      @Value("${app.embedding.chunk-tokens:200}") int chunkTokens,
                      @Value("${app.embedding.overlap-ratio:0.15}") double overlapRatio) {
        this(embeddingProvider, chunker, new ChunkingParams(chunkTokens, overlapRatio));
    }

    Vectorizer(EmbeddingProvider embeddingProvider, TextChunker chunker, ChunkingParams chunkingParams) {
        this.embeddingProvider = embeddingProvider;
        this.chunker = chunker;
        this.chunkingParams = chunkingParams;
    }

    public Vectorization vectorize(String text) {
        return vectorize(text, embeddingProvider.maxInputTokens());
    }

    public Vectorization vectorize(String text, int maxInputTokens) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Testo vuoto: niente da vettorizzare");
        }
        ChunkingParams params = chunkingParams.fitTo(maxInputTokens);
        List<TextChunk> chunks = chunker.chunk(text, params);
        List<float[]> chunkVectors = embeddingProvider.embedAll(chunks.stream().map(TextChunk::text).toList());

        List<ChunkEmbedding> chunkEmbeddings = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            chunkEmbeddings.add(new ChunkEmbedding(chunks.get(i), chunkVectors.get(i)));
        }

        int tokenCount = chunker.countTokens(text);
        boolean pooled = tokenCount > maxInputTokens;
        float[] full = pooled ? VectorMath.mean(chunkVectors) : embeddingProvider.embed(text);

        log.debug("Vettorizzati {} token: {} chunk da {} token, pooled={}",
                tokenCount, chunks.size(), params.chunkTokens(), pooled);
        return new Vectorization(full, chunkEmbeddings, pooled, tokenCount);
    }

    /** Embedding di una query, con lo stesso modello usato per gli item. */
    public float[] embedQuery(String query) {
        return embeddingProvider.embed(query);
    }
}
