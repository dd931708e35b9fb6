package it.aw.readingqueue.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.TokenCountEstimator;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.HuggingFaceTokenCountEstimator;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import it.aw.readingqueue.provider.OnnxCrossEncoderScoringModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ResourceUtils;

import java.time.Duration;

/**
 * Configura i bean LangChain4j.
 *
 * EmbeddingModel: AllMiniLM-L6-v2 quantizzato in locale (default, senza API key)
 *                 oppure endpoint OpenAI-compatibile con {@code app.embedding.provider=openai}.
 * ChatModel:      endpoint OpenAI-compatibile, usato per sintesi ed etichette dei cluster.
 * TokenCountEstimator: tokenizer WordPiece di BERT, lo stesso vocabolario del modello locale.
 * EmbeddingStore: InMemoryEmbeddingStore, ricostruito da DuckDB all'avvio.
 * ScoringModel:   cross-encoder ONNX locale, creato solo se è configurato il path del modello.
 *
 * Il timeout dei client HTTP è allineato a {@code app.provider.timeout}: la chiamata
 * viene comunque interrotta da ProviderCalls allo scadere.
 */
@Configuration
public class LangChain4jConfig {

    private static final Logger log = LoggerFactory.getLogger(LangChain4jConfig.class);

    @Value("${app.provider.timeout:PT30S}")
    private Duration timeout;

    @Bean
    public EmbeddingModel embeddingModel(@Value("${app.embedding.provider:local}") String provider,
                                         @Value("${app.embedding.model:all-minilm-l6-v2-q}") String model,
                                         @Value("${app.embedding.base-url:https://api.openai.com/v1}") String baseUrl,
                                         @Value("${app.embedding.api-key:}") String apiKey) {
        if ("openai".equalsIgnoreCase(provider)) {
            log.info("Inizializzazione EmbeddingModel: {} su {}", model, baseUrl);
            return OpenAiEmbeddingModel.builder()
                    .baseUrl(baseUrl)
                    .apiKey(apiKey)
                    .modelName(model)
                    .timeout(timeout)
                    .build();
        }
        log.info("Inizializzazione EmbeddingModel: AllMiniLmL6V2Quantized (locale)");
        return new AllMiniLmL6V2QuantizedEmbeddingModel();
    }

    @Bean
    public ChatModel chatModel(@Value("${app.llm.base-url:https://api.openai.com/v1}") String baseUrl,
                               @Value("${app.llm.api-key:not-configured}") String apiKey,
                               @Value("${app.llm.model:gpt-4o-mini}") String model,
                               @Value("${app.llm.temperature:0.2}") double temperature) {
        log.info("Inizializzazione ChatModel: {} su {}", model, baseUrl);
        return OpenAiChatModel.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .modelName(model)
                .temperature(temperature)
                .timeout(timeout)
                .build();
    }

    @Bean
    public TokenCountEstimator tokenCountEstimator() {
        return new HuggingFaceTokenCountEstimator();
    }

    @Bean
    public InMemoryEmbeddingStore<TextSegment> embeddingStore() {
        return new InMemoryEmbeddingStore<>();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnExpression("${app.rerank.enabled:true} and '${app.rerank.model-path:}' != ''")
    public OnnxCrossEncoderScoringModel scoringModel(@Value("${app.rerank.model-path}") String modelPath,
                                                     @Value("${app.rerank.tokenizer-path}") String tokenizerPath,
                                                     @Value("${app.rerank.max-length:512}") int maxLength)
            throws Exception {
        log.info("Inizializzazione ScoringModel: cross-encoder ONNX {}", modelPath);
        return new OnnxCrossEncoderScoringModel(
                ResourceUtils.getFile(modelPath).toPath(),
                ResourceUtils.getFile(tokenizerPath).toPath(),
                maxLength);
    }
}
