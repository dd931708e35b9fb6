package it.aw.readingqueue.service;

import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import it.aw.readingqueue.error.ValidationException;
import it.aw.readingqueue.model.Item;
import it.aw.readingqueue.model.SummaryData;
import it.aw.readingqueue.provider.CompletionProvider;
import it.aw.readingqueue.provider.StructuredOutputDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Stadio di sintesi: chiede all'LLM una sintesi di 1-2 frasi e un expiry score.
 * <p>
 * La risposta è decodificata contro lo schema {@code {summary, expiry_score}};
 * uno score fuori da [0, 1] viene riportato nell'intervallo, uno score mancante
 * o non numerico rende la risposta non valida.
 */
@Service
public class SummaryService {

    private static final Logger log = LoggerFactory.getLogger(SummaryService.class);

    static final String SYSTEM_PROMPT = """
            Your role is to extract key metadata from the scraped data. \
            Provide a 1-2 sentence summary and an expiry score between 0 and 1 \
            where 1 decays fastest (time-sensitive news) and 0 is evergreen content.""";

    static final JsonSchema SCHEMA = JsonSchema.builder()
            .name("SummaryData")
            .rootElement(JsonObjectSchema.builder()
                    .addStringProperty("summary", "1-2 sentence summary of the article")
                    .addNumberProperty("expiry_score", "How fast the article loses relevance, from 0 to 1")
                    .required("summary", "expiry_score")
                    .build())
            .build();

    private final CompletionProvider completionProvider;
    private final StructuredOutputDecoder decoder;
    private final int maxContentChars;

    public SummaryService(CompletionProvider completionProvider,
                          StructuredOutputDecoder decoder,
                          @Value("${app.llm.max-content-chars:40000}") int maxContentChars) {
        this.completionProvider = completionProvider;
        this.decoder = decoder;
        this.maxContentChars = maxContentChars;
    }

    public SummaryData summarise(Item item) {
        String raw = completionProvider.complete(SYSTEM_PROMPT, buildContext(item), SCHEMA);
        SummaryData data = decoder.decode(raw, SummaryData.class);

        if (data.summary() == null || data.summary().isBlank()) {
            throw new ValidationException("Sintesi vuota nella risposta del modello");
        }
        Double expiry = data.expiryScore();
        if (expiry == null || expiry.isNaN()) {
            throw new ValidationException("Expiry score mancante o non numerico nella risposta del modello");
        }
        double clamped = Math.max(0.0, Math.min(1.0, expiry));
        if (clamped != expiry) {
            log.warn("Expiry score {} fuori intervallo per item {}, riportato a {}", expiry, item.id(), clamped);
        }
        return new SummaryData(data.summary().strip(), clamped);
    }

    String buildContext(Item item) {
        StringBuilder sb = new StringBuilder();
        if (item.title() != null) sb.append("Title: ").append(item.title()).append('\n');
        if (item.sourceSite() != null) sb.append("Source: ").append(item.sourceSite()).append('\n');
        if (item.publicationDate() != null) sb.append("Published: ").append(item.publicationDate()).append('\n');
        sb.append("URL: ").append(item.canonicalUrl() != null ? item.canonicalUrl() : item.url()).append('\n');

        String content = item.contentMarkdown() != null ? item.contentMarkdown() : item.contentText();
        if (content != null) {
            if (content.length() > maxContentChars) {
                content = content.substring(0, maxContentChars);
            }
            sb.append("\nArticle Content:\n").append(content);
        }
        return sb.toString();
    }
}
