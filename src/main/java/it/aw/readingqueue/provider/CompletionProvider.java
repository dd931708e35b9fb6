package it.aw.readingqueue.provider;

import dev.langchain4j.model.chat.request.json.JsonSchema;

/**
 * Completamento LLM con output strutturato.
 * Restituisce il JSON grezzo prodotto dal modello: la decodifica tipizzata e la
 * validazione spettano a {@link StructuredOutputDecoder}.
 */
public interface CompletionProvider {

    String complete(String systemPrompt, String userPrompt, JsonSchema responseSchema);
}
