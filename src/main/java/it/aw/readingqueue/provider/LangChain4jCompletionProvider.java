package it.aw.readingqueue.provider;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.springframework.stereotype.Component;

/**
 * {@link CompletionProvider} sopra un {@link ChatModel} LangChain4j, con
 * response format JSON vincolato allo schema richiesto.
 */
@Component
public class LangChain4jCompletionProvider implements CompletionProvider {

    private final ChatModel chatModel;
    private final ProviderCalls calls;

    public LangChain4jCompletionProvider(ChatModel chatModel, ProviderCalls calls) {
        this.chatModel = chatModel;
        this.calls = calls;
    }

    @Override
    public String complete(String systemPrompt, String userPrompt, JsonSchema responseSchema) {
        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt))
                .parameters(ChatRequestParameters.builder()
                        .responseFormat(ResponseFormat.builder()
                                .type(ResponseFormatType.JSON)
                                .jsonSchema(responseSchema)
                                .build())
                        .build())
                .build();
        ChatResponse response = calls.call("completion " + responseSchema.name(), () -> chatModel.chat(request));
        return response.aiMessage().text();
    }
}
