package it.aw.editalanalysis.llm;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Implementazione su {@link ChatModel} di LangChain4j.
 * Con uno schema la richiesta usa il response format JSON strutturato.
 */
@Service
public class LangChain4jLanguageModelService implements LanguageModelService {

    private static final Logger log = LoggerFactory.getLogger(LangChain4jLanguageModelService.class);

    private final ChatModel chatModel;

    public LangChain4jLanguageModelService(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public String complete(String systemPrompt, String userPrompt, JsonSchema responseSchema) {
        ChatRequest.Builder request = ChatRequest.builder()
                .messages(List.of(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt)));
        if (responseSchema != null) {
            request.responseFormat(ResponseFormat.builder()
                    .type(ResponseFormatType.JSON)
                    .jsonSchema(responseSchema)
                    .build());
        }

        String schemaName = responseSchema != null ? responseSchema.name() : "text";
        log.debug("Chiamata al modello [{}]: prompt di {} caratteri", schemaName, userPrompt.length());
        long start = System.currentTimeMillis();

        ChatResponse response = chatModel.chat(request.build());
        String text = response.aiMessage() != null ? response.aiMessage().text() : null;
        if (text == null) {
            throw new IllegalStateException("Risposta vuota dal modello [" + schemaName + "]");
        }

        log.info("Risposta del modello [{}]: {} caratteri in {} ms",
                schemaName, text.length(), System.currentTimeMillis() - start);
        return text;
    }
}
