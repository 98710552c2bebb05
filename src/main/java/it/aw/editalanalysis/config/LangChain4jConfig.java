package it.aw.editalanalysis.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configura il modello chat LangChain4j usato dal Language Model Service.
 *
 * ChatModel: OpenAI (modello, temperatura e timeout da application.properties).
 *            La chiave API arriva da OPENAI_API_KEY; senza chiave il bean viene
 *            comunque creato ma ogni chiamata fallisce, e la pipeline registra
 *            l'errore nello stage che l'ha invocata.
 */
@Configuration
public class LangChain4jConfig {

    private static final Logger log = LoggerFactory.getLogger(LangChain4jConfig.class);

    @Value("${llm.openai.api-key:}")
    private String apiKey;

    @Value("${llm.openai.model:gpt-4o}")
    private String modelName;

    @Value("${llm.openai.temperature:0.7}")
    private double temperature;

    @Value("${llm.openai.timeout-seconds:120}")
    private long timeoutSeconds;

    @Value("${llm.openai.max-retries:2}")
    private int maxRetries;

    @Bean
    public ChatModel chatModel() {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("ChatModel: llm.openai.api-key non impostata, le chiamate al modello falliranno");
        }
        log.info("Inizializzazione ChatModel: OpenAI {} (temperature={}, timeout={}s)",
                modelName, temperature, timeoutSeconds);
        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(temperature)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .maxRetries(maxRetries)
                .build();
    }
}
