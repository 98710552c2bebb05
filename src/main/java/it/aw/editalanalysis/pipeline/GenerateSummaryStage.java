package it.aw.editalanalysis.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.editalanalysis.ingest.MetadataReader;
import it.aw.editalanalysis.llm.LanguageModelService;
import it.aw.editalanalysis.model.AnalysisRequest;
import it.aw.editalanalysis.model.PipelineFault;
import it.aw.editalanalysis.model.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Una chiamata al modello con metadata e contenuto completo.
 * Oltre al riassunto arricchisce il metadata con contatti e campi descrittivi.
 */
class GenerateSummaryStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(GenerateSummaryStage.class);

    static final String NAME = "generate_summary";
    static final String UNKNOWN_CITY = "Não foi possível determinar";

    /** Campi della risposta copiati nel metadata quando non vuoti. */
    static final List<String> ENRICHED_KEYS = List.of(
            "phone", "website", "email", "title", "object",
            "quantities", "specifications", "deadlines", "values");

    private final LanguageModelService model;
    private final ObjectMapper objectMapper;

    GenerateSummaryStage(LanguageModelService model, ObjectMapper objectMapper) {
        this.model = model;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<PipelineFault> execute(PipelineState state, AnalysisRequest request) throws JsonProcessingException {
        String metadataJson = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(state.getMetadata());
        String raw = model.complete(AnalysisPrompts.SUMMARY_SYSTEM,
                AnalysisPrompts.summaryUser(request.target(), metadataJson, state.getContent()),
                AnalysisPrompts.SUMMARY_SCHEMA);

        JsonNode response = objectMapper.readTree(raw);
        if (!response.isObject()) {
            throw new IllegalStateException("risposta di riassunto non è un oggetto JSON");
        }

        state.setSummary(text(response, "summary"));

        String city = text(response, "city");
        if (city.isEmpty()) city = state.metadataValue(MetadataReader.CITY).strip();
        state.setCity(city.isEmpty() ? UNKNOWN_CITY : city);

        int enriched = 0;
        for (String key : ENRICHED_KEYS) {
            String value = text(response, key);
            if (!value.isEmpty()) {
                state.getMetadata().put(key, value);
                enriched++;
            }
        }
        log.info("Riassunto generato: {} caratteri, città={}, {} campi di metadata arricchiti",
                state.getSummary().length(), state.getCity(), enriched);
        return Optional.empty();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText().strip() : "";
    }
}
