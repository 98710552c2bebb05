package it.aw.editalanalysis.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.editalanalysis.llm.LanguageModelService;
import it.aw.editalanalysis.model.AnalysisRequest;
import it.aw.editalanalysis.model.PipelineFault;
import it.aw.editalanalysis.model.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Il modello riceve target e riassunto, mai il contenuto grezzo.
 * Con {@code forceMatch} il risultato è sempre true.
 */
class AnalyzeTargetStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeTargetStage.class);

    static final String NAME = "analyze_target";

    private final LanguageModelService model;
    private final ObjectMapper objectMapper;

    AnalyzeTargetStage(LanguageModelService model, ObjectMapper objectMapper) {
        this.model = model;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<PipelineFault> execute(PipelineState state, AnalysisRequest request) throws JsonProcessingException {
        String raw = model.complete(AnalysisPrompts.TARGET_SYSTEM,
                AnalysisPrompts.targetUser(request.target(), state.getSummary(),
                        state.metadataValue("object"),
                        state.metadataValue("specifications"),
                        state.metadataValue("quantities")),
                AnalysisPrompts.TARGET_SCHEMA);

        JsonNode response = objectMapper.readTree(raw);
        JsonNode relevant = response.get("is_relevant");
        if (relevant == null || !relevant.isBoolean()) {
            throw new IllegalStateException("risposta senza is_relevant booleano");
        }

        boolean match = relevant.booleanValue();
        log.info("Target '{}': is_relevant={}, confidence={}, termini={}",
                request.target(), match, response.path("confidence").asDouble(0.0), response.path("matching_terms"));

        if (request.forceMatch() && !match) {
            log.info("Target '{}': forceMatch attivo, target_match forzato a true", request.target());
        }
        state.setTargetMatch(match || request.forceMatch());
        return Optional.empty();
    }
}
