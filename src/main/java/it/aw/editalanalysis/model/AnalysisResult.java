package it.aw.editalanalysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Record di output di un'analisi, serializzato in snake_case.
 * Il contenuto estratto del bundle non ne fa mai parte.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnalysisResult(
        String              bidNumber,
        String              city,
        Map<String, String> metadata,
        boolean             targetMatch,
        ThresholdStatus     thresholdMatch,
        @JsonProperty("is_relevant")
        boolean             isRelevant,
        String              summary,
        String              justification
) {

    /** Chiavi del metadata riportate nel blocco {@code metadata} dell'output. */
    public static final List<String> OUTPUT_METADATA_KEYS = List.of(
            "title", "object", "quantities", "specifications", "deadlines",
            "values", "phone", "website", "email");

    public static AnalysisResult from(PipelineState state) {
        Map<String, String> metadata = new LinkedHashMap<>();
        for (String key : OUTPUT_METADATA_KEYS) {
            metadata.put(key, state.metadataValue(key));
        }
        return new AnalysisResult(
                state.getBidNumber(),
                state.getCity(),
                metadata,
                state.isTargetMatch(),
                state.getThresholdMatch(),
                state.isRelevant(),
                state.getSummary(),
                state.getJustification());
    }
}
