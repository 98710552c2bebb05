package it.aw.editalanalysis.pipeline;

import it.aw.editalanalysis.llm.LanguageModelService;
import it.aw.editalanalysis.model.AnalysisRequest;
import it.aw.editalanalysis.model.PipelineFault;
import it.aw.editalanalysis.model.PipelineState;
import it.aw.editalanalysis.model.ThresholdStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Giustificazione testuale e calcolo finale di is_relevant:
 * {@code targetMatch && (threshold == 0 || thresholdMatch == TRUE)}.
 */
class GenerateJustificationStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(GenerateJustificationStage.class);

    static final String NAME = "generate_justification";

    private final LanguageModelService model;

    GenerateJustificationStage(LanguageModelService model) {
        this.model = model;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<PipelineFault> execute(PipelineState state, AnalysisRequest request) {
        String text = model.complete(AnalysisPrompts.JUSTIFICATION_SYSTEM,
                AnalysisPrompts.justificationUser(request.target(), state.isTargetMatch(),
                        state.getThresholdMatch().value(), request.threshold(), state.getSummary()),
                null);

        boolean relevant = isRelevant(state.isTargetMatch(), request.threshold(), state.getThresholdMatch());
        state.setRelevant(relevant);

        if (text == null || text.isBlank()) {
            log.warn("Giustificazione vuota dal modello, uso il testo di fallback");
            text = fallback(state, request);
        }
        state.setJustification(text.strip());
        log.info("Esito: is_relevant={} (target_match={}, threshold_match={}, threshold={})",
                relevant, state.isTargetMatch(), state.getThresholdMatch(), request.threshold());
        return Optional.empty();
    }

    static boolean isRelevant(boolean targetMatch, int threshold, ThresholdStatus thresholdMatch) {
        return targetMatch && (threshold == 0 || thresholdMatch == ThresholdStatus.TRUE);
    }

    static String fallback(PipelineState state, AnalysisRequest request) {
        String target = request.target();
        if (!state.isTargetMatch()) {
            return "O edital não apresenta relação com o target '" + target + "'.";
        }
        if (state.isRelevant()) {
            return request.threshold() == 0
                    ? "O edital é relevante para o target '" + target + "'."
                    : "O edital é relevante para o target '" + target + "' e atende ao mínimo de "
                            + request.threshold() + " (" + state.metadataValue(CheckThresholdStage.QUANTITIES_KEY) + ").";
        }
        if (state.getThresholdMatch() == ThresholdStatus.INCONCLUSIVE) {
            return "O edital é relacionado ao target '" + target + "', mas não foi possível determinar a quantidade "
                    + "para compará-la ao mínimo de " + request.threshold() + ".";
        }
        return "O edital é relacionado ao target '" + target + "', mas a quantidade identificada ("
                + state.metadataValue(CheckThresholdStage.QUANTITIES_KEY) + ") é inferior ao mínimo de "
                + request.threshold() + ".";
    }
}
