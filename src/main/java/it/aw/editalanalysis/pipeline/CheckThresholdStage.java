package it.aw.editalanalysis.pipeline;

import it.aw.editalanalysis.llm.LanguageModelService;
import it.aw.editalanalysis.model.AnalysisRequest;
import it.aw.editalanalysis.model.PipelineFault;
import it.aw.editalanalysis.model.PipelineState;
import it.aw.editalanalysis.model.QuantityEstimate;
import it.aw.editalanalysis.model.ReconciledQuantity;
import it.aw.editalanalysis.model.TextChunk;
import it.aw.editalanalysis.model.ThresholdStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Confronto tra quantità e threshold.
 * <p>
 * threshold == 0 e target non corrispondente si risolvono senza chiamate al modello.
 * Altrimenti una stima per chunk, poi riconciliazione sul massimo.
 */
class CheckThresholdStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(CheckThresholdStage.class);

    static final String NAME = "check_threshold";
    static final String QUANTITIES_KEY = "quantities";

    private final LanguageModelService model;
    private final ChunkSplitter splitter;
    private final QuantityReconciler reconciler;

    CheckThresholdStage(LanguageModelService model, ChunkSplitter splitter, QuantityReconciler reconciler) {
        this.model = model;
        this.splitter = splitter;
        this.reconciler = reconciler;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<PipelineFault> execute(PipelineState state, AnalysisRequest request) {
        int threshold = request.threshold();
        if (threshold == 0 || !state.isTargetMatch()) {
            ReconciledQuantity shortCircuit = reconciler.reconcile(List.of(), threshold, state.isTargetMatch());
            state.setThresholdMatch(shortCircuit.thresholdStatus());
            return Optional.empty();
        }

        List<TextChunk> chunks = splitter.split(state.getContent());
        List<QuantityEstimate> estimates = new ArrayList<>(chunks.size());
        for (TextChunk chunk : chunks) {
            String raw = model.complete(AnalysisPrompts.QUANTITY_SYSTEM,
                    AnalysisPrompts.quantityUser(request.target(), threshold,
                            chunk.index() + 1, chunks.size(), chunk.text()),
                    AnalysisPrompts.QUANTITY_SCHEMA);
            Optional<QuantityEstimate> estimate = reconciler.parseEstimate(raw);
            if (estimate.isPresent()) {
                estimates.add(estimate.get());
            } else {
                log.warn("Chunk {}/{}: stima non valida, esclusa dalla riconciliazione", chunk.index() + 1, chunks.size());
            }
        }

        ReconciledQuantity reconciled = reconciler.reconcile(estimates, threshold, true);
        state.setThresholdMatch(reconciled.thresholdStatus());
        state.getMetadata().put(QUANTITIES_KEY, quantityNote(reconciled, chunks.size()));
        return Optional.empty();
    }

    static String quantityNote(ReconciledQuantity reconciled, int chunkCount) {
        if (reconciled.thresholdStatus() == ThresholdStatus.INCONCLUSIVE) {
            if (reconciled.validEstimates() == 0) {
                return "Erro ao processar quantidades: nenhuma resposta válida em " + chunkCount + " trecho(s)";
            }
            return "Erro ao processar quantidades: quantidade não identificada no edital";
        }
        return reconciled.totalQuantity() + " " + reconciled.unit() + " - " + reconciled.explanation();
    }
}
