package it.aw.editalanalysis.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.editalanalysis.ingest.DirectoryIngestor;
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
 * Macchina a stati dell'analisi di un edital.
 * <p>
 * Sequenza fissa:
 * <ol>
 *   <li>extract_metadata</li>
 *   <li>extract_content</li>
 *   <li>generate_summary</li>
 *   <li>analyze_target</li>
 *   <li>check_threshold</li>
 *   <li>generate_justification</li>
 * </ol>
 * Dopo il primo errore gli stage successivi vengono saltati e lo stato resta terminale.
 * L'interruzione del thread viene controllata a ogni confine di stage.
 * Ogni run crea il proprio {@link PipelineState}: l'istanza è riusabile e condivisibile tra thread.
 */
public class AnalysisPipeline {

    private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);

    private final List<PipelineStage> stages;

    public AnalysisPipeline(List<PipelineStage> stages) {
        this.stages = List.copyOf(stages);
    }

    public static AnalysisPipeline standard(MetadataReader metadataReader,
                                            DirectoryIngestor ingestor,
                                            LanguageModelService model,
                                            ChunkSplitter splitter,
                                            QuantityReconciler reconciler,
                                            ObjectMapper objectMapper) {
        return new AnalysisPipeline(List.of(
                new ExtractMetadataStage(metadataReader),
                new ExtractContentStage(ingestor),
                new GenerateSummaryStage(model, objectMapper),
                new AnalyzeTargetStage(model, objectMapper),
                new CheckThresholdStage(model, splitter, reconciler),
                new GenerateJustificationStage(model)));
    }

    public PipelineState run(AnalysisRequest request) {
        PipelineState state = new PipelineState(request.bundlePath());
        log.info("Analisi avviata: bundle={}, target='{}', threshold={}, forceMatch={}",
                request.bundlePath(), request.target(), request.threshold(), request.forceMatch());

        for (PipelineStage stage : stages) {
            if (state.hasError()) {
                log.info("Stage {} saltato: errore precedente ({})", stage.name(), state.getErrorMessage());
                continue;
            }
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Analisi interrotta prima di {}", stage.name());
                state.markFailed(PipelineFault.of("Análise interrompida antes de " + stage.name()));
                continue;
            }
            runStage(stage, state, request);
        }

        log.info("Analisi conclusa: bundle={}, is_relevant={}, has_error={}",
                request.bundlePath(), state.isRelevant(), state.hasError());
        return state;
    }

    private void runStage(PipelineStage stage, PipelineState state, AnalysisRequest request) {
        log.debug("Stage {} avviato", stage.name());
        try {
            Optional<PipelineFault> fault = stage.execute(state, request);
            if (fault.isPresent()) {
                log.warn("Stage {} terminato con esito negativo: {}", stage.name(), fault.get().errorMessage());
                state.markFailed(fault.get());
            }
        } catch (Exception e) {
            log.error("Stage {} fallito", stage.name(), e);
            state.markFailed(PipelineFault.of("Erro em " + stage.name() + ": " + e.getMessage()));
        }
    }

    public List<String> stageNames() {
        return stages.stream().map(PipelineStage::name).toList();
    }
}
