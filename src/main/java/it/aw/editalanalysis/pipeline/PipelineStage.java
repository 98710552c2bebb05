package it.aw.editalanalysis.pipeline;

import it.aw.editalanalysis.model.AnalysisRequest;
import it.aw.editalanalysis.model.PipelineFault;
import it.aw.editalanalysis.model.PipelineState;

import java.util.Optional;

/**
 * Uno stato della pipeline di analisi.
 * <p>
 * Un esito di dominio negativo si restituisce come {@link PipelineFault}; qualunque eccezione
 * viene gestita da {@link AnalysisPipeline}, unico punto in cui si catturano gli errori non classificati.
 */
public interface PipelineStage {

    String name();

    Optional<PipelineFault> execute(PipelineState state, AnalysisRequest request) throws Exception;
}
