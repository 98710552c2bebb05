package it.aw.editalanalysis.service;

import it.aw.editalanalysis.model.AnalysisRecord;
import it.aw.editalanalysis.model.AnalysisRequest;
import it.aw.editalanalysis.model.AnalysisResult;
import it.aw.editalanalysis.model.PipelineState;
import it.aw.editalanalysis.pipeline.AnalysisPipeline;
import it.aw.editalanalysis.registry.AnalysisRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Esegue un'analisi completa.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Run della macchina a stati sul bundle</li>
 *   <li>Registrazione dell'esito nel registry DuckDB</li>
 *   <li>Report JSON su disco, se la richiesta indica un file di output</li>
 * </ol>
 * Un errore della pipeline non è un'eccezione: l'analisi viene registrata con {@code hasError=true}.
 * Il file di output viene validato prima della run: un percorso non ammesso produce
 * {@link IllegalArgumentException} senza eseguire né registrare nulla.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final AnalysisPipeline pipeline;
    private final AnalysisRegistry registry;
    private final JsonReportWriter reportWriter;

    public AnalysisService(AnalysisPipeline pipeline, AnalysisRegistry registry, JsonReportWriter reportWriter) {
        this.pipeline = pipeline;
        this.registry = registry;
        this.reportWriter = reportWriter;
    }

    public AnalysisRecord analyze(AnalysisRequest request) throws IOException {
        boolean writeReport = request.outputFile() != null && !request.outputFile().isBlank();
        if (writeReport) {
            reportWriter.resolve(request.outputFile());
        }

        String analysisId = UUID.randomUUID().toString();
        log.info("Inizio analisi {}: bundle={}, target='{}', threshold={}",
                analysisId, request.bundlePath(), request.target(), request.threshold());

        // [1] pipeline
        PipelineState state = pipeline.run(request);
        AnalysisResult result = AnalysisResult.from(state);

        // [2] registry
        AnalysisRecord record = new AnalysisRecord(
                analysisId,
                request.bundlePath(),
                request.target(),
                request.threshold(),
                request.forceMatch(),
                LocalDateTime.now(),
                result,
                state.hasError(),
                state.getErrorMessage());
        registry.register(record);

        // [3] report
        if (writeReport) {
            reportWriter.write(result, request.outputFile());
        }

        log.info("Analisi {} completata: is_relevant={}, has_error={}",
                analysisId, result.isRelevant(), state.hasError());
        return record;
    }
}
