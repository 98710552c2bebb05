package it.aw.editalanalysis.pipeline;

import it.aw.editalanalysis.ingest.DirectoryIngestor;
import it.aw.editalanalysis.ingest.IngestionResult;
import it.aw.editalanalysis.model.AnalysisRequest;
import it.aw.editalanalysis.model.PipelineFault;
import it.aw.editalanalysis.model.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Ingestione del bundle. Documento troppo grande e contenuto insufficiente sono esiti
 * di dominio e portano direttamente allo stato terminale, ciascuno con la propria giustificazione.
 */
class ExtractContentStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(ExtractContentStage.class);

    static final String NAME = "extract_content";

    private final DirectoryIngestor ingestor;

    ExtractContentStage(DirectoryIngestor ingestor) {
        this.ingestor = ingestor;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<PipelineFault> execute(PipelineState state, AnalysisRequest request) throws IOException {
        IngestionResult result;
        try {
            result = ingestor.ingest(Path.of(request.bundlePath()));
        } catch (FileNotFoundException e) {
            return Optional.of(new PipelineFault(e.getMessage(), "Erro ao processar edital: " + e.getMessage()));
        }

        if (result instanceof IngestionResult.DocumentTooLarge) {
            IngestionResult.DocumentTooLarge tooLarge = (IngestionResult.DocumentTooLarge) result;
            return Optional.of(PipelineFault.of(tooLarge.message()));
        }
        if (result instanceof IngestionResult.InsufficientContent) {
            IngestionResult.InsufficientContent insufficient = (IngestionResult.InsufficientContent) result;
            return Optional.of(new PipelineFault(insufficient.message(),
                    "Conteúdo insuficiente para análise: " + insufficient.message()
                            + " Por segurança, o edital foi marcado como não relevante."));
        }

        String content = ((IngestionResult.Success) result).text();
        state.setContent(content);
        log.info("Contenuto estratto: {} caratteri", content.length());
        return Optional.empty();
    }
}
