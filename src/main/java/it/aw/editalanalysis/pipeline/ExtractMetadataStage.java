package it.aw.editalanalysis.pipeline;

import it.aw.editalanalysis.ingest.MetadataReader;
import it.aw.editalanalysis.model.AnalysisRequest;
import it.aw.editalanalysis.model.PipelineFault;
import it.aw.editalanalysis.model.PipelineState;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/** Legge metadata.json; un file assente non è un errore. */
class ExtractMetadataStage implements PipelineStage {

    static final String NAME = "extract_metadata";

    private final MetadataReader metadataReader;

    ExtractMetadataStage(MetadataReader metadataReader) {
        this.metadataReader = metadataReader;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<PipelineFault> execute(PipelineState state, AnalysisRequest request) {
        Map<String, String> metadata = metadataReader.read(Path.of(request.bundlePath()));
        state.getMetadata().putAll(metadata);
        state.setBidNumber(metadata.getOrDefault(MetadataReader.BID_NUMBER, PipelineState.UNKNOWN_BID_NUMBER));
        state.setCity(metadata.getOrDefault(MetadataReader.CITY, ""));
        return Optional.empty();
    }
}
