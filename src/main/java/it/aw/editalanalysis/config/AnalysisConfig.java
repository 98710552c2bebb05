package it.aw.editalanalysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.editalanalysis.ingest.DirectoryIngestor;
import it.aw.editalanalysis.ingest.EncodingDecoder;
import it.aw.editalanalysis.ingest.FormatExtractor;
import it.aw.editalanalysis.ingest.MetadataReader;
import it.aw.editalanalysis.llm.LanguageModelService;
import it.aw.editalanalysis.model.ChunkingParams;
import it.aw.editalanalysis.pipeline.AnalysisPipeline;
import it.aw.editalanalysis.pipeline.ChunkSplitter;
import it.aw.editalanalysis.pipeline.QuantityReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Costruisce {@link AnalysisSettings} a partire da application.properties e,
 * da questi, i componenti di ingestione e la pipeline di analisi.
 * Tutti i valori hanno un default: la sezione {@code analysis.*} è opzionale.
 */
@Configuration
public class AnalysisConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalysisConfig.class);

    @Bean
    public AnalysisSettings analysisSettings(
            @Value("${analysis.max-chars:200000}")          int maxChars,
            @Value("${analysis.zip.max-chars:50000}")       int zipMaxChars,
            @Value("${analysis.zip.max-depth:3}")           int zipMaxDepth,
            @Value("${analysis.pdf.max-pages:20}")          int pdfMaxPages,
            @Value("${analysis.pdf.min-page-chars:50}")     int pdfMinPageChars,
            @Value("${analysis.chunk.size:15000}")          int chunkSize,
            @Value("${analysis.chunk.overlap:1000}")        int chunkOverlap) {

        AnalysisSettings settings = new AnalysisSettings(maxChars, zipMaxChars, zipMaxDepth,
                pdfMaxPages, pdfMinPageChars, new ChunkingParams(chunkSize, chunkOverlap));
        log.info("AnalysisSettings: maxChars={}, zipMaxChars={}, zipMaxDepth={}, pdfMaxPages={}, chunk={}/{}",
                maxChars, zipMaxChars, zipMaxDepth, pdfMaxPages, chunkSize, chunkOverlap);
        return settings;
    }

    @Bean
    public EncodingDecoder encodingDecoder() {
        return new EncodingDecoder();
    }

    @Bean
    public MetadataReader metadataReader(EncodingDecoder decoder, ObjectMapper objectMapper) {
        return new MetadataReader(decoder, objectMapper);
    }

    @Bean
    public DirectoryIngestor directoryIngestor(AnalysisSettings settings) {
        return new DirectoryIngestor(new FormatExtractor(settings), settings);
    }

    @Bean
    public ChunkSplitter chunkSplitter(AnalysisSettings settings) {
        return new ChunkSplitter(settings.chunking());
    }

    @Bean
    public QuantityReconciler quantityReconciler(ObjectMapper objectMapper) {
        return new QuantityReconciler(objectMapper);
    }

    @Bean
    public AnalysisPipeline analysisPipeline(MetadataReader metadataReader,
                                             DirectoryIngestor ingestor,
                                             LanguageModelService languageModelService,
                                             ChunkSplitter splitter,
                                             QuantityReconciler reconciler,
                                             ObjectMapper objectMapper) {
        return AnalysisPipeline.standard(metadataReader, ingestor, languageModelService,
                splitter, reconciler, objectMapper);
    }
}
