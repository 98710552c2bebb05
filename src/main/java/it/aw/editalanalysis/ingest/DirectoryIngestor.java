package it.aw.editalanalysis.ingest;

import it.aw.editalanalysis.config.AnalysisSettings;
import it.aw.editalanalysis.model.ExtractedUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ingestione di un bundle: tutti i file della directory diventano un unico testo.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Walk ricorsivo ordinato; {@code metadata.json} è metadata, tutto il resto contenuto</li>
 *   <li>Estrazione per file; i fallimenti sono registrati per nome e non interrompono il walk
 *       (quelli del metadata non contano come fallimenti di contenuto)</li>
 *   <li>Nessun file di contenuto, o tutti in errore: {@link IngestionResult.InsufficientContent}</li>
 *   <li>Normalizzazione del testo aggregato e controllo di {@link ContentSizeGuard}</li>
 * </ol>
 */
public class DirectoryIngestor {

    private static final Logger log = LoggerFactory.getLogger(DirectoryIngestor.class);

    private final FormatExtractor formatExtractor;
    private final int defaultMaxChars;

    public DirectoryIngestor(FormatExtractor formatExtractor, AnalysisSettings settings) {
        this.formatExtractor = formatExtractor;
        this.defaultMaxChars = settings.maxChars();
    }

    public IngestionResult ingest(Path bundle) throws IOException {
        return ingest(bundle, defaultMaxChars);
    }

    public IngestionResult ingest(Path bundle, int maxChars) throws IOException {
        if (!Files.isDirectory(bundle)) {
            throw new FileNotFoundException("Diretório não encontrado: " + bundle);
        }

        // [1] classificazione
        List<Path> files = listFiles(bundle);
        long contentFiles = files.stream().filter(f -> !FormatExtractor.isMetadataFile(f)).count();
        log.info("Bundle {}: {} file ({} di contenuto, {} metadata)",
                bundle, files.size(), contentFiles, files.size() - contentFiles);

        // [2] estrazione
        List<ExtractedUnit> units = new ArrayList<>(files.size());
        for (Path file : files) {
            units.add(extractUnit(file));
        }

        StringBuilder aggregate = new StringBuilder();
        List<String> failedFiles = new ArrayList<>();
        int successfulContent = 0;
        for (int i = 0; i < files.size(); i++) {
            ExtractedUnit unit = units.get(i);
            boolean metadata = FormatExtractor.isMetadataFile(files.get(i));
            if (unit.failed()) {
                if (!metadata) failedFiles.add(unit.sourceName());
                continue;
            }
            aggregate.append("\n\n=== ").append(unit.sourceName()).append(" ===\n\n").append(unit.text());
            if (!metadata) successfulContent++;
        }
        log.info("Bundle {}: {} file di contenuto estratti, {} in errore {}",
                bundle, successfulContent, failedFiles.size(), failedFiles);

        // [3] contenuto minimo
        if (contentFiles == 0) {
            return new IngestionResult.InsufficientContent(
                    "Apenas metadata.json encontrado. Não há arquivos de conteúdo para análise.", List.of());
        }
        if (successfulContent == 0) {
            return new IngestionResult.InsufficientContent(
                    "Não foi possível extrair conteúdo de nenhum arquivo de conteúdo. Arquivos com erro: "
                            + String.join(", ", failedFiles),
                    failedFiles);
        }

        // [4] normalizzazione e limite
        String text = TextNormalizer.normalize(aggregate.toString());
        log.info("Bundle {}: {} caratteri grezzi, {} dopo la normalizzazione", bundle, aggregate.length(), text.length());
        return new ContentSizeGuard(maxChars).check(text)
                .<IngestionResult>map(tooLarge -> {
                    log.warn("Bundle {}: documento troppo grande ({} > {})", bundle, tooLarge.actualChars(), tooLarge.maxChars());
                    return tooLarge;
                })
                .orElseGet(() -> new IngestionResult.Success(text));
    }

    private ExtractedUnit extractUnit(Path file) {
        String name = file.getFileName().toString();
        try {
            String text = formatExtractor.extract(file);
            if (text.isBlank()) {
                return ExtractedUnit.failure(name, "Nenhum texto extraído");
            }
            log.debug("{}: {} caratteri estratti", name, text.length());
            return ExtractedUnit.success(name, text);
        } catch (ExtractionException e) {
            log.warn("{}: estrazione fallita: {}", name, e.getMessage());
            return ExtractedUnit.failure(name, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("{}: errore inatteso in estrazione", name, e);
            return ExtractedUnit.failure(name, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static List<Path> listFiles(Path bundle) throws IOException {
        try (Stream<Path> walk = Files.walk(bundle)) {
            return walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
    }
}
