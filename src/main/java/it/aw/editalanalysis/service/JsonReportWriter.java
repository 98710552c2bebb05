package it.aw.editalanalysis.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.editalanalysis.model.AnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Scrive il record di output come JSON indentato UTF-8.
 * I percorsi sono risolti rispetto a {@code analysis.report.dir}; un percorso che
 * esce da quella directory (assoluto o con {@code ..}) viene rifiutato.
 */
@Component
public class JsonReportWriter {

    private static final Logger log = LoggerFactory.getLogger(JsonReportWriter.class);

    private final ObjectMapper objectMapper;
    private final Path reportDir;

    public JsonReportWriter(ObjectMapper objectMapper, @Value("${analysis.report.dir:./reports}") String reportDir) {
        this.objectMapper = objectMapper;
        this.reportDir = Paths.get(reportDir);
    }

    /**
     * @throws IllegalArgumentException se il file di output è vuoto o fuori da {@code analysis.report.dir}
     */
    public Path resolve(String outputFile) {
        if (outputFile == null || outputFile.isBlank()) {
            throw new IllegalArgumentException("outputFile vuoto");
        }
        Path root = reportDir.toAbsolutePath().normalize();
        Path target;
        try {
            target = root.resolve(outputFile).normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("outputFile non valido: " + outputFile, e);
        }
        if (!target.startsWith(root) || target.equals(root)) {
            throw new IllegalArgumentException("outputFile fuori dalla directory dei report: " + outputFile);
        }
        return target;
    }

    public Path write(AnalysisResult result, String outputFile) throws IOException {
        Path target = resolve(outputFile);
        Path parent = target.getParent();
        if (parent != null) Files.createDirectories(parent);
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, result);
        }
        log.info("Report scritto: {}", target);
        return target;
    }
}
