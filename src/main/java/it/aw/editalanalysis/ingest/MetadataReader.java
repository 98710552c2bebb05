package it.aw.editalanalysis.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.editalanalysis.model.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Legge {@code metadata.json} dalla radice del bundle.
 * <p>
 * File assente o non interpretabile non è un errore: si ottiene {@code {bid_number: "N/A"}}.
 * I valori scalari sono convertiti in stringa; {@code threshold} e {@code target} vengono
 * rimossi perché sono parametri dell'analisi e non devono mai arrivare in un prompt.
 */
public class MetadataReader {

    private static final Logger log = LoggerFactory.getLogger(MetadataReader.class);

    public static final String BID_NUMBER = "bid_number";
    public static final String CITY = "city";

    /** Chiavi passate dal chiamante come parametri, mai mostrate al modello. */
    public static final List<String> ANALYSIS_PARAMETER_KEYS = List.of("threshold", "target");

    public static final List<String> RECOGNIZED_KEYS = List.of(
            "object", "dates", "public_notice", "status", "agency", CITY,
            BID_NUMBER, "notes", "process_id", "phone", "website");

    private final EncodingDecoder decoder;
    private final ObjectMapper objectMapper;

    public MetadataReader(EncodingDecoder decoder, ObjectMapper objectMapper) {
        this.decoder = decoder;
        this.objectMapper = objectMapper;
    }

    public Map<String, String> read(Path bundle) {
        Map<String, String> metadata = new LinkedHashMap<>();
        findMetadataFile(bundle).ifPresent(file -> parseInto(file, metadata));

        ANALYSIS_PARAMETER_KEYS.forEach(metadata::remove);
        String bidNumber = metadata.get(BID_NUMBER);
        if (bidNumber == null || bidNumber.isBlank()) {
            metadata.put(BID_NUMBER, PipelineState.UNKNOWN_BID_NUMBER);
        }
        log.info("Metadata letti da {}: {} chiavi (bid_number={})", bundle, metadata.size(), metadata.get(BID_NUMBER));
        return metadata;
    }

    private Optional<Path> findMetadataFile(Path bundle) {
        if (!Files.isDirectory(bundle)) return Optional.empty();
        try (Stream<Path> entries = Files.list(bundle)) {
            return entries.filter(Files::isRegularFile)
                    .filter(FormatExtractor::isMetadataFile)
                    .findFirst();
        } catch (IOException e) {
            log.warn("Impossibile elencare {}: {}", bundle, e.getMessage());
            return Optional.empty();
        }
    }

    private void parseInto(Path file, Map<String, String> metadata) {
        try {
            Optional<String> text = decoder.decode(Files.readAllBytes(file));
            if (text.isEmpty()) {
                log.warn("{}: contenuto non decodificabile, metadata ignorati", file);
                return;
            }
            JsonNode root = objectMapper.readTree(text.get());
            if (!root.isObject()) {
                log.warn("{}: non è un oggetto JSON, metadata ignorati", file);
                return;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (value.isValueNode() && !value.isNull()) {
                    metadata.put(field.getKey(), value.asText());
                } else if (RECOGNIZED_KEYS.contains(field.getKey())) {
                    log.debug("{}: chiave {} non scalare ignorata", file.getFileName(), field.getKey());
                }
            }
        } catch (JsonProcessingException e) {
            log.warn("{}: JSON non valido ({}), metadata ignorati", file, e.getOriginalMessage());
        } catch (IOException e) {
            log.warn("{}: lettura fallita ({}), metadata ignorati", file, e.getMessage());
        }
    }
}
