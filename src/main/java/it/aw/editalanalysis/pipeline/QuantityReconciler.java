package it.aw.editalanalysis.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.editalanalysis.model.QuantityEstimate;
import it.aw.editalanalysis.model.ReconciledQuantity;
import it.aw.editalanalysis.model.ThresholdStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Validazione delle stime per chunk e riconciliazione in una quantità unica.
 * <p>
 * Il totale è il massimo delle stime valide (non la somma: i chunk si sovrappongono e
 * la stessa quantità compare spesso in più sezioni dell'edital).
 * Regole di stato, valutate in ordine:
 * <ol>
 *   <li>threshold == 0 → true</li>
 *   <li>target non corrispondente → false</li>
 *   <li>totale == 0 → inconclusive</li>
 *   <li>totale &gt;= threshold → true, altrimenti false</li>
 * </ol>
 * Una stima malformata è un'anomalia da loggare, non un errore della pipeline.
 */
public class QuantityReconciler {

    private static final Logger log = LoggerFactory.getLogger(QuantityReconciler.class);

    static final List<String> REQUIRED_FIELDS = List.of("total_quantity", "unit", "explanation");

    private final ObjectMapper objectMapper;

    public QuantityReconciler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Interpreta la risposta del modello per un chunk.
     *
     * @return la stima, oppure vuoto se la risposta non è valida
     */
    public Optional<QuantityEstimate> parseEstimate(String raw) {
        if (raw == null || raw.isBlank()) {
            log.warn("Stima quantità scartata: risposta vuota");
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.warn("Stima quantità scartata: JSON non valido ({})", e.getOriginalMessage());
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            log.warn("Stima quantità scartata: la risposta non è un oggetto JSON");
            return Optional.empty();
        }

        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED_FIELDS) {
            if (!node.hasNonNull(field)) missing.add(field);
        }
        if (!missing.isEmpty()) {
            log.warn("Stima quantità scartata: campi mancanti {}", missing);
            return Optional.empty();
        }

        Optional<Long> quantity = asNonNegativeLong(node.get("total_quantity"));
        if (quantity.isEmpty()) {
            log.warn("Stima quantità scartata: total_quantity non valida ({})", node.get("total_quantity"));
            return Optional.empty();
        }
        JsonNode unit = node.get("unit");
        if (!unit.isTextual() || unit.asText().isBlank()) {
            log.warn("Stima quantità scartata: unit non valida ({})", unit);
            return Optional.empty();
        }
        return Optional.of(new QuantityEstimate(quantity.get(), unit.asText().strip(), node.get("explanation").asText()));
    }

    public ReconciledQuantity reconcile(List<QuantityEstimate> estimates, int threshold, boolean targetMatch) {
        Optional<QuantityEstimate> best = estimates.stream()
                .max(Comparator.comparingLong(QuantityEstimate::totalQuantity));
        long total = best.map(QuantityEstimate::totalQuantity).orElse(0L);
        String unit = best.map(QuantityEstimate::unit).orElse("");
        String explanation = best.map(QuantityEstimate::explanation).orElse("");

        ThresholdStatus status;
        if (threshold == 0) {
            status = ThresholdStatus.TRUE;
        } else if (!targetMatch) {
            status = ThresholdStatus.FALSE;
        } else if (total == 0) {
            status = ThresholdStatus.INCONCLUSIVE;
        } else {
            status = total >= threshold ? ThresholdStatus.TRUE : ThresholdStatus.FALSE;
        }

        log.info("Riconciliazione: {} stime valide, totale={} {}, threshold={} -> {}",
                estimates.size(), total, unit, threshold, status);
        return new ReconciledQuantity(total, unit, explanation, status, estimates.size());
    }

    private static Optional<Long> asNonNegativeLong(JsonNode value) {
        long parsed;
        if (value.isIntegralNumber()) {
            if (!value.canConvertToLong()) return Optional.empty();
            parsed = value.asLong();
        } else if (value.isNumber()) {
            double d = value.asDouble();
            if (d != Math.rint(d) || Double.isInfinite(d)) return Optional.empty();
            parsed = (long) d;
        } else if (value.isTextual()) {
            try {
                parsed = Long.parseLong(value.asText().strip());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return parsed >= 0 ? Optional.of(parsed) : Optional.empty();
    }
}
