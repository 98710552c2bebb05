package it.aw.editalanalysis.controller;

import it.aw.editalanalysis.model.AnalysisRecord;
import it.aw.editalanalysis.model.AnalysisRequest;
import it.aw.editalanalysis.model.AnalysisSummary;
import it.aw.editalanalysis.model.RegistryStats;
import it.aw.editalanalysis.registry.AnalysisRegistry;
import it.aw.editalanalysis.service.AnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Espone l'esecuzione delle analisi e lo storico registrato.
 *
 * Endpoint disponibili:
 *   POST   /api/analyses                  esegue un'analisi in modo sincrono
 *   GET    /api/analyses                  lista delle analisi registrate
 *   GET    /api/analyses/stats            statistiche aggregate
 *   GET    /api/analyses/{analysisId}     dettaglio di un'analisi
 *   DELETE /api/analyses/{analysisId}     rimuove un'analisi dallo storico
 *
 * Nota: il path letterale /stats ha priorità su /{analysisId} in Spring MVC.
 */
@RestController
@RequestMapping("/api/analyses")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalysisService analysisService;
    private final AnalysisRegistry registry;

    public AnalysisController(AnalysisService analysisService, AnalysisRegistry registry) {
        this.analysisService = analysisService;
        this.registry = registry;
    }

    // -------------------------------------------------------------------------
    // POST /api/analyses
    // -------------------------------------------------------------------------

    /**
     * Analizza un bundle già presente sul filesystem del server.
     * Un errore di pipeline (bundle vuoto, documento troppo grande...) restituisce
     * comunque 200 con {@code hasError=true} e la giustificazione.
     *
     * Esempio:
     *   curl -X POST http://localhost:8889/api/analyses \
     *        -H "Content-Type: application/json" \
     *        -d '{"bundlePath":"/data/editais/123","target":"notebooks","threshold":500}'
     */
    @PostMapping
    public ResponseEntity<AnalysisRecord> analyze(@RequestBody AnalysisRequest request) {
        try {
            return ResponseEntity.ok(analysisService.analyze(request));
        } catch (IllegalArgumentException e) {
            log.warn("Richiesta di analisi rifiutata: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        } catch (Exception e) {
            log.error("Errore durante l'analisi: {}", request.bundlePath(), e);
            return ResponseEntity.internalServerError().build();
        }
    }

    // -------------------------------------------------------------------------
    // GET /api/analyses
    // -------------------------------------------------------------------------

    @GetMapping
    public ResponseEntity<List<AnalysisSummary>> listAnalyses() {
        return ResponseEntity.ok(registry.findAllAsSummary());
    }

    // -------------------------------------------------------------------------
    // GET /api/analyses/stats
    // -------------------------------------------------------------------------

    @GetMapping("/stats")
    public ResponseEntity<RegistryStats> stats() {
        return ResponseEntity.ok(registry.stats());
    }

    // -------------------------------------------------------------------------
    // GET /api/analyses/{analysisId}
    // -------------------------------------------------------------------------

    @GetMapping("/{analysisId}")
    public ResponseEntity<AnalysisRecord> getAnalysis(@PathVariable String analysisId) {
        return registry.findById(analysisId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    // -------------------------------------------------------------------------
    // DELETE /api/analyses/{analysisId}
    // -------------------------------------------------------------------------

    @DeleteMapping("/{analysisId}")
    public ResponseEntity<Void> deleteAnalysis(@PathVariable String analysisId) {
        boolean removed = registry.remove(analysisId);
        return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }
}
