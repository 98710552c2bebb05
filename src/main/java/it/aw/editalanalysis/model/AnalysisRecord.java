package it.aw.editalanalysis.model;

import java.time.LocalDateTime;

/**
 * Dettaglio completo di un'analisi registrata, inclusi esito ed eventuale errore.
 * <p>
 * Restituito da POST /api/analyses e GET /api/analyses/{analysisId}.
 * Per le operazioni di lista usare {@link AnalysisSummary}.
 */
public record AnalysisRecord(
        String          analysisId,
        String          bundlePath,
        String          target,
        int             threshold,
        boolean         forceMatch,
        LocalDateTime   analyzedAt,
        AnalysisResult  result,
        boolean         hasError,
        String          errorMessage
) {
    /** Proietta il record nella vista leggera senza summary e justification. */
    public AnalysisSummary toSummary() {
        return new AnalysisSummary(analysisId, bundlePath, target, threshold,
                result.bidNumber(), result.isRelevant(), hasError, analyzedAt);
    }
}
