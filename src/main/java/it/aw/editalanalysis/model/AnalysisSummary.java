package it.aw.editalanalysis.model;

import java.time.LocalDateTime;

/**
 * Vista leggera di un'analisi registrata.
 * <p>
 * Restituita da GET /api/analyses (lista).
 */
public record AnalysisSummary(
        String        analysisId,
        String        bundlePath,
        String        target,
        int           threshold,
        String        bidNumber,
        boolean       relevant,
        boolean       hasError,
        LocalDateTime analyzedAt
) {}
