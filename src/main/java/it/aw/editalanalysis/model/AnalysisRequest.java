package it.aw.editalanalysis.model;

/**
 * Parametri di una singola analisi.
 *
 * @param bundlePath directory del bundle (edital)
 * @param target     argomento rispetto a cui valutare la rilevanza
 * @param threshold  quantità minima richiesta; 0 disattiva il controllo quantitativo
 * @param forceMatch forza target_match=true indipendentemente dalla risposta del modello
 * @param outputFile file JSON di output opzionale (null = nessun report su disco)
 */
public record AnalysisRequest(
        String  bundlePath,
        String  target,
        int     threshold,
        boolean forceMatch,
        String  outputFile
) {
    public AnalysisRequest {
        if (bundlePath == null || bundlePath.isBlank()) {
            throw new IllegalArgumentException("bundlePath obbligatorio");
        }
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target obbligatorio");
        }
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold deve essere >= 0 (ricevuto: " + threshold + ")");
        }
    }

    public static AnalysisRequest of(String bundlePath, String target, int threshold) {
        return new AnalysisRequest(bundlePath, target, threshold, false, null);
    }
}
