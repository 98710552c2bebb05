package it.aw.editalanalysis.config;

import it.aw.editalanalysis.model.ChunkingParams;

/**
 * Configurazione immutabile dell'analisi, passata per costruttore a tutti i componenti.
 *
 * @param maxChars        tetto di caratteri del testo aggregato del bundle
 * @param zipMaxChars     tetto di caratteri del testo estratto da un singolo ZIP
 * @param zipMaxDepth     profondità massima di ZIP annidati
 * @param pdfMaxPages     pagine PDF elaborate al massimo per file
 * @param pdfMinPageChars pagine con testo pulito di lunghezza &lt;= a questo valore sono scartate
 * @param chunking        parametri di chunking per la stima delle quantità
 */
public record AnalysisSettings(
        int            maxChars,
        int            zipMaxChars,
        int            zipMaxDepth,
        int            pdfMaxPages,
        int            pdfMinPageChars,
        ChunkingParams chunking
) {

    public static final int DEFAULT_MAX_CHARS         = 200_000;
    public static final int DEFAULT_ZIP_MAX_CHARS     = 50_000;
    public static final int DEFAULT_ZIP_MAX_DEPTH     = 3;
    public static final int DEFAULT_PDF_MAX_PAGES     = 20;
    public static final int DEFAULT_PDF_MIN_PAGE_CHARS = 50;

    public AnalysisSettings {
        if (maxChars < 1) {
            throw new IllegalArgumentException("maxChars deve essere >= 1 (ricevuto: " + maxChars + ")");
        }
        if (zipMaxChars < 1) {
            throw new IllegalArgumentException("zipMaxChars deve essere >= 1 (ricevuto: " + zipMaxChars + ")");
        }
        if (zipMaxDepth < 0) {
            throw new IllegalArgumentException("zipMaxDepth deve essere >= 0 (ricevuto: " + zipMaxDepth + ")");
        }
        if (pdfMaxPages < 1) {
            throw new IllegalArgumentException("pdfMaxPages deve essere >= 1 (ricevuto: " + pdfMaxPages + ")");
        }
        if (chunking == null) {
            chunking = ChunkingParams.defaults();
        }
    }

    public static AnalysisSettings defaults() {
        return new AnalysisSettings(DEFAULT_MAX_CHARS, DEFAULT_ZIP_MAX_CHARS, DEFAULT_ZIP_MAX_DEPTH,
                DEFAULT_PDF_MAX_PAGES, DEFAULT_PDF_MIN_PAGE_CHARS, ChunkingParams.defaults());
    }

    public AnalysisSettings withMaxChars(int newMaxChars) {
        return new AnalysisSettings(newMaxChars, zipMaxChars, zipMaxDepth, pdfMaxPages, pdfMinPageChars, chunking);
    }
}
