package it.aw.editalanalysis.model;

/**
 * Finestra di testo normalizzato destinata a una singola chiamata al modello.
 * <p>
 * Gli offset sono 0-based sul testo completo; endOffset è esclusivo.
 */
public record TextChunk(
        int    index,        // posizione 0-based nella sequenza
        String text,
        int    startOffset,
        int    endOffset
) {
    public int length() {
        return endOffset - startOffset;
    }
}
