package it.aw.editalanalysis.model;

/**
 * Risultato dell'estrazione di un singolo file del bundle.
 * Esattamente uno tra {@code text} ed {@code error} è valorizzato.
 */
public record ExtractedUnit(String sourceName, String text, String error) {

    public static ExtractedUnit success(String sourceName, String text) {
        return new ExtractedUnit(sourceName, text, null);
    }

    public static ExtractedUnit failure(String sourceName, String error) {
        return new ExtractedUnit(sourceName, null, error);
    }

    public boolean failed() {
        return error != null;
    }
}
