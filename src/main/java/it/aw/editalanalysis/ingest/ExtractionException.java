package it.aw.editalanalysis.ingest;

/**
 * Estrazione di un singolo file fallita o priva di testo utilizzabile.
 * Non è fatale per il bundle: il file viene registrato tra quelli in errore.
 */
public class ExtractionException extends Exception {

    private final String sourceName;

    public ExtractionException(String sourceName, String message) {
        super(message);
        this.sourceName = sourceName;
    }

    public ExtractionException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
