package it.aw.editalanalysis.ingest;

/** ZIP inesistente, non valido o corrotto. */
public class BadArchiveException extends ExtractionException {

    public BadArchiveException(String sourceName, String message) {
        super(sourceName, message);
    }

    public BadArchiveException(String sourceName, String message, Throwable cause) {
        super(sourceName, message, cause);
    }
}
