package it.aw.editalanalysis.ingest;

/** Nessun membro dello ZIP ha prodotto testo utilizzabile. */
public class EmptyArchiveException extends ExtractionException {

    public EmptyArchiveException(String sourceName) {
        super(sourceName, "Nenhum texto extraído do ZIP: " + sourceName);
    }
}
