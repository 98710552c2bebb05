package it.aw.editalanalysis.ingest;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Backend di parsing PDF. Restituisce il testo grezzo delle prime {@code maxPages} pagine,
 * una stringa per pagina in ordine (indice 0 = pagina 1).
 */
public interface PdfBackend {

    String name();

    List<String> pageTexts(Path file, int maxPages) throws IOException;
}
