package it.aw.editalanalysis.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Estrazione del testo da PDF con catena di backend.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Parse con il backend primario (PDFBox); se lancia, un solo retry con il secondario (Tika)</li>
 *   <li>Al massimo {@code maxPages} pagine</li>
 *   <li>Ogni pagina viene normalizzata; pagine con &lt;= {@code minPageChars} caratteri sono scartate
 *       (pagine scansionate o rumore)</li>
 *   <li>Le pagine superstiti sono concatenate con il marker {@code === Página N ===}</li>
 * </ol>
 */
public class PdfTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfTextExtractor.class);

    private final List<PdfBackend> backends;
    private final int maxPages;
    private final int minPageChars;

    public PdfTextExtractor(int maxPages, int minPageChars) {
        this(List.of(new PdfBoxBackend(), new TikaPdfBackend()), maxPages, minPageChars);
    }

    public PdfTextExtractor(List<PdfBackend> backends, int maxPages, int minPageChars) {
        if (backends.isEmpty()) {
            throw new IllegalArgumentException("Serve almeno un backend PDF");
        }
        this.backends = List.copyOf(backends);
        this.maxPages = maxPages;
        this.minPageChars = minPageChars;
    }

    public String extract(Path file) throws ExtractionException {
        String name = file.getFileName().toString();
        List<String> pages = parseWithFallback(file, name);

        StringBuilder sb = new StringBuilder();
        int kept = 0;
        for (int i = 0; i < pages.size(); i++) {
            String pageText = TextNormalizer.normalize(pages.get(i));
            if (pageText.length() > minPageChars) {
                sb.append("\n\n=== Página ").append(i + 1).append(" ===\n\n").append(pageText);
                kept++;
            } else {
                log.debug("{}: pagina {} ignorata ({} caratteri)", name, i + 1, pageText.length());
            }
        }

        if (kept == 0) {
            throw new ExtractionException(name, "Nenhuma página com texto utilizável: " + name);
        }
        log.info("{}: {} pagine utili su {} elaborate", name, kept, pages.size());
        return sb.toString();
    }

    private List<String> parseWithFallback(Path file, String name) throws ExtractionException {
        // [1] backend primario
        PdfBackend primary = backends.get(0);
        try {
            return primary.pageTexts(file, maxPages);
        } catch (IOException | RuntimeException e) {
            if (backends.size() == 1) {
                throw new ExtractionException(name, "Erro ao ler PDF: " + e.getMessage(), e);
            }
            log.warn("{}: backend {} fallito ({}), ritento con {}",
                    name, primary.name(), e.getMessage(), backends.get(1).name());
        }

        // [2] un solo retry con il secondario
        PdfBackend secondary = backends.get(1);
        try {
            return secondary.pageTexts(file, maxPages);
        } catch (IOException | RuntimeException e) {
            throw new ExtractionException(name, "Erro ao ler PDF: " + e.getMessage(), e);
        }
    }
}
