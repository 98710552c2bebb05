package it.aw.editalanalysis.ingest;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Backend primario: PDFBox, pagina per pagina con {@link PDFTextStripper}.
 */
public class PdfBoxBackend implements PdfBackend {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxBackend.class);

    @Override
    public String name() {
        return "pdfbox";
    }

    @Override
    public List<String> pageTexts(Path file, int maxPages) throws IOException {
        try (PDDocument doc = PDDocument.load(file.toFile())) {
            int totalPages = doc.getNumberOfPages();
            int pages = Math.min(maxPages, totalPages);
            log.debug("PDFBox: {} pagine trovate, ne elaboro {}", totalPages, pages);

            PDFTextStripper stripper = new PDFTextStripper();
            List<String> texts = new ArrayList<>(pages);
            for (int p = 1; p <= pages; p++) {
                stripper.setStartPage(p);
                stripper.setEndPage(p);
                texts.add(stripper.getText(doc));
            }
            return texts;
        }
    }
}
