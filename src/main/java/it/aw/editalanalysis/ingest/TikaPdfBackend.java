package it.aw.editalanalysis.ingest;

import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.pdf.PDFParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Backend secondario: parser PDF di Tika.
 * <p>
 * Tika emette XHTML con un {@code <div class="page">} per pagina: l'handler apre
 * un nuovo buffer a ogni pagina e chiude ogni paragrafo con un a capo.
 */
public class TikaPdfBackend implements PdfBackend {

    private static final Logger log = LoggerFactory.getLogger(TikaPdfBackend.class);

    @Override
    public String name() {
        return "tika";
    }

    @Override
    public List<String> pageTexts(Path file, int maxPages) throws IOException {
        PageCollector collector = new PageCollector(maxPages);
        try (InputStream in = Files.newInputStream(file)) {
            new PDFParser().parse(in, collector, new Metadata(), new ParseContext());
        } catch (SAXException | TikaException e) {
            throw new IOException("Parsing Tika fallito per " + file.getFileName() + ": " + e.getMessage(), e);
        }
        log.debug("Tika: {} pagine raccolte da {}", collector.pages.size(), file.getFileName());
        return collector.pages;
    }

    private static final class PageCollector extends DefaultHandler {

        private final int maxPages;
        private final List<String> pages = new ArrayList<>();
        private StringBuilder current;
        private int divDepth;           // div annidati dentro la pagina corrente

        PageCollector(int maxPages) {
            this.maxPages = maxPages;
        }

        @Override
        public void startElement(String uri, String localName, String qName, Attributes atts) {
            if (!"div".equals(localName)) return;
            if (divDepth == 0 && "page".equals(atts.getValue("class"))) {
                current = pages.size() < maxPages ? new StringBuilder() : null;
                divDepth = 1;
            } else if (divDepth > 0) {
                divDepth++;
            }
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            if ("p".equals(localName) && current != null) {
                current.append('\n');
            } else if ("div".equals(localName) && divDepth > 0 && --divDepth == 0) {
                if (current != null) pages.add(current.toString());
                current = null;
            }
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            if (current != null) current.append(ch, start, length);
        }
    }
}
