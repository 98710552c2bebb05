package it.aw.editalanalysis.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import it.aw.editalanalysis.config.AnalysisSettings;
import org.apache.poi.hwpf.HWPFDocument;
import org.apache.poi.hwpf.usermodel.Paragraph;
import org.apache.poi.hwpf.usermodel.Range;
import org.apache.poi.hwpf.usermodel.Table;
import org.apache.poi.hwpf.usermodel.TableRow;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Estrae il testo da un singolo file, scegliendo l'estrattore in base al {@link FileKind}.
 * <p>
 * Gli ZIP sono delegati ad {@link ArchiveExtractor}, che a sua volta usa questa classe
 * per i membri dell'archivio.
 */
public class FormatExtractor {

    private static final Logger log = LoggerFactory.getLogger(FormatExtractor.class);

    static final String METADATA_FILENAME = "metadata.json";
    private static final String CELL_SEPARATOR = " | ";

    @FunctionalInterface
    private interface Extractor {
        String extract(Path file) throws ExtractionException;
    }

    private final EncodingDecoder decoder;
    private final PdfTextExtractor pdfExtractor;
    private final ArchiveExtractor archiveExtractor;
    private final int zipMaxChars;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CsvMapper csvMapper = new CsvMapper();
    private final Map<FileKind, Extractor> extractors = new EnumMap<>(FileKind.class);

    public FormatExtractor(AnalysisSettings settings) {
        this(settings, new EncodingDecoder(),
                new PdfTextExtractor(settings.pdfMaxPages(), settings.pdfMinPageChars()));
    }

    public FormatExtractor(AnalysisSettings settings, EncodingDecoder decoder, PdfTextExtractor pdfExtractor) {
        this.decoder = decoder;
        this.pdfExtractor = pdfExtractor;
        this.archiveExtractor = new ArchiveExtractor(this, settings.zipMaxDepth());
        this.zipMaxChars = settings.zipMaxChars();

        extractors.put(FileKind.PDF,     pdfExtractor::extract);
        extractors.put(FileKind.DOCX,    this::extractDocx);
        extractors.put(FileKind.DOC,     this::extractDoc);
        extractors.put(FileKind.TEXT,    this::extractText);
        extractors.put(FileKind.CSV,     this::extractCsv);
        extractors.put(FileKind.JSON,    this::extractJson);
        extractors.put(FileKind.ZIP,     file -> archiveExtractor.extract(file, zipMaxChars));
        extractors.put(FileKind.UNKNOWN, this::extractText);
    }

    public String extract(Path file) throws ExtractionException {
        FileKind kind = FileKind.of(file);
        log.debug("Estrazione {} come {}", file.getFileName(), kind);
        return extractors.get(kind).extract(file);
    }

    public ArchiveExtractor archiveExtractor() {
        return archiveExtractor;
    }

    public static boolean isMetadataFile(Path file) {
        return METADATA_FILENAME.equalsIgnoreCase(file.getFileName().toString());
    }

    // ── Testo ───────────────────────────────────────────────────────────────

    /** Markdown, testo semplice e qualunque estensione sconosciuta. */
    String extractText(Path file) throws ExtractionException {
        return decode(file);
    }

    private String decode(Path file) throws ExtractionException {
        String name = file.getFileName().toString();
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new ExtractionException(name, "Erro ao ler arquivo: " + e.getMessage(), e);
        }
        return decoder.decode(bytes)
                .orElseThrow(() -> new ExtractionException(name, "Não foi possível decodificar o arquivo: " + name));
    }

    // ── Word ────────────────────────────────────────────────────────────────

    private String extractDocx(Path file) throws ExtractionException {
        String name = file.getFileName().toString();
        List<String> parts = new ArrayList<>();
        try (InputStream in = Files.newInputStream(file);
             XWPFDocument doc = new XWPFDocument(in)) {

            for (XWPFParagraph paragraph : doc.getParagraphs()) {
                String text = paragraph.getText();
                if (text != null && !text.isBlank()) parts.add(text.strip());
            }
            for (XWPFTable table : doc.getTables()) {
                for (XWPFTableRow row : table.getRows()) {
                    StringJoiner line = new StringJoiner(CELL_SEPARATOR);
                    for (XWPFTableCell cell : row.getTableCells()) {
                        String text = cell.getText();
                        if (text != null && !text.isBlank()) line.add(text.strip());
                    }
                    if (line.length() > 0) parts.add(line.toString());
                }
            }
        } catch (IOException | RuntimeException e) {
            throw new ExtractionException(name, "Erro ao ler DOCX: " + e.getMessage(), e);
        }
        return requireText(name, String.join("\n", parts));
    }

    private String extractDoc(Path file) throws ExtractionException {
        String name = file.getFileName().toString();
        List<String> parts = new ArrayList<>();
        try (InputStream in = Files.newInputStream(file);
             HWPFDocument doc = new HWPFDocument(in)) {
            Range range = doc.getRange();
            int i = 0;
            while (i < range.numParagraphs()) {
                Paragraph paragraph = range.getParagraph(i);
                if (paragraph.isInTable()) {
                    Table table = range.getTable(paragraph);
                    for (int r = 0; r < table.numRows(); r++) {
                        TableRow row = table.getRow(r);
                        List<String> cells = new ArrayList<>(row.numCells());
                        for (int c = 0; c < row.numCells(); c++) {
                            cells.add(row.getCell(c).text());
                        }
                        String line = joinCells(cells);
                        if (!line.isEmpty()) parts.add(line);
                    }
                    i += Math.max(table.numParagraphs(), 1);
                    continue;
                }
                String text = cleanDocText(paragraph.text());
                if (!text.isEmpty()) parts.add(text);
                i++;
            }
        } catch (IOException | RuntimeException e) {
            throw new ExtractionException(name, "Erro ao ler DOC: " + e.getMessage(), e);
        }
        return requireText(name, String.join("\n", parts));
    }

    /** Celle non vuote di una riga di tabella, unite da " | " come per il DOCX. */
    static String joinCells(List<String> cells) {
        StringJoiner line = new StringJoiner(CELL_SEPARATOR);
        for (String cell : cells) {
            String text = cleanDocText(cell);
            if (!text.isEmpty()) line.add(text);
        }
        return line.toString();
    }

    /** Rimuove i marcatori di fine cella (BEL) e i caratteri di controllo di Word. */
    private static String cleanDocText(String text) {
        if (text == null) return "";
        return text.replaceAll("[\\x00-\\x08\\x0B-\\x1F]", " ").strip();
    }

    private static String requireText(String name, String text) throws ExtractionException {
        if (text.isBlank()) {
            throw new ExtractionException(name, "Documento sem texto: " + name);
        }
        return text;
    }

    // ── CSV ─────────────────────────────────────────────────────────────────

    private String extractCsv(Path file) throws ExtractionException {
        String name = file.getFileName().toString();
        String content = decode(file);

        List<String> lines = new ArrayList<>();
        try (MappingIterator<List<String>> rows = csvMapper
                .readerForListOf(String.class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .readValues(content)) {
            while (rows.hasNext()) {
                StringJoiner line = new StringJoiner(CELL_SEPARATOR);
                boolean blank = true;
                for (String cell : rows.next()) {
                    String value = cell != null ? cell.strip() : "";
                    if (!value.isEmpty()) blank = false;
                    line.add(value);
                }
                if (!blank) lines.add(line.toString());
            }
        } catch (IOException | RuntimeException e) {
            throw new ExtractionException(name, "Erro ao ler CSV: " + e.getMessage(), e);
        }

        if (lines.isEmpty()) {
            throw new ExtractionException(name, "CSV sem linhas com conteúdo: " + name);
        }
        return String.join("\n", lines);
    }

    // ── JSON ────────────────────────────────────────────────────────────────

    private String extractJson(Path file) throws ExtractionException {
        String name = file.getFileName().toString();
        String content = decode(file);
        try {
            JsonNode root = objectMapper.readTree(content);
            if (isMetadataFile(file) && root.isObject()) {
                // parametri dell'analisi, non contenuto del documento
                ((ObjectNode) root).remove(MetadataReader.ANALYSIS_PARAMETER_KEYS);
            }
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new ExtractionException(name, "JSON inválido: " + e.getOriginalMessage(), e);
        }
    }
}
