package it.aw.editalanalysis;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFTable;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/** File di test generati al volo: PDF, DOCX e ZIP. */
public final class Fixtures {

    private Fixtures() {}

    /** Una pagina per elemento; ogni elemento può contenere più righe separate da \n (solo ASCII). */
    public static Path pdf(Path file, List<String> pages) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            for (String pageText : pages) {
                PDPage page = new PDPage();
                doc.addPage(page);
                try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                    cs.beginText();
                    cs.setFont(PDType1Font.HELVETICA, 11);
                    cs.newLineAtOffset(50, 720);
                    for (String line : pageText.split("\n")) {
                        cs.showText(line);
                        cs.newLineAtOffset(0, -15);
                    }
                    cs.endText();
                }
            }
            doc.save(file.toFile());
        }
        return file;
    }

    public static Path docx(Path file, List<String> paragraphs, List<List<String>> tableRows) throws IOException {
        try (XWPFDocument doc = new XWPFDocument();
             OutputStream out = Files.newOutputStream(file)) {
            for (String paragraph : paragraphs) {
                doc.createParagraph().createRun().setText(paragraph);
            }
            if (!tableRows.isEmpty()) {
                int cols = tableRows.get(0).size();
                XWPFTable table = doc.createTable(tableRows.size(), cols);
                for (int r = 0; r < tableRows.size(); r++) {
                    for (int c = 0; c < cols; c++) {
                        table.getRow(r).getCell(c).setText(tableRows.get(r).get(c));
                    }
                }
            }
            doc.write(out);
        }
        return file;
    }

    public static byte[] zipBytes(Map<String, byte[]> entries) throws IOException {
        return zipBytes(entries, StandardCharsets.UTF_8);
    }

    /** Con un charset diverso da UTF-8 i nomi sono scritti senza flag UTF-8, come fanno i vecchi tool Windows. */
    public static byte[] zipBytes(Map<String, byte[]> entries, Charset nameCharset) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(buffer, nameCharset)) {
            for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue());
                zip.closeEntry();
            }
        }
        return buffer.toByteArray();
    }

    public static Path zip(Path file, Map<String, byte[]> entries) throws IOException {
        Files.write(file, zipBytes(entries));
        return file;
    }

    public static Path zip(Path file, Map<String, byte[]> entries, Charset nameCharset) throws IOException {
        Files.write(file, zipBytes(entries, nameCharset));
        return file;
    }

    public static Map<String, byte[]> entries(String... nameAndText) {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        for (int i = 0; i < nameAndText.length; i += 2) {
            entries.put(nameAndText[i], nameAndText[i + 1].getBytes(StandardCharsets.UTF_8));
        }
        return entries;
    }

    public static Path text(Path file, String content) throws IOException {
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
