package it.aw.editalanalysis.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Estrazione ricorsiva del testo da archivi ZIP.
 * <p>
 * Pipeline per livello:
 * <ol>
 *   <li>Oltre {@code maxDepth} restituisce un marker di profondità massima (non un errore)</li>
 *   <li>Valida che il file esista e sia uno ZIP leggibile, altrimenti {@link BadArchiveException}</li>
 *   <li>Estrae in una directory temporanea, saltando voci fuori destinazione e {@code __MACOSX}</li>
 *   <li>Membri ordinari via {@link FormatExtractor}; ZIP annidati dopo, con profondità + 1</li>
 *   <li>Concatena con marker per membro e tronca a {@code maxChars}</li>
 * </ol>
 * La directory temporanea viene rimossa su ogni percorso di uscita.
 * <p>
 * I nomi delle voci si leggono in UTF-8; se non sono UTF-8 validi si ripiega su CP437,
 * la codifica degli strumenti ZIP di Windows che non impostano il flag UTF-8.
 */
public class ArchiveExtractor {

    private static final Logger log = LoggerFactory.getLogger(ArchiveExtractor.class);

    static final Charset LEGACY_ENTRY_CHARSET = Charset.forName("IBM437");

    private final FormatExtractor formatExtractor;
    private final int maxDepth;

    ArchiveExtractor(FormatExtractor formatExtractor, int maxDepth) {
        this.formatExtractor = formatExtractor;
        this.maxDepth = maxDepth;
    }

    public String extract(Path zip, int maxChars) throws ExtractionException {
        return extract(zip, maxChars, maxDepth, 0);
    }

    public String extract(Path zip, int maxChars, int maxDepth, int depth) throws ExtractionException {
        String name = zip.getFileName().toString();
        int level = depth + 1;

        if (depth >= maxDepth) {
            log.warn("{}: profondità massima ZIP raggiunta ({}), ricorsione interrotta", name, maxDepth);
            return depthMarker(maxDepth, name);
        }
        validate(zip, name);
        log.info("Estrazione ZIP (livello {}): {}", level, name);

        Path scratch = null;
        try {
            scratch = Files.createTempDirectory("edital-zip-");
            unzip(zip, scratch, name);

            StringBuilder text = new StringBuilder();
            int processed = 0;
            List<Path> nested = new ArrayList<>();

            // [1] membri ordinari
            for (Path member : listFiles(scratch)) {
                String memberName = member.getFileName().toString();
                if (FileKind.of(member) == FileKind.ZIP) {
                    nested.add(member);
                    continue;
                }
                try {
                    String memberText = FileKind.isOtherArchive(member)
                            ? formatExtractor.extractText(member)
                            : formatExtractor.extract(member);
                    text.append("\n\n=== ").append(memberName).append(" ===\n\n").append(memberText);
                    processed++;
                    log.debug("{} (livello {}): {} -> {} caratteri", name, level, memberName, memberText.length());
                } catch (ExtractionException | RuntimeException e) {
                    log.warn("{} (livello {}): membro {} saltato: {}", name, level, memberName, e.getMessage());
                }
            }

            // [2] ZIP annidati
            for (Path inner : nested) {
                String innerName = inner.getFileName().toString();
                try {
                    String innerText = extract(inner, maxChars, maxDepth, depth + 1);
                    text.append("\n\n=== ZIP ANINHADO: ").append(innerName).append(" ===\n\n").append(innerText);
                    processed++;
                } catch (ExtractionException e) {
                    log.warn("{} (livello {}): ZIP annidato {} saltato: {}", name, level, innerName, e.getMessage());
                }
            }

            log.info("{} (livello {}): {} membri estratti", name, level, processed);
            if (text.toString().isBlank()) {
                throw new EmptyArchiveException(name);
            }
            return truncate(text.toString(), maxChars);

        } catch (IOException | RuntimeException e) {
            throw new BadArchiveException(name, "Erro ao extrair ZIP: " + e.getMessage(), e);
        } finally {
            release(scratch);
        }
    }

    static String depthMarker(int maxDepth, String name) {
        return "[Profundidade máxima de ZIP atingida (" + maxDepth + "): " + name + "]";
    }

    static String truncate(String text, int maxChars) {
        if (text.length() <= maxChars) return text;
        return text.substring(0, maxChars) + "\n\n[Texto truncado em " + maxChars + " caracteres]";
    }

    private static void validate(Path zip, String name) throws BadArchiveException {
        if (!Files.isRegularFile(zip)) {
            throw new BadArchiveException(name, "Arquivo ZIP não encontrado: " + zip);
        }
        try (ZipFile ignored = open(zip, StandardCharsets.UTF_8)) {
            log.trace("{}: ZIP valido (UTF-8)", name);
        } catch (ZipException | IllegalArgumentException utf8Failure) {
            try (ZipFile ignored = open(zip, LEGACY_ENTRY_CHARSET)) {
                log.debug("{}: nomi delle voci non UTF-8, uso {}", name, LEGACY_ENTRY_CHARSET);
            } catch (ZipException | IllegalArgumentException e) {
                throw new BadArchiveException(name, "Arquivo não é um ZIP válido: " + name, e);
            } catch (IOException e) {
                throw new BadArchiveException(name, "Erro ao abrir ZIP: " + e.getMessage(), e);
            }
        } catch (IOException e) {
            throw new BadArchiveException(name, "Erro ao abrir ZIP: " + e.getMessage(), e);
        }
    }

    /** Apre lo ZIP e ne scorre le voci: un nome non decodificabile emerge già qui. */
    private static ZipFile open(Path zip, Charset charset) throws IOException {
        ZipFile zf = new ZipFile(zip.toFile(), charset);
        try {
            Enumeration<? extends ZipEntry> entries = zf.entries();
            while (entries.hasMoreElements()) {
                entries.nextElement().getName();
            }
            return zf;
        } catch (RuntimeException e) {
            zf.close();
            throw e;
        }
    }

    private static void unzip(Path zip, Path destination, String name) throws IOException {
        try {
            unzip(zip, destination, name, StandardCharsets.UTF_8);
        } catch (ZipException | IllegalArgumentException e) {
            log.debug("{}: lettura UTF-8 fallita ({}), nuovo tentativo con {}", name, e.getMessage(), LEGACY_ENTRY_CHARSET);
            unzip(zip, destination, name, LEGACY_ENTRY_CHARSET);
        }
    }

    private static void unzip(Path zip, Path destination, String name, Charset charset) throws IOException {
        Path root = destination.toRealPath();
        try (ZipFile zf = open(zip, charset)) {
            Enumeration<? extends ZipEntry> entries = zf.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                String entryName = entry.getName();
                if (entryName.startsWith("__MACOSX/") || entryName.contains("/._")) {
                    continue;
                }
                Path target;
                try {
                    target = root.resolve(entryName).normalize();
                } catch (InvalidPathException e) {
                    log.warn("{}: voce con nome non valido ignorata: {}", name, e.getMessage());
                    continue;
                }
                if (!target.startsWith(root)) {
                    log.warn("{}: voce {} fuori dalla directory di destinazione, ignorata", name, entryName);
                    continue;
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else {
                    Files.createDirectories(target.getParent());
                    try (InputStream is = zf.getInputStream(entry)) {
                        Files.copy(is, target, StandardCopyOption.REPLACE_EXISTING);
                    }
                }
            }
        }
    }

    private static List<Path> listFiles(Path dir) throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
    }

    private static void release(Path scratch) {
        if (scratch == null) return;
        try {
            FileSystemUtils.deleteRecursively(scratch);
            log.trace("Directory temporanea rimossa: {}", scratch);
        } catch (IOException e) {
            log.warn("Impossibile rimuovere la directory temporanea {}: {}", scratch, e.getMessage());
        }
    }
}
