package it.aw.editalanalysis.ingest;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Tipologia di file, risolta una volta sola dall'estensione.
 * Ogni tipo ha un estrattore dedicato; UNKNOWN ricade sulla decodifica testuale generica.
 */
public enum FileKind {

    PDF(Set.of(".pdf")),
    DOCX(Set.of(".docx")),
    DOC(Set.of(".doc")),
    TEXT(Set.of(".md", ".markdown", ".txt")),
    CSV(Set.of(".csv")),
    JSON(Set.of(".json")),
    ZIP(Set.of(".zip")),
    UNKNOWN(Set.of());

    /** Archivi riconosciuti ma non espansi: vengono letti come testo generico. */
    private static final Set<String> OTHER_ARCHIVES = Set.of(".rar", ".7z", ".gz", ".bz2", ".tgz", ".tar");

    private final Set<String> extensions;

    FileKind(Set<String> extensions) {
        this.extensions = extensions;
    }

    public static FileKind of(Path path) {
        String ext = extensionOf(path.getFileName().toString());
        for (FileKind kind : values()) {
            if (kind.extensions.contains(ext)) return kind;
        }
        return UNKNOWN;
    }

    public static boolean isOtherArchive(Path path) {
        return OTHER_ARCHIVES.contains(extensionOf(path.getFileName().toString()));
    }

    static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot >= 0 ? filename.substring(dot).toLowerCase(Locale.ROOT) : "";
    }
}
