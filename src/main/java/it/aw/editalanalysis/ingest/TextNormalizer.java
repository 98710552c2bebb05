package it.aw.editalanalysis.ingest;

import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Pulizia del testo estratto: applicata a ogni unità e al testo aggregato del bundle.
 * <ol>
 *   <li>Normalizza i fine riga (CRLF, CR, NEL, LS, PS diventano \n)</li>
 *   <li>Rimuove i caratteri di controllo (tranne \n e \t)</li>
 *   <li>Per ogni riga: comprime gli spazi orizzontali, elimina lo spazio prima
 *       della punteggiatura, rimuove gli spazi agli estremi</li>
 *   <li>Elimina le righe vuote</li>
 * </ol>
 * L'operazione è idempotente: {@code normalize(normalize(x)).equals(normalize(x))}.
 */
public final class TextNormalizer {

    private static final Pattern LINE_BREAKS        = Pattern.compile("\\r\\n|[\\r\\u0085\\u2028\\u2029]");
    private static final Pattern CONTROL_CHARS      = Pattern.compile("[\\p{Cntrl}&&[^\\n\\t]]");
    private static final Pattern HORIZONTAL_SPACES  = Pattern.compile("\\h+");
    private static final Pattern SPACE_BEFORE_PUNCT = Pattern.compile(" (?=[.,;:!?])");

    private TextNormalizer() {}

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) return "";

        String unified = LINE_BREAKS.matcher(text).replaceAll("\n");
        unified = CONTROL_CHARS.matcher(unified).replaceAll("");

        StringJoiner out = new StringJoiner("\n");
        for (String line : unified.split("\n", -1)) {
            String cleaned = HORIZONTAL_SPACES.matcher(line).replaceAll(" ");
            cleaned = SPACE_BEFORE_PUNCT.matcher(cleaned).replaceAll("");
            cleaned = cleaned.strip();
            if (!cleaned.isEmpty()) out.add(cleaned);
        }
        return out.toString();
    }
}
