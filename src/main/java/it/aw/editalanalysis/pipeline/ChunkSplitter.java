package it.aw.editalanalysis.pipeline;

import it.aw.editalanalysis.model.ChunkingParams;
import it.aw.editalanalysis.model.TextChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Divide il testo in finestre sovrapposte, allineate alla fine di frase quando possibile.
 * <p>
 * Scansione greedy in avanti: se la finestra non arriva in fondo al testo si cerca
 * all'indietro l'ultimo '.' oltre la metà della finestra e lo si usa come confine.
 * La finestra successiva parte da {@code end - overlap}, ma sempre almeno un carattere
 * più avanti della precedente, così la sequenza termina anche con overlap &gt;= chunkSize.
 */
public class ChunkSplitter {

    private static final Logger log = LoggerFactory.getLogger(ChunkSplitter.class);

    private final ChunkingParams defaults;

    public ChunkSplitter(ChunkingParams defaults) {
        this.defaults = defaults;
    }

    public List<TextChunk> split(String text) {
        return split(text, defaults);
    }

    public List<TextChunk> split(String text, ChunkingParams params) {
        List<TextChunk> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) return chunks;

        int size = params.chunkSize();
        int n = text.length();
        int start = 0;
        while (start < n) {
            int end = Math.min(start + size, n);
            if (end < n) {
                int dot = text.lastIndexOf('.', end - 1);
                if (dot > start + size / 2) {
                    end = dot + 1;
                }
            }
            chunks.add(new TextChunk(chunks.size(), text.substring(start, end), start, end));
            if (end >= n) break;
            start = Math.max(end - params.overlap(), start + 1);
        }

        log.debug("Chunking: {} caratteri -> {} chunk (size={}, overlap={})",
                n, chunks.size(), size, params.overlap());
        return chunks;
    }
}
