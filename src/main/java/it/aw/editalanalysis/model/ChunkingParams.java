package it.aw.editalanalysis.model;

/**
 * Parametri di chunking per le chiamate al modello che lavorano su finestre di testo.
 * <p>
 * Un overlap maggiore o uguale a chunkSize è ammesso: lo splitter garantisce comunque
 * l'avanzamento di almeno un carattere per finestra.
 */
public record ChunkingParams(int chunkSize, int overlap) {

    public static final int DEFAULT_CHUNK_SIZE = 15_000;
    public static final int DEFAULT_OVERLAP    = 1_000;

    /** Costruttore compatto con validazione. */
    public ChunkingParams {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize deve essere >= 1 (ricevuto: " + chunkSize + ")");
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap deve essere >= 0 (ricevuto: " + overlap + ")");
        }
    }

    public static ChunkingParams defaults() {
        return new ChunkingParams(DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP);
    }
}
