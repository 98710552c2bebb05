package it.aw.editalanalysis.ingest;

import java.util.List;

/**
 * Esito dell'ingestione di un bundle. I due casi di fallimento sono esiti di dominio,
 * non errori infrastrutturali: lo stage di estrazione li converte in stato terminale.
 */
public sealed interface IngestionResult {

    /** Testo aggregato, normalizzato ed entro il limite. */
    record Success(String text) implements IngestionResult {}

    /** Solo metadata, oppure tutti i file di contenuto in errore. */
    record InsufficientContent(String message, List<String> failedFiles) implements IngestionResult {
        public InsufficientContent {
            failedFiles = List.copyOf(failedFiles);
        }
    }

    /** Testo normalizzato oltre il tetto configurato. */
    record DocumentTooLarge(int maxChars, int actualChars) implements IngestionResult {

        public String message() {
            return "Não foi possível processar a análise por completo pois o documento é muito grande "
                    + "(tamanho atual: " + actualChars + " caracteres, limite: " + maxChars + " caracteres). "
                    + "Por segurança, o edital foi marcado como não relevante.";
        }
    }
}
