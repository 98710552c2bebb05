package it.aw.editalanalysis.model;

/**
 * Esito terminale di uno stage della pipeline.
 *
 * @param errorMessage  messaggio tecnico (finisce in {@code errorMessage} dello stato)
 * @param justification spiegazione leggibile per l'utente finale
 */
public record PipelineFault(String errorMessage, String justification) {

    public static PipelineFault of(String message) {
        return new PipelineFault(message, message);
    }
}
