package it.aw.editalanalysis.llm;

import dev.langchain4j.model.chat.request.json.JsonSchema;

/**
 * Servizio esterno che esegue i compiti semantici della pipeline.
 * <p>
 * Chiamata sincrona; qualunque errore (rete, timeout, risposta vuota) viene propagato
 * come eccezione e trattato dalla pipeline come fallimento dello stage chiamante.
 */
public interface LanguageModelService {

    /**
     * @param systemPrompt   istruzioni di ruolo
     * @param userPrompt     richiesta con il contenuto da analizzare
     * @param responseSchema schema JSON della risposta; null per testo libero
     * @return il testo della risposta (JSON se è stato passato uno schema)
     */
    String complete(String systemPrompt, String userPrompt, JsonSchema responseSchema);
}
