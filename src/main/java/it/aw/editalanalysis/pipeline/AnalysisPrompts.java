package it.aw.editalanalysis.pipeline;

import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

/**
 * Prompt di sistema e schemi di risposta per le quattro chiamate al modello.
 * I testi sono in portoghese come i documenti analizzati.
 */
final class AnalysisPrompts {

    private AnalysisPrompts() {}

    // ── Summary ─────────────────────────────────────────────────────────────

    static final String SUMMARY_SYSTEM = """
            Você é um especialista em resumir editais de licitação.
            Gere um resumo detalhado e estruturado do edital, com no máximo 1500 palavras, cobrindo
            objeto, quantidades e especificações, prazos e valores, requisitos técnicos e condições comerciais.
            Identifique também a cidade/UF do edital (no metadata ou no texto), os contatos (phone, website, email)
            e preencha title, object, quantities, specifications, deadlines e values em texto livre.
            Use string vazia para qualquer informação não encontrada.
            """;

    static final JsonSchema SUMMARY_SCHEMA = JsonSchema.builder()
            .name("edital_summary")
            .rootElement(JsonObjectSchema.builder()
                    .addStringProperty("summary")
                    .addStringProperty("city")
                    .addStringProperty("phone")
                    .addStringProperty("website")
                    .addStringProperty("email")
                    .addStringProperty("title")
                    .addStringProperty("object")
                    .addStringProperty("quantities")
                    .addStringProperty("specifications")
                    .addStringProperty("deadlines")
                    .addStringProperty("values")
                    .required("summary", "city", "phone", "website", "email", "title",
                            "object", "quantities", "specifications", "deadlines", "values")
                    .build())
            .build();

    static String summaryUser(String target, String metadataJson, String content) {
        return "Target: " + target
                + "\n\nMetadata:\n" + metadataJson
                + "\n\nConteúdo do Edital:\n" + content;
    }

    // ── Target ──────────────────────────────────────────────────────────────

    static final String TARGET_SYSTEM = """
            Você é um especialista em análise de editais de licitação.
            Decida se o edital é relevante para o target informado, considerando sinônimos e termos relacionados,
            especificações técnicas que indiquem o tipo de equipamento e o contexto de uso do equipamento ou serviço.
            """;

    static final JsonSchema TARGET_SCHEMA = JsonSchema.builder()
            .name("target_analysis")
            .rootElement(JsonObjectSchema.builder()
                    .addBooleanProperty("is_relevant")
                    .addNumberProperty("confidence")
                    .addProperty("matching_terms", JsonArraySchema.builder()
                            .items(JsonStringSchema.builder().build())
                            .build())
                    .addStringProperty("explanation")
                    .required("is_relevant", "confidence", "matching_terms", "explanation")
                    .build())
            .build();

    static String targetUser(String target, String summary, String object, String specifications, String quantities) {
        return "Target: " + target
                + "\n\nResumo do Edital:\n" + summary
                + "\n\nInformações Adicionais:"
                + "\n- Objeto: " + object
                + "\n- Especificações: " + specifications
                + "\n- Quantidades: " + quantities;
    }

    // ── Quantità ────────────────────────────────────────────────────────────

    static final String QUANTITY_SYSTEM = """
            Você é um especialista em análise de quantidades em editais.
            Você recebe um trecho do edital. Identifique as quantidades relevantes para o target,
            some-as dentro do trecho, informe a unidade de medida e explique como chegou ao total.
            Se o trecho não mencionar quantidades do target, responda total_quantity = 0.
            Exemplo: {"total_quantity": 100, "unit": "unidades", "explanation": "100 unidades no item 1"}
            """;

    static final JsonSchema QUANTITY_SCHEMA = JsonSchema.builder()
            .name("quantity_estimate")
            .rootElement(JsonObjectSchema.builder()
                    .addIntegerProperty("total_quantity")
                    .addStringProperty("unit")
                    .addStringProperty("explanation")
                    .required("total_quantity", "unit", "explanation")
                    .build())
            .build();

    static String quantityUser(String target, int threshold, int chunkNumber, int chunkCount, String chunk) {
        return "Target: " + target
                + "\nThreshold: " + threshold
                + "\n\nTrecho " + chunkNumber + " de " + chunkCount + ":\n" + chunk;
    }

    // ── Justification ───────────────────────────────────────────────────────

    static final String JUSTIFICATION_SYSTEM = """
            Você é um especialista em justificar decisões sobre editais.
            Gere uma justificativa direta, com no máximo 2 frases e 50 palavras.
            Regras: o edital é relevante quando target_match = true e (threshold = 0 ou threshold_match = "true").
            Se não relevante, explique se o target não foi encontrado ou se a quantidade é insuficiente ou indeterminada.
            Se relevante, explique por que o target é relevante ou por que a quantidade é suficiente.
            """;

    static String justificationUser(String target, boolean targetMatch, String thresholdMatch,
                                    int threshold, String summary) {
        return "Target: " + target
                + "\nTarget Match: " + targetMatch
                + "\nThreshold Match: " + thresholdMatch
                + "\nThreshold: " + threshold
                + "\n\nResumo do Edital:\n" + summary;
    }
}
