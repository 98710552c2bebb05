package it.aw.editalanalysis.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.editalanalysis.Fixtures;
import it.aw.editalanalysis.config.AnalysisSettings;
import it.aw.editalanalysis.ingest.DirectoryIngestor;
import it.aw.editalanalysis.ingest.EncodingDecoder;
import it.aw.editalanalysis.ingest.FormatExtractor;
import it.aw.editalanalysis.ingest.MetadataReader;
import it.aw.editalanalysis.llm.LanguageModelService;
import it.aw.editalanalysis.model.AnalysisRequest;
import it.aw.editalanalysis.model.ChunkingParams;
import it.aw.editalanalysis.model.PipelineState;
import it.aw.editalanalysis.model.ThresholdStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AnalysisPipelineTest {

    private static final String SUMMARY_RESPONSE = """
            {"summary": "Pregão eletrônico para aquisição de 750 notebooks para as escolas municipais.",
             "city": "Recife", "phone": "", "website": "", "email": "licitacao@recife.pe.gov.br",
             "title": "Pregão Eletrônico 12/2024", "object": "Aquisição de notebooks",
             "quantities": "750 notebooks", "specifications": "Intel Core i5, 8GB RAM",
             "deadlines": "", "values": ""}
            """;

    private static final String TARGET_MATCH = """
            {"is_relevant": true, "confidence": 0.95, "matching_terms": ["notebook"], "explanation": "Compra de notebooks"}
            """;

    private static final String TARGET_NO_MATCH = """
            {"is_relevant": false, "confidence": 0.9, "matching_terms": [], "explanation": "Serviço de limpeza"}
            """;

    private static final String QUANTITY_750 = """
            {"total_quantity": 750, "unit": "unidades", "explanation": "Item 1: 750 notebooks"}
            """;

    @TempDir
    Path bundle;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private LanguageModelService model;

    @BeforeEach
    void setUp() {
        model = mock(LanguageModelService.class);
    }

    private AnalysisPipeline pipeline(AnalysisSettings settings, ChunkSplitter splitter) {
        return AnalysisPipeline.standard(
                new MetadataReader(new EncodingDecoder(), objectMapper),
                new DirectoryIngestor(new FormatExtractor(settings), settings),
                model,
                splitter,
                new QuantityReconciler(objectMapper),
                objectMapper);
    }

    private AnalysisPipeline pipeline() {
        AnalysisSettings settings = AnalysisSettings.defaults();
        return pipeline(settings, new ChunkSplitter(settings.chunking()));
    }

    private void notebookBundle() throws IOException {
        Fixtures.text(bundle.resolve("metadata.json"), """
                {"bid_number": "PE-12/2024", "city": "Recife", "object": "Aquisição de notebooks",
                 "threshold": 500, "target": "notebooks"}
                """);
        Fixtures.text(bundle.resolve("edital.txt"), """
                PREGÃO ELETRÔNICO Nº 12/2024
                Objeto: aquisição de notebooks para as escolas da rede municipal.
                Item 1 - Notebook Intel Core i5, 8GB RAM, SSD 256GB - Quantidade: 750 unidades.
                """);
    }

    private void answerSummaryAndTarget(String targetResponse) {
        when(model.complete(eq(AnalysisPrompts.SUMMARY_SYSTEM), anyString(), any())).thenReturn(SUMMARY_RESPONSE);
        when(model.complete(eq(AnalysisPrompts.TARGET_SYSTEM), anyString(), any())).thenReturn(targetResponse);
    }

    private void answerJustification(String text) {
        when(model.complete(eq(AnalysisPrompts.JUSTIFICATION_SYSTEM), anyString(), any())).thenReturn(text);
    }

    private AnalysisRequest request(int threshold) {
        return AnalysisRequest.of(bundle.toString(), "notebooks", threshold);
    }

    // ── Esiti completi ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("Analisi completa")
    class FullRun {

        @Test
        @DisplayName("750 notebook con threshold 500: rilevante")
        void relevantAboveThreshold() throws Exception {
            notebookBundle();
            answerSummaryAndTarget(TARGET_MATCH);
            when(model.complete(eq(AnalysisPrompts.QUANTITY_SYSTEM), anyString(), any())).thenReturn(QUANTITY_750);
            answerJustification("O edital prevê 750 notebooks, acima do mínimo de 500.");

            PipelineState state = pipeline().run(request(500));

            assertThat(state.hasError()).isFalse();
            assertThat(state.getBidNumber()).isEqualTo("PE-12/2024");
            assertThat(state.getCity()).isEqualTo("Recife");
            assertThat(state.isTargetMatch()).isTrue();
            assertThat(state.getThresholdMatch()).isEqualTo(ThresholdStatus.TRUE);
            assertThat(state.isRelevant()).isTrue();
            assertThat(state.metadataValue("quantities")).isEqualTo("750 unidades - Item 1: 750 notebooks");
            assertThat(state.metadataValue("email")).isEqualTo("licitacao@recife.pe.gov.br");
            assertThat(state.getJustification()).isEqualTo("O edital prevê 750 notebooks, acima do mínimo de 500.");
        }

        @Test
        @DisplayName("750 notebook con threshold 1000: non rilevante")
        void belowThreshold() throws Exception {
            notebookBundle();
            answerSummaryAndTarget(TARGET_MATCH);
            when(model.complete(eq(AnalysisPrompts.QUANTITY_SYSTEM), anyString(), any())).thenReturn(QUANTITY_750);
            answerJustification("A quantidade de 750 é inferior ao mínimo de 1000.");

            PipelineState state = pipeline().run(request(1000));

            assertThat(state.hasError()).isFalse();
            assertThat(state.isTargetMatch()).isTrue();
            assertThat(state.getThresholdMatch()).isEqualTo(ThresholdStatus.FALSE);
            assertThat(state.isRelevant()).isFalse();
            assertThat(state.getJustification()).isNotBlank();
        }

        @Test
        @DisplayName("threshold 0: nessuna stima di quantità richiesta")
        void zeroThresholdSkipsQuantities() throws Exception {
            notebookBundle();
            answerSummaryAndTarget(TARGET_MATCH);
            answerJustification("Edital relevante para notebooks.");

            PipelineState state = pipeline().run(request(0));

            assertThat(state.getThresholdMatch()).isEqualTo(ThresholdStatus.TRUE);
            assertThat(state.isRelevant()).isTrue();
            assertThat(state.metadataValue("quantities")).isEqualTo("750 notebooks");
            verify(model, never()).complete(eq(AnalysisPrompts.QUANTITY_SYSTEM), anyString(), any());
        }

        @Test
        @DisplayName("target non corrispondente con threshold > 0: nessuna stima, threshold_match false")
        void targetMismatchSkipsQuantities() throws Exception {
            notebookBundle();
            answerSummaryAndTarget(TARGET_NO_MATCH);
            answerJustification("O edital trata de serviço de limpeza.");

            PipelineState state = pipeline().run(request(500));

            assertThat(state.isTargetMatch()).isFalse();
            assertThat(state.getThresholdMatch()).isEqualTo(ThresholdStatus.FALSE);
            assertThat(state.isRelevant()).isFalse();
            verify(model, never()).complete(eq(AnalysisPrompts.QUANTITY_SYSTEM), anyString(), any());
        }

        @Test
        @DisplayName("forceMatch: target_match true anche se il modello risponde false")
        void forceMatch() throws Exception {
            notebookBundle();
            answerSummaryAndTarget(TARGET_NO_MATCH);
            answerJustification("Relevante por decisão do operador.");

            PipelineState state = pipeline().run(new AnalysisRequest(bundle.toString(), "notebooks", 0, true, null));

            assertThat(state.isTargetMatch()).isTrue();
            assertThat(state.isRelevant()).isTrue();
        }

        @Test
        @DisplayName("il prompt di riassunto non contiene i parametri di analisi del metadata")
        void summaryPromptWithoutAnalysisParameters() throws Exception {
            notebookBundle();
            answerSummaryAndTarget(TARGET_MATCH);
            answerJustification("ok");

            pipeline().run(request(0));

            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
            verify(model).complete(eq(AnalysisPrompts.SUMMARY_SYSTEM), prompt.capture(), eq(AnalysisPrompts.SUMMARY_SCHEMA));
            assertThat(prompt.getValue())
                    .contains("PE-12/2024")
                    .contains("Quantidade: 750 unidades")
                    .doesNotContain("\"threshold\"")
                    .doesNotContain("\"target\"");
        }

        @Test
        @DisplayName("città assente ovunque: valore di default")
        void unknownCity() throws Exception {
            Fixtures.text(bundle.resolve("edital.txt"), "Aquisição de notebooks para a secretaria de educação.");
            when(model.complete(eq(AnalysisPrompts.SUMMARY_SYSTEM), anyString(), any()))
                    .thenReturn("{\"summary\": \"Compra de notebooks\", \"city\": \"\"}");
            when(model.complete(eq(AnalysisPrompts.TARGET_SYSTEM), anyString(), any())).thenReturn(TARGET_MATCH);
            answerJustification("ok");

            PipelineState state = pipeline().run(request(0));

            assertThat(state.getCity()).isEqualTo(GenerateSummaryStage.UNKNOWN_CITY);
            assertThat(state.getBidNumber()).isEqualTo(PipelineState.UNKNOWN_BID_NUMBER);
        }
    }

    // ── Quantità ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Stima delle quantità")
    class Quantities {

        @Test
        @DisplayName("più chunk: il totale è il massimo delle stime, non la somma")
        void maximumAcrossChunks() throws Exception {
            StringBuilder text = new StringBuilder();
            for (int i = 1; i <= 20; i++) {
                text.append("Item ").append(i).append(" - Notebook para uso administrativo da secretaria. ");
            }
            Fixtures.text(bundle.resolve("edital.txt"), text.toString());
            answerSummaryAndTarget(TARGET_MATCH);
            when(model.complete(eq(AnalysisPrompts.QUANTITY_SYSTEM), anyString(), any())).thenReturn(
                    "{\"total_quantity\": 300, \"unit\": \"unidades\", \"explanation\": \"lote 1\"}",
                    "{\"total_quantity\": 750, \"unit\": \"unidades\", \"explanation\": \"total geral\"}",
                    "{\"total_quantity\": 500, \"unit\": \"unidades\", \"explanation\": \"lote 2\"}");
            answerJustification("ok");

            AnalysisSettings settings = AnalysisSettings.defaults();
            PipelineState state = pipeline(settings, new ChunkSplitter(new ChunkingParams(200, 20))).run(request(1000));

            verify(model, atLeast(3)).complete(eq(AnalysisPrompts.QUANTITY_SYSTEM), anyString(), eq(AnalysisPrompts.QUANTITY_SCHEMA));
            assertThat(state.getThresholdMatch()).isEqualTo(ThresholdStatus.FALSE);
            assertThat(state.metadataValue("quantities")).isEqualTo("750 unidades - total geral");
        }

        @Test
        @DisplayName("stima malformata e giustificazione vuota: inconclusive con testo di fallback")
        void malformedEstimate() throws Exception {
            notebookBundle();
            answerSummaryAndTarget(TARGET_MATCH);
            when(model.complete(eq(AnalysisPrompts.QUANTITY_SYSTEM), anyString(), any())).thenReturn("não sei");
            answerJustification("   ");

            PipelineState state = pipeline().run(request(500));

            assertThat(state.hasError()).isFalse();
            assertThat(state.getThresholdMatch()).isEqualTo(ThresholdStatus.INCONCLUSIVE);
            assertThat(state.isRelevant()).isFalse();
            assertThat(state.metadataValue("quantities"))
                    .isEqualTo("Erro ao processar quantidades: nenhuma resposta válida em 1 trecho(s)");
            assertThat(state.getJustification())
                    .contains("não foi possível determinar a quantidade")
                    .contains("500");
        }
    }

    // ── Esiti terminali ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("Esiti terminali")
    class Terminal {

        @Test
        @DisplayName("errore del modello nel riassunto: stage successivi saltati")
        void summaryFailure() throws Exception {
            notebookBundle();
            when(model.complete(eq(AnalysisPrompts.SUMMARY_SYSTEM), anyString(), any()))
                    .thenThrow(new IllegalStateException("timeout"));

            PipelineState state = pipeline().run(request(500));

            assertThat(state.hasError()).isTrue();
            assertThat(state.getErrorMessage()).isEqualTo("Erro em generate_summary: timeout");
            assertThat(state.isRelevant()).isFalse();
            assertThat(state.isTargetMatch()).isFalse();
            assertThat(state.getThresholdMatch()).isEqualTo(ThresholdStatus.INCONCLUSIVE);
            verify(model, times(1)).complete(anyString(), anyString(), any());
        }

        @Test
        @DisplayName("risposta di target senza booleano: errore dello stage")
        void invalidTargetResponse() throws Exception {
            notebookBundle();
            answerSummaryAndTarget("{\"is_relevant\": \"talvez\"}");

            PipelineState state = pipeline().run(request(0));

            assertThat(state.hasError()).isTrue();
            assertThat(state.getErrorMessage()).startsWith("Erro em analyze_target:");
            verify(model, never()).complete(eq(AnalysisPrompts.JUSTIFICATION_SYSTEM), anyString(), any());
        }

        @Test
        @DisplayName("solo metadata.json: contenuto insufficiente, nessuna chiamata al modello")
        void onlyMetadata() throws Exception {
            Fixtures.text(bundle.resolve("metadata.json"), "{\"bid_number\": \"PE-1/2024\"}");

            PipelineState state = pipeline().run(request(500));

            assertThat(state.hasError()).isTrue();
            assertThat(state.isRelevant()).isFalse();
            assertThat(state.getBidNumber()).isEqualTo("PE-1/2024");
            assertThat(state.getJustification())
                    .startsWith("Conteúdo insuficiente para análise: Apenas metadata.json encontrado.")
                    .endsWith("Por segurança, o edital foi marcado como não relevante.");
            verifyNoInteractions(model);
        }

        @Test
        @DisplayName("bundle inesistente: errore di elaborazione")
        void missingBundle() {
            Path missing = bundle.resolve("nao-existe");

            PipelineState state = pipeline().run(AnalysisRequest.of(missing.toString(), "notebooks", 0));

            assertThat(state.hasError()).isTrue();
            assertThat(state.getErrorMessage()).isEqualTo("Diretório não encontrado: " + missing);
            assertThat(state.getJustification()).isEqualTo("Erro ao processar edital: Diretório não encontrado: " + missing);
            assertThat(state.getBidNumber()).isEqualTo(PipelineState.UNKNOWN_BID_NUMBER);
            verifyNoInteractions(model);
        }

        @Test
        @DisplayName("documento troppo grande: nessuna chiamata al modello")
        void documentTooLarge() throws Exception {
            notebookBundle();
            AnalysisSettings settings = AnalysisSettings.defaults().withMaxChars(50);

            PipelineState state = pipeline(settings, new ChunkSplitter(settings.chunking())).run(request(500));

            assertThat(state.hasError()).isTrue();
            assertThat(state.isRelevant()).isFalse();
            assertThat(state.getJustification()).isEqualTo(state.getErrorMessage());
            assertThat(state.getJustification()).contains("50");
            verifyNoInteractions(model);
        }

        @Test
        @DisplayName("thread interrotto: analisi fermata prima del primo stage")
        void interrupted() throws Exception {
            notebookBundle();
            Thread.currentThread().interrupt();
            try {
                PipelineState state = pipeline().run(request(500));

                assertThat(state.hasError()).isTrue();
                assertThat(state.getErrorMessage()).isEqualTo("Análise interrompida antes de extract_metadata");
                verifyNoInteractions(model);
            } finally {
                Thread.interrupted();
            }
        }
    }

    @Test
    @DisplayName("sequenza fissa degli stage")
    void stageOrder() {
        assertThat(pipeline().stageNames()).containsExactly(
                "extract_metadata", "extract_content", "generate_summary",
                "analyze_target", "check_threshold", "generate_justification");
    }
}
