package it.aw.editalanalysis.ingest;

import it.aw.editalanalysis.Fixtures;
import it.aw.editalanalysis.config.AnalysisSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectoryIngestorTest {

    @TempDir
    Path bundle;

    private final AnalysisSettings settings = AnalysisSettings.defaults();
    private final DirectoryIngestor ingestor = new DirectoryIngestor(new FormatExtractor(settings), settings);

    @Nested
    @DisplayName("Contenuto insufficiente")
    class Insufficient {

        @Test
        @DisplayName("solo metadata.json: InsufficientContent")
        void onlyMetadata() throws Exception {
            Fixtures.text(bundle.resolve("metadata.json"), "{\"bid_number\":\"123\"}");

            IngestionResult result = ingestor.ingest(bundle);

            assertThat(result).isInstanceOf(IngestionResult.InsufficientContent.class);
            assertThat(((IngestionResult.InsufficientContent) result).message())
                    .isEqualTo("Apenas metadata.json encontrado. Não há arquivos de conteúdo para análise.");
        }

        @Test
        @DisplayName("tutti i file di contenuto in errore: elenco dei nomi nel messaggio")
        void allContentFailed() throws Exception {
            Fixtures.text(bundle.resolve("metadata.json"), "{\"bid_number\":\"123\"}");
            Fixtures.text(bundle.resolve("vazio.txt"), "");
            Fixtures.text(bundle.resolve("quebrado.pdf"), "nao e pdf");

            IngestionResult.InsufficientContent result = (IngestionResult.InsufficientContent) ingestor.ingest(bundle);

            assertThat(result.failedFiles()).containsExactly("quebrado.pdf", "vazio.txt");
            assertThat(result.message())
                    .startsWith("Não foi possível extrair conteúdo de nenhum arquivo de conteúdo.")
                    .endsWith("Arquivos com erro: quebrado.pdf, vazio.txt");
        }

        @Test
        @DisplayName("directory vuota: InsufficientContent")
        void emptyBundle() throws Exception {
            assertThat(ingestor.ingest(bundle)).isInstanceOf(IngestionResult.InsufficientContent.class);
        }
    }

    @Nested
    @DisplayName("Aggregazione")
    class Aggregation {

        @Test
        @DisplayName("file con intestazione, metadata senza parametri di analisi, testo normalizzato")
        void aggregatesWithHeaders() throws Exception {
            Fixtures.text(bundle.resolve("metadata.json"), "{\"bid_number\":\"123\",\"threshold\":500,\"target\":\"notebooks\"}");
            Fixtures.text(bundle.resolve("edital.txt"), "Objeto :   aquisição de   notebooks\r\n\r\n\r\nItem 1 ;  750");

            IngestionResult.Success result = (IngestionResult.Success) ingestor.ingest(bundle);

            assertThat(result.text()).contains("=== edital.txt ===\nObjeto: aquisição de notebooks\nItem 1; 750");
            assertThat(result.text()).contains("=== metadata.json ===").contains("\"bid_number\"");
            assertThat(result.text()).doesNotContain("threshold").doesNotContain("\"target\"");
            assertThat(TextNormalizer.normalize(result.text())).isEqualTo(result.text());
        }

        @Test
        @DisplayName("metadata illeggibile non conta come fallimento di contenuto")
        void brokenMetadataIsNotAContentFailure() throws Exception {
            Fixtures.text(bundle.resolve("metadata.json"), "{ quebrado");
            Fixtures.text(bundle.resolve("edital.md"), "# Pregão 12/2024");

            assertThat(ingestor.ingest(bundle)).isInstanceOf(IngestionResult.Success.class);
        }

        @Test
        @DisplayName("le sottodirectory vengono visitate")
        void walksSubdirectories() throws Exception {
            Files.createDirectories(bundle.resolve("anexos"));
            Fixtures.text(bundle.resolve("anexos/planilha.csv"), "item,qtd\nnotebook,750");

            IngestionResult.Success result = (IngestionResult.Success) ingestor.ingest(bundle);

            assertThat(result.text()).contains("=== planilha.csv ===").contains("notebook | 750");
        }

        @Test
        @DisplayName("uno ZIP nel bundle passa dall'estrattore di archivi")
        void zipInBundle() throws Exception {
            Fixtures.zip(bundle.resolve("anexos.zip"), Fixtures.entries("termo.txt", "Termo de referência"));

            IngestionResult.Success result = (IngestionResult.Success) ingestor.ingest(bundle);

            assertThat(result.text()).contains("=== anexos.zip ===").contains("=== termo.txt ===");
        }

        @Test
        @DisplayName("ZIP con voce dal nome non valido accanto a un file buono: Success")
        void brokenZipDoesNotSinkSiblings() throws Exception {
            Fixtures.text(bundle.resolve("edital.txt"), "Pregão para aquisição de 750 notebooks.");
            Fixtures.zip(bundle.resolve("anexos.zip"), Fixtures.entries("bad\u0000name.txt", "x"));

            IngestionResult result = ingestor.ingest(bundle);

            assertThat(result).isInstanceOf(IngestionResult.Success.class);
            assertThat(((IngestionResult.Success) result).text())
                    .contains("=== edital.txt ===")
                    .contains("750 notebooks")
                    .doesNotContain("=== anexos.zip ===");
        }

        @Test
        @DisplayName("ZIP con nomi CP437 come unico contenuto: estratto")
        void legacyZipAsOnlyContent() throws Exception {
            Fixtures.zip(bundle.resolve("anexos.zip"),
                    Fixtures.entries("Especificação.txt", "Notebook Intel Core i5, 750 unidades"),
                    Charset.forName("IBM437"));

            IngestionResult result = ingestor.ingest(bundle);

            assertThat(result).isInstanceOf(IngestionResult.Success.class);
            assertThat(((IngestionResult.Success) result).text()).contains("750 unidades");
        }
    }

    @Nested
    @DisplayName("Limite di dimensione")
    class SizeLimit {

        @Test
        @DisplayName("esattamente maxChars passa, un carattere in meno di limite fallisce")
        void boundary() throws Exception {
            Fixtures.text(bundle.resolve("edital.txt"), "Pregão eletrônico para aquisição de 750 notebooks.");
            int size = ((IngestionResult.Success) ingestor.ingest(bundle)).text().length();

            assertThat(ingestor.ingest(bundle, size)).isInstanceOf(IngestionResult.Success.class);

            IngestionResult tooLarge = ingestor.ingest(bundle, size - 1);
            assertThat(tooLarge).isInstanceOf(IngestionResult.DocumentTooLarge.class);
            assertThat(((IngestionResult.DocumentTooLarge) tooLarge).actualChars()).isEqualTo(size);
            assertThat(((IngestionResult.DocumentTooLarge) tooLarge).maxChars()).isEqualTo(size - 1);
        }
    }

    @Test
    @DisplayName("bundle inesistente: FileNotFoundException con il percorso")
    void missingBundle() {
        Path missing = bundle.resolve("nao-existe");

        assertThatThrownBy(() -> ingestor.ingest(missing))
                .isInstanceOf(FileNotFoundException.class)
                .hasMessage("Diretório não encontrado: " + missing);
    }
}
