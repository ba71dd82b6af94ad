package im.arun.docingest.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.docingest.ingest.RunStatus;
import im.arun.docingest.model.ExtractionField;
import im.arun.docingest.model.ProjectSettings;
import im.arun.docingest.model.SeparationMethod;
import im.arun.docingest.testsupport.TestImages;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class IngestCLITest {

    @Test
    void buildsSettingsFromOptions() {
        IngestCLI cli = new IngestCLI();
        new CommandLine(cli).parseArgs(
                "--project", "p", "--batch", "b",
                "--separation", "PAGE_COUNT", "--pages-per-document", "3",
                "--fields", "invoice_number, total", "--table-fields", "amount",
                "--check-scanning", "--tenant", "acme",
                "scan.pdf");

        ProjectSettings settings = cli.buildSettings();

        assertThat(settings.getSeparationPolicy().getMethod()).isEqualTo(SeparationMethod.PAGE_COUNT);
        assertThat(settings.getSeparationPolicy().getPagesPerDocument()).isEqualTo(3);
        assertThat(settings.getExtractionFields()).extracting(ExtractionField::getName)
                .containsExactly("invoice_number", "total");
        assertThat(settings.getTableFields()).extracting(ExtractionField::getName).containsExactly("amount");
        assertThat(settings.isCheckedFieldsEnabled()).isTrue();
        assertThat(settings.getTenantId()).isEqualTo("acme");
    }

    @Test
    void defaultsToNoSeparation() {
        IngestCLI cli = new IngestCLI();
        new CommandLine(cli).parseArgs("--project", "p", "--batch", "b", "a.png");

        assertThat(cli.buildSettings().getSeparationPolicy().getMethod()).isEqualTo(SeparationMethod.NONE);
    }

    @Test
    void exitCodes() {
        assertThat(IngestCLI.exitCode(RunStatus.SUCCEEDED)).isZero();
        assertThat(IngestCLI.exitCode(RunStatus.PARTIAL_SUCCESS)).isZero();
        assertThat(IngestCLI.exitCode(RunStatus.FAILED)).isEqualTo(1);
        assertThat(IngestCLI.exitCode(RunStatus.PRECONDITION_FAILED)).isEqualTo(1);
    }

    /**
     * End to end: an image is recognized by the HTTP service and stored in the batch directory.
     */
    @Test
    void ingestsIntoBatchDirectory(@TempDir Path dir) throws Exception {
        Path image = dir.resolve("receipt.png");
        Files.write(image, TestImages.png(200, 300));
        Path output = dir.resolve("batches");
        Path report = dir.resolve("report.json");

        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setBody("{\"text\":\"TOTAL 9.99\",\"metadata\":{\"total\":\"9.99\"}}"));
            server.start();

            int exitCode = new CommandLine(new IngestCLI()).execute(
                    "--project", "p1", "--batch", "b1",
                    "--output", output.toString(),
                    "--endpoint", server.url("/ocr-scan").toString(),
                    "--report", report.toString(),
                    image.toString());

            assertThat(exitCode).isZero();
            assertThat(server.getRequestCount()).isEqualTo(1);
        }

        JsonNode json = new ObjectMapper().readTree(report.toFile());
        assertThat(json.get("status").asText()).isEqualTo("SUCCEEDED");
        assertThat(json.get("documents").get(0).get("name").asText()).isEqualTo("receipt.png");
        try (Stream<Path> files = Files.list(output.resolve("b1"))) {
            assertThat(files.count()).isEqualTo(2);
        }
    }

    @Test
    void missingFileFails(@TempDir Path dir) {
        int exitCode = new CommandLine(new IngestCLI()).execute(
                "--project", "p1", "--batch", "b1",
                "--output", dir.toString(),
                dir.resolve("absent.pdf").toString());

        assertThat(exitCode).isEqualTo(1);
    }
}
