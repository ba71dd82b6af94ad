package im.arun.docingest.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import im.arun.docingest.config.ConfigLoader;
import im.arun.docingest.config.IngestConfig;
import im.arun.docingest.ingest.IngestionOrchestrator;
import im.arun.docingest.ingest.IngestionReport;
import im.arun.docingest.ingest.IngestionRequest;
import im.arun.docingest.ingest.RunStatus;
import im.arun.docingest.model.ExtractionField;
import im.arun.docingest.model.ProjectSettings;
import im.arun.docingest.model.SeparationMethod;
import im.arun.docingest.model.SeparationPolicy;
import im.arun.docingest.model.UploadUnit;
import im.arun.docingest.persistence.JsonDirectoryPersistenceGateway;
import im.arun.docingest.quota.InMemoryQuotaService;
import im.arun.docingest.quota.QuotaService;
import im.arun.docingest.recognition.HttpRecognitionService;
import im.arun.docingest.util.ExecutorProvider;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface: recognise a set of files into a batch directory.
 */
@Command(
    name = "doc-ingest",
    description = "Split, recognise and store uploaded documents into a batch",
    mixinStandardHelpOptions = true,
    version = "doc-ingest 1.0"
)
public class IngestCLI implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "PDF or image files to ingest")
    private List<File> files;

    @Option(names = {"--project"}, description = "Project id", required = true)
    private String projectId;

    @Option(names = {"--batch"}, description = "Batch id (directory under --output)", required = true)
    private String batchId;

    @Option(names = {"--output"}, description = "Root directory for batches", defaultValue = "./batches")
    private Path outputDir;

    @Option(names = {"--create-batch"}, negatable = true, defaultValue = "true",
            description = "Create the batch if it does not exist (default: ${DEFAULT-VALUE})")
    private boolean createBatch;

    @Option(names = {"--separation"}, description = "Separation method: ${COMPLETION-CANDIDATES}", defaultValue = "NONE")
    private SeparationMethod separation;

    @Option(names = {"--pages-per-document"}, description = "Pages per document for PAGE_COUNT", defaultValue = "1")
    private int pagesPerDocument;

    @Option(names = {"--blank-threshold"}, description = "Characters below which a page is blank", defaultValue = "50")
    private int blankThreshold;

    @Option(names = {"--separator-pattern"}, description = "Text marking a separator sheet (repeatable)")
    private List<String> separatorPatterns = new ArrayList<>();

    @Option(names = {"--fields"}, split = ",", description = "Extraction field names")
    private List<String> fields = new ArrayList<>();

    @Option(names = {"--table-fields"}, split = ",", description = "Line item field names")
    private List<String> tableFields = new ArrayList<>();

    @Option(names = {"--check-scanning"}, description = "Extract MICR line fields")
    private boolean checkScanning;

    @Option(names = {"--tenant"}, description = "Tenant / customer id")
    private String tenantId;

    @Option(names = {"--quota"}, description = "Remaining document capacity (unlimited when omitted)")
    private Integer quota;

    @Option(names = {"--workers"}, description = "Concurrent workers")
    private Integer workers;

    @Option(names = {"--endpoint"}, description = "Recognition service URL")
    private String endpoint;

    @Option(names = {"--api-key"}, description = "Recognition API key (or set RECOGNITION_API_KEY env var)")
    private String apiKey;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--report"}, description = "Write the run report to this file instead of stdout")
    private Path reportPath;

    @Override
    public Integer call() throws Exception {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("workerCount", workers);
        overrides.put("endpoint", endpoint);
        overrides.put("apiKey", apiKey);
        IngestConfig config = new ConfigLoader(configPath).load(overrides);

        List<UploadUnit> uploads = new ArrayList<>();
        for (File file : files) {
            if (!file.isFile()) {
                System.err.println("Error: file not found: " + file);
                return 1;
            }
            uploads.add(new UploadUnit(Files.readAllBytes(file.toPath()), Files.probeContentType(file.toPath()), file.getName()));
        }

        JsonDirectoryPersistenceGateway persistence = new JsonDirectoryPersistenceGateway(outputDir);
        if (createBatch) {
            persistence.createBatch(batchId);
        }
        QuotaService quotaService = quota != null ? InMemoryQuotaService.withRemaining(quota) : InMemoryQuotaService.unlimited();

        IngestionOrchestrator orchestrator = new IngestionOrchestrator(
                config, new HttpRecognitionService(config), persistence, quotaService);

        IngestionRequest request = IngestionRequest.builder()
                .projectId(projectId)
                .batchId(batchId)
                .settings(buildSettings())
                .files(uploads)
                .build();

        System.err.println("Ingesting " + uploads.size() + " file(s) into batch " + batchId);
        IngestionReport report = orchestrator.run(request);

        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        String json = mapper.writeValueAsString(report);

        if (reportPath != null) {
            Files.writeString(reportPath, json);
            System.err.println("Report written to: " + reportPath);
        } else {
            System.out.println(json);
        }

        return exitCode(report.getStatus());
    }

    ProjectSettings buildSettings() {
        ProjectSettings.ProjectSettingsBuilder settings = ProjectSettings.builder()
                .checkedFieldsEnabled(checkScanning)
                .tenantId(tenantId)
                .separationPolicy(buildPolicy());
        fields.forEach(name -> settings.extractionField(ExtractionField.of(name.trim())));
        tableFields.forEach(name -> settings.tableField(ExtractionField.of(name.trim())));
        return settings.build();
    }

    private SeparationPolicy buildPolicy() {
        switch (separation) {
            case PAGE_COUNT:
                return SeparationPolicy.pageCount(pagesPerDocument);
            case BLANK_PAGE:
                return SeparationPolicy.blankPage(blankThreshold);
            case BARCODE:
                return SeparationPolicy.barcode(separatorPatterns);
            case NONE:
            default:
                return SeparationPolicy.none();
        }
    }

    static int exitCode(RunStatus status) {
        return status == RunStatus.SUCCEEDED || status == RunStatus.PARTIAL_SUCCESS ? 0 : 1;
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new CommandLine(new IngestCLI()).execute(args);
        } finally {
            ExecutorProvider.shutdown();
        }
        System.exit(exitCode);
    }
}
