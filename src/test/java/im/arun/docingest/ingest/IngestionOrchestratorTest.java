package im.arun.docingest.ingest;

import im.arun.docingest.config.IngestConfig;
import im.arun.docingest.image.ImageNormalizer;
import im.arun.docingest.model.ErrorKind;
import im.arun.docingest.model.PdfPage;
import im.arun.docingest.model.ProcessedDocument;
import im.arun.docingest.model.ProjectSettings;
import im.arun.docingest.model.RecognitionRequest;
import im.arun.docingest.model.RecognitionResult;
import im.arun.docingest.model.SeparationPolicy;
import im.arun.docingest.model.UploadUnit;
import im.arun.docingest.pdf.PdfBoundaryAnalyzer;
import im.arun.docingest.pdf.PdfExtractor;
import im.arun.docingest.persistence.DocumentRecord;
import im.arun.docingest.persistence.InMemoryPersistenceGateway;
import im.arun.docingest.persistence.PersistenceException;
import im.arun.docingest.quota.InMemoryQuotaService;
import im.arun.docingest.quota.ResourceGate;
import im.arun.docingest.recognition.FailureCause;
import im.arun.docingest.recognition.RecognitionService;
import im.arun.docingest.scheduler.BoundedWorkScheduler;
import im.arun.docingest.testsupport.StubRecognitionService;
import im.arun.docingest.testsupport.TestImages;
import im.arun.docingest.testsupport.TestPdfs;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class IngestionOrchestratorTest {

    private static final String PROJECT = "project-1";
    private static final String BATCH = "batch-1";

    private IngestConfig config;
    private InMemoryPersistenceGateway persistence;

    @BeforeEach
    void setUp() {
        config = new IngestConfig();
        config.setJournalDirectory(null);
        config.setRetryBaseDelayMs(0);
        config.setMaxImageDimension(600);
        persistence = new InMemoryPersistenceGateway();
        persistence.createBatch(BATCH);
    }

    private IngestionOrchestrator orchestrator(RecognitionService service, InMemoryQuotaService quota) {
        return new IngestionOrchestrator(config, service, persistence, quota);
    }

    private static UploadUnit png(String name) throws IOException {
        return new UploadUnit(TestImages.png(300, 400), "image/png", name);
    }

    private static UploadUnit pdf(String name, byte[] content) {
        return new UploadUnit(content, "application/pdf", name);
    }

    private static IngestionRequest.IngestionRequestBuilder request() {
        return IngestionRequest.builder().projectId(PROJECT).batchId(BATCH);
    }

    /**
     * A 5-page PDF split two pages per document yields three documents named and ordered by page range.
     */
    @Test
    void splitsPdfIntoOrderedDocuments() throws Exception {
        StubRecognitionService service = StubRecognitionService.succeeding();
        InMemoryQuotaService quota = InMemoryQuotaService.withRemaining(10);
        ProjectSettings settings = ProjectSettings.builder().separationPolicy(SeparationPolicy.pageCount(2)).build();

        IngestionReport report = orchestrator(service, quota).run(request()
                .settings(settings)
                .file(pdf("scan.pdf", TestPdfs.textPages(5)))
                .build());

        assertThat(report.getStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(report.getDocuments())
                .extracting(ProcessedDocument::getName, ProcessedDocument::getStartPage, ProcessedDocument::getEndPage)
                .containsExactly(
                        tuple("scan_doc1.pdf", 1, 2),
                        tuple("scan_doc2.pdf", 3, 4),
                        tuple("scan_doc3.pdf", 5, 5));
        assertThat(report.getDocuments()).noneMatch(ProcessedDocument::isImageMode);
        assertThat(persistence.getDocuments(BATCH))
                .extracting(DocumentRecord::getName, DocumentRecord::getOrdinal)
                .containsExactly(tuple("scan_doc1.pdf", 0), tuple("scan_doc2.pdf", 1), tuple("scan_doc3.pdf", 2));
        assertThat(persistence.getBatchState(BATCH)).hasValueSatisfying(state -> {
            assertThat(state.getTotalDocuments()).isEqualTo(3);
            assertThat(state.getProcessedDocuments()).isEqualTo(3);
        });
        assertThat(quota.snapshot().getRemaining()).isEqualTo(7);
        assertThat(service.textRequests()).isEqualTo(3);
    }

    /**
     * A multi-page PDF with no separation configured is split one page per document.
     */
    @Test
    void noSeparationOnMultiPagePdfSplitsPerPage() throws Exception {
        IngestionReport report = orchestrator(StubRecognitionService.succeeding(), InMemoryQuotaService.unlimited())
                .run(request().file(pdf("two.pdf", TestPdfs.textPages(2))).build());

        assertThat(report.getDocuments()).extracting(ProcessedDocument::getName)
                .containsExactly("two_doc1.pdf", "two_doc2.pdf");
    }

    /**
     * A scanned page without a text layer is sent as a bounded image.
     */
    @Test
    void scannedPdfFallsBackToImage() throws Exception {
        StubRecognitionService service = StubRecognitionService.succeeding();

        IngestionReport report = orchestrator(service, InMemoryQuotaService.unlimited())
                .run(request().file(pdf("scan.pdf", TestPdfs.blankPages(1))).build());

        assertThat(report.getStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(report.getDocuments()).singleElement().satisfies(doc -> {
            assertThat(doc.getName()).isEqualTo("scan.pdf");
            assertThat(doc.isImageMode()).isTrue();
        });
        assertThat(service.getRequests()).singleElement()
                .satisfies(r -> assertThat(r.getImage().getLongerEdge()).isLessThanOrEqualTo(600));
        assertThat(persistence.getDocuments(BATCH)).singleElement()
                .satisfies(r -> assertThat(r.getContentRef()).startsWith("data:image/jpeg;base64,"));
    }

    /**
     * With no quota left, an image is rejected before any recognition call.
     */
    @Test
    void zeroQuotaMakesNoCalls() throws Exception {
        StubRecognitionService service = StubRecognitionService.succeeding();

        IngestionReport report = orchestrator(service, InMemoryQuotaService.withRemaining(0))
                .run(request().file(png("receipt.png")).build());

        assertThat(report.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(report.getFailures()).singleElement().satisfies(f -> {
            assertThat(f.getUnitName()).isEqualTo("receipt.png");
            assertThat(f.getErrorKind()).isEqualTo(ErrorKind.QUOTA_EXCEEDED);
        });
        assertThat(service.getCalls()).isZero();
        assertThat(persistence.getDocumentCount()).isZero();
    }

    /**
     * A batch deleted before the run starts stops everything: nothing recognized, saved or consumed.
     */
    @Test
    void deletedBatchIsPreconditionFailure() throws Exception {
        StubRecognitionService service = StubRecognitionService.succeeding();
        InMemoryQuotaService quota = InMemoryQuotaService.withRemaining(5);
        persistence.deleteBatch(BATCH);

        IngestionReport report = orchestrator(service, quota)
                .run(request().file(png("a.png")).file(png("b.png")).build());

        assertThat(report.getStatus()).isEqualTo(RunStatus.PRECONDITION_FAILED);
        assertThat(report.countFailures(ErrorKind.PRECONDITION_FAILED)).isEqualTo(1);
        assertThat(service.getCalls()).isZero();
        assertThat(persistence.getDocumentCount()).isZero();
        assertThat(quota.getConsumedCount()).isZero();
    }

    @Test
    void missingProjectIsPreconditionFailure() throws Exception {
        StubRecognitionService service = StubRecognitionService.succeeding();

        IngestionReport report = orchestrator(service, InMemoryQuotaService.unlimited())
                .run(IngestionRequest.builder().batchId(BATCH).file(png("a.png")).build());

        assertThat(report.getStatus()).isEqualTo(RunStatus.PRECONDITION_FAILED);
        assertThat(report.getFailures()).singleElement()
                .satisfies(f -> assertThat(f.getMessage()).contains("project"));
        assertThat(service.getCalls()).isZero();
    }

    /**
     * A batch deleted mid-run stops further writes; later units are reported against the missing batch.
     */
    @Test
    void batchDeletedMidRunStopsRemainingUnits() throws Exception {
        config.setWorkerCount(1);
        persistence = new InMemoryPersistenceGateway() {
            private final AtomicBoolean deleted = new AtomicBoolean();

            @Override
            public String saveDocument(DocumentRecord record) throws PersistenceException {
                String id = super.saveDocument(record);
                if (deleted.compareAndSet(false, true)) {
                    deleteBatch(record.getBatchId());
                }
                return id;
            }
        };
        persistence.createBatch(BATCH);
        StubRecognitionService service = StubRecognitionService.succeeding();
        InMemoryQuotaService quota = InMemoryQuotaService.withRemaining(10);

        IngestionReport report = orchestrator(service, quota)
                .run(request().file(png("a.png")).file(png("b.png")).file(png("c.png")).build());

        assertThat(report.getStatus()).isEqualTo(RunStatus.PRECONDITION_FAILED);
        assertThat(report.getSavedCount()).isEqualTo(1);
        assertThat(report.getFailedUnitNames()).containsExactly("b.png", "c.png");
        assertThat(report.countFailures(ErrorKind.PRECONDITION_FAILED)).isEqualTo(2);
        assertThat(service.getCalls()).isEqualTo(1);
        assertThat(quota.getConsumedCount()).isEqualTo(1);
    }

    /**
     * One failed save does not stop the others and consumes no quota.
     */
    @Test
    void persistenceFailureIsIsolated() throws Exception {
        persistence = new InMemoryPersistenceGateway() {
            @Override
            public String saveDocument(DocumentRecord record) throws PersistenceException {
                if (record.getName().equals("b.png")) {
                    throw new PersistenceException("disk full");
                }
                return super.saveDocument(record);
            }
        };
        persistence.createBatch(BATCH);
        InMemoryQuotaService quota = InMemoryQuotaService.withRemaining(10);

        IngestionReport report = orchestrator(StubRecognitionService.succeeding(), quota)
                .run(request().file(png("a.png")).file(png("b.png")).file(png("c.png")).build());

        assertThat(report.getStatus()).isEqualTo(RunStatus.PARTIAL_SUCCESS);
        assertThat(report.getDocuments()).extracting(ProcessedDocument::getName).containsExactly("a.png", "c.png");
        assertThat(report.getFailures()).singleElement().satisfies(f -> {
            assertThat(f.getUnitName()).isEqualTo("b.png");
            assertThat(f.getErrorKind()).isEqualTo(ErrorKind.PERSISTENCE_FAILED);
        });
        assertThat(quota.snapshot().getRemaining()).isEqualTo(8);
    }

    /**
     * Concurrent workers never process more documents than the quota allows.
     */
    @Test
    void quotaIsNeverOverrun() throws Exception {
        config.setWorkerCount(3);
        InMemoryQuotaService quota = InMemoryQuotaService.withRemaining(4);
        IngestionRequest.IngestionRequestBuilder request = request();
        for (int i = 0; i < 10; i++) {
            request.file(png("page" + i + ".png"));
        }

        IngestionReport report = orchestrator(StubRecognitionService.succeeding(), quota).run(request.build());

        assertThat(report.getSavedCount()).isEqualTo(4);
        assertThat(report.countFailures(ErrorKind.QUOTA_EXCEEDED)).isEqualTo(6);
        assertThat(quota.snapshot().getRemaining()).isZero();
        assertThat(report.getStatus()).isEqualTo(RunStatus.PARTIAL_SUCCESS);
    }

    @Test
    void unavailableServiceFailsEveryUnit() throws Exception {
        StubRecognitionService service = StubRecognitionService.alwaysFailing(FailureCause.UNREACHABLE);
        InMemoryQuotaService quota = InMemoryQuotaService.withRemaining(5);

        IngestionReport report = orchestrator(service, quota).run(request().file(png("a.png")).build());

        assertThat(report.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(report.countFailures(ErrorKind.RECOGNITION_UNAVAILABLE)).isEqualTo(1);
        assertThat(service.getCalls()).isEqualTo(config.getMaxRetries());
        assertThat(quota.snapshot().getRemaining()).isEqualTo(5);
    }

    /**
     * Corrupt files are reported by name while the rest of the upload proceeds.
     */
    @Test
    void corruptFileDoesNotStopUpload() throws Exception {
        byte[] garbage = "%PDF-1.4 truncated".getBytes(StandardCharsets.UTF_8);

        IngestionReport report = orchestrator(StubRecognitionService.succeeding(), InMemoryQuotaService.unlimited())
                .run(request().file(pdf("broken.pdf", garbage)).file(png("ok.png")).build());

        assertThat(report.getStatus()).isEqualTo(RunStatus.PARTIAL_SUCCESS);
        assertThat(report.getDocuments()).extracting(ProcessedDocument::getName).containsExactly("ok.png");
        assertThat(report.getFailures()).singleElement().satisfies(f -> {
            assertThat(f.getUnitName()).isEqualTo("broken.pdf");
            assertThat(f.getErrorKind()).isEqualTo(ErrorKind.CORRUPT_DOCUMENT);
        });
    }

    /**
     * Extraction settings are forwarded with every request.
     */
    @Test
    void settingsReachTheService() throws Exception {
        StubRecognitionService service = StubRecognitionService.succeeding();
        ProjectSettings settings = ProjectSettings.builder()
                .checkedFieldsEnabled(true)
                .tenantId("tenant-9")
                .build();

        orchestrator(service, InMemoryQuotaService.unlimited())
                .run(request().settings(settings).file(png("a.png")).build());

        assertThat(service.getRequests()).singleElement().satisfies(r -> {
            assertThat(r.isCheckedFieldsEnabled()).isTrue();
            assertThat(r.getTenantId()).isEqualTo("tenant-9");
        });
    }

    /**
     * A background run can be observed and cancelled; units not yet started are reported as cancelled,
     * and a second run on the same batch is refused while the first is active.
     */
    @Test
    void backgroundRunCanBeCancelled() throws Exception {
        config.setWorkerCount(1);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        RecognitionService blocking = (RecognitionRequest request) -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new RecognitionResult("scanned", Map.of(), List.of());
        };
        IngestionOrchestrator orchestrator = orchestrator(blocking, InMemoryQuotaService.unlimited());

        RunHandle handle = orchestrator.start(request()
                .file(png("a.png")).file(png("b.png")).file(png("c.png")).file(png("d.png"))
                .build());
        assertThat(handle.getReport()).isEmpty();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(orchestrator.isRunning(BATCH)).isTrue();
        assertThat(orchestrator.getRun(BATCH)).containsSame(handle);
        assertThat(handle.getState()).isEqualTo(IngestionState.SCHEDULING);
        IngestionReport duplicate = orchestrator.start(request().file(png("e.png")).build()).await(5, TimeUnit.SECONDS);
        assertThat(duplicate.getStatus()).isEqualTo(RunStatus.PRECONDITION_FAILED);

        handle.cancel();
        release.countDown();
        IngestionReport report = handle.await(5, TimeUnit.SECONDS);

        assertThat(report.getStatus()).isEqualTo(RunStatus.CANCELLED);
        assertThat(report.getDocuments()).extracting(ProcessedDocument::getName).containsExactly("a.png");
        assertThat(report.countFailures(ErrorKind.CANCELLED)).isEqualTo(3);
        assertThat(handle.isDone()).isTrue();
        assertThat(handle.getReport()).containsSame(report);
        assertThat(handle.getState()).isEqualTo(IngestionState.DONE);
    }

    /**
     * An unexpected error while splitting one file is reported against that file only.
     */
    @Test
    void unexpectedPreparationErrorIsContainedToFile() throws Exception {
        PdfExtractor extractor = new PdfExtractor() {
            @Override
            public List<PdfPage> extractPages(PDDocument document) {
                throw new IllegalStateException("font table unreadable");
            }
        };
        DocumentPreparer preparer = new DocumentPreparer(extractor, new PdfBoundaryAnalyzer(extractor),
                new ImageNormalizer(), config);
        IngestionOrchestrator orchestrator = new IngestionOrchestrator(config, persistence,
                new ResourceGate(InMemoryQuotaService.unlimited()), preparer,
                IngestionOrchestrator.defaultChain(config, StubRecognitionService.succeeding()),
                new BoundedWorkScheduler(0));

        IngestionReport report = orchestrator.run(request()
                .file(pdf("odd.pdf", TestPdfs.textPages(2))).file(png("ok.png")).build());

        assertThat(report.getStatus()).isEqualTo(RunStatus.PARTIAL_SUCCESS);
        assertThat(persistence.getDocuments(BATCH)).extracting(DocumentRecord::getName).containsExactly("ok.png");
        assertThat(report.getFailures()).singleElement().satisfies(f -> {
            assertThat(f.getUnitName()).isEqualTo("odd.pdf");
            assertThat(f.getErrorKind()).isEqualTo(ErrorKind.CORRUPT_DOCUMENT);
            assertThat(f.getMessage()).contains("font table unreadable");
        });
    }

    /**
     * The largest pages-per-document value keeps a PDF whole.
     */
    @Test
    void maximumPagesPerDocumentKeepsPdfWhole() throws Exception {
        ProjectSettings settings = ProjectSettings.builder()
                .separationPolicy(SeparationPolicy.pageCount(Integer.MAX_VALUE)).build();

        IngestionReport report = orchestrator(StubRecognitionService.succeeding(), InMemoryQuotaService.unlimited())
                .run(request().settings(settings).file(pdf("scan.pdf", TestPdfs.textPages(3))).build());

        assertThat(report.getStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(report.getDocuments())
                .extracting(ProcessedDocument::getStartPage, ProcessedDocument::getEndPage)
                .containsExactly(tuple(1, 3));
    }

    @Test
    void errorKindMapping() {
        assertThat(IngestionOrchestrator.errorKindOf(FailureCause.UNREADABLE_SOURCE)).isEqualTo(ErrorKind.CORRUPT_DOCUMENT);
        assertThat(IngestionOrchestrator.errorKindOf(FailureCause.PAYLOAD_TOO_LARGE)).isEqualTo(ErrorKind.RECOGNITION_UNAVAILABLE);
        assertThat(IngestionOrchestrator.errorKindOf(FailureCause.NO_DATA)).isEqualTo(ErrorKind.RECOGNITION_UNAVAILABLE);
    }
}
