package im.arun.docingest.ingest;

import im.arun.docingest.config.IngestConfig;
import im.arun.docingest.image.ImageNormalizer;
import im.arun.docingest.model.DocumentKind;
import im.arun.docingest.model.ErrorKind;
import im.arun.docingest.model.LogicalDocument;
import im.arun.docingest.model.ProcessedDocument;
import im.arun.docingest.model.ProjectSettings;
import im.arun.docingest.model.UnitFailure;
import im.arun.docingest.pdf.PdfBoundaryAnalyzer;
import im.arun.docingest.pdf.PdfExtractor;
import im.arun.docingest.persistence.DocumentRecord;
import im.arun.docingest.persistence.PersistenceException;
import im.arun.docingest.persistence.PersistenceGateway;
import im.arun.docingest.quota.QuotaService;
import im.arun.docingest.quota.ResourceGate;
import im.arun.docingest.recognition.FailureCause;
import im.arun.docingest.recognition.RecognitionClient;
import im.arun.docingest.recognition.RecognitionService;
import im.arun.docingest.recognition.StrategyChain;
import im.arun.docingest.recognition.strategy.ImageFallbackStrategy;
import im.arun.docingest.recognition.strategy.StrategyOutcome;
import im.arun.docingest.recognition.strategy.TextStrategy;
import im.arun.docingest.scheduler.BoundedWorkScheduler;
import im.arun.docingest.scheduler.CancellationToken;
import im.arun.docingest.scheduler.WorkOutcome;
import im.arun.docingest.util.ExecutorProvider;
import im.arun.docingest.util.IngestionJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Top-level coordinator of an upload: validates the target batch, splits files into logical documents,
 * and runs recognize, save and consume quota for each of them on a bounded worker pool.
 * <p>
 * Failures of one document never stop the others. Only a missing project or batch stops a run,
 * before any document is touched, or a batch deleted mid-run, which stops further writes.
 */
public class IngestionOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(IngestionOrchestrator.class);

    private final IngestConfig config;
    private final PersistenceGateway persistence;
    private final ResourceGate resourceGate;
    private final DocumentPreparer preparer;
    private final StrategyChain strategyChain;
    private final BoundedWorkScheduler scheduler;
    private final Map<String, RunHandle> activeRuns = new ConcurrentHashMap<>();

    public IngestionOrchestrator(IngestConfig config, RecognitionService recognitionService,
                                 PersistenceGateway persistence, QuotaService quotaService) {
        this(config, persistence, new ResourceGate(quotaService),
                defaultPreparer(config), defaultChain(config, recognitionService),
                new BoundedWorkScheduler(config.getInterItemDelayMs()));
    }

    public IngestionOrchestrator(IngestConfig config, PersistenceGateway persistence, ResourceGate resourceGate,
                                 DocumentPreparer preparer, StrategyChain strategyChain,
                                 BoundedWorkScheduler scheduler) {
        this.config = config;
        this.persistence = persistence;
        this.resourceGate = resourceGate;
        this.preparer = preparer;
        this.strategyChain = strategyChain;
        this.scheduler = scheduler;
    }

    private static DocumentPreparer defaultPreparer(IngestConfig config) {
        PdfExtractor extractor = new PdfExtractor();
        return new DocumentPreparer(extractor, new PdfBoundaryAnalyzer(extractor), new ImageNormalizer(), config);
    }

    static StrategyChain defaultChain(IngestConfig config, RecognitionService service) {
        RecognitionClient client = new RecognitionClient(service, config.getMaxPayloadBytes(), config.getRetryBaseDelayMs());
        return new StrategyChain(List.of(
                new TextStrategy(client, config.getTextThreshold(), config.getMaxRetries()),
                new ImageFallbackStrategy(client, new ImageNormalizer(), config.getMaxImageDimension(),
                        config.getImageQuality(), config.getMaxRetries())));
    }

    /**
     * Start a run in the background. A second run for a batch that is still being processed
     * completes immediately with {@link RunStatus#PRECONDITION_FAILED}.
     */
    public RunHandle start(IngestionRequest request) {
        RunHandle handle = newHandle(request);
        if (!register(handle)) {
            handle.complete(alreadyRunning(handle));
            return handle;
        }
        ExecutorProvider.getCoordinator().execute(() -> execute(request, handle));
        return handle;
    }

    /**
     * Run to completion on the calling thread.
     */
    public IngestionReport run(IngestionRequest request) {
        RunHandle handle = newHandle(request);
        if (!register(handle)) {
            return alreadyRunning(handle);
        }
        execute(request, handle);
        return handle.await();
    }

    public boolean isRunning(String batchId) {
        return batchId != null && activeRuns.containsKey(batchId);
    }

    public Optional<RunHandle> getRun(String batchId) {
        return Optional.ofNullable(batchId == null ? null : activeRuns.get(batchId));
    }

    private RunHandle newHandle(IngestionRequest request) {
        return new RunHandle(UUID.randomUUID().toString(), request.getBatchId(), new CancellationToken());
    }

    private boolean register(RunHandle handle) {
        // Runs without a batch fail validation; they never occupy a slot
        return handle.getBatchId() == null || activeRuns.putIfAbsent(handle.getBatchId(), handle) == null;
    }

    private void execute(IngestionRequest request, RunHandle handle) {
        try {
            handle.complete(process(request, handle));
        } catch (RuntimeException | Error e) {
            logger.error("Run {} for batch {} crashed", handle.getRunId(), handle.getBatchId(), e);
            handle.fail(e);
        } finally {
            if (handle.getBatchId() != null) {
                activeRuns.remove(handle.getBatchId(), handle);
            }
        }
    }

    private IngestionReport process(IngestionRequest request, RunHandle handle) {
        Instant startedAt = Instant.now();
        String batchId = request.getBatchId();
        IngestionJournal journal = new IngestionJournal(config.getJournalDirectory(), batchId != null ? batchId : "no-batch");
        IngestionReport.IngestionReportBuilder report = IngestionReport.builder()
                .runId(handle.getRunId())
                .batchId(batchId)
                .startedAt(startedAt);

        transition(handle, journal, IngestionState.VALIDATING);
        Optional<String> precondition = checkPreconditions(request);
        if (precondition.isPresent()) {
            logger.warn("Run {} rejected: {}", handle.getRunId(), precondition.get());
            journal.error("precondition_failed", Map.of("reason", precondition.get()));
            transition(handle, journal, IngestionState.DONE);
            return report.status(RunStatus.PRECONDITION_FAILED)
                    .failure(new UnitFailure(batchId != null ? batchId : "batch", ErrorKind.PRECONDITION_FAILED, precondition.get()))
                    .finishedAt(Instant.now())
                    .build();
        }

        transition(handle, journal, IngestionState.SPLITTING);
        ProjectSettings settings = request.getSettings();
        DocumentPreparer.Preparation preparation = preparer.prepare(request.getFiles(), settings.getSeparationPolicy());
        journal.info("split", Map.of(
                "files", request.getFiles().size(),
                "documents", preparation.getDocuments().size(),
                "corrupt_files", preparation.getFailures().size()));

        transition(handle, journal, IngestionState.SCHEDULING);
        RunContext context = new RunContext(request.getProjectId(), batchId, settings, handle.getCancellationToken(), journal);
        List<WorkOutcome<LogicalDocument, UnitResult>> outcomes = scheduler.runAll(
                preparation.getDocuments(), config.getWorkerCount(), unit -> processUnit(unit, context),
                handle.getCancellationToken());

        transition(handle, journal, IngestionState.AGGREGATING);
        List<ProcessedDocument> saved = new ArrayList<>();
        List<UnitFailure> failures = new ArrayList<>(preparation.getFailures());
        for (WorkOutcome<LogicalDocument, UnitResult> outcome : outcomes) {
            LogicalDocument unit = outcome.getUnit();
            if (!outcome.isAttempted()) {
                failures.add(new UnitFailure(unit.getName(), context.abortKind(), context.abortMessage()));
            } else if (outcome.getError() != null) {
                failures.add(new UnitFailure(unit.getName(), ErrorKind.RECOGNITION_UNAVAILABLE,
                        "Unexpected error: " + outcome.getError().getMessage()));
            } else if (outcome.getResult().isSuccess()) {
                saved.add(outcome.getResult().getDocument());
            } else {
                failures.add(outcome.getResult().getFailure());
            }
        }
        saved.sort(Comparator.comparingInt(ProcessedDocument::getSourceIndex).thenComparingInt(ProcessedDocument::getOrdinal));

        RunStatus status = aggregate(saved, failures, context);
        journal.info("completed", Map.of("status", status.name(), "saved", saved.size(), "failed", failures.size()));
        logger.info("Run {} for batch {} finished {}: {} saved, {} failed",
                handle.getRunId(), batchId, status, saved.size(), failures.size());
        transition(handle, journal, IngestionState.DONE);

        return report.status(status)
                .documents(saved)
                .failures(failures)
                .finishedAt(Instant.now())
                .build();
    }

    private Optional<String> checkPreconditions(IngestionRequest request) {
        if (isBlank(request.getProjectId())) {
            return Optional.of("No project selected");
        }
        if (isBlank(request.getBatchId())) {
            return Optional.of("No batch selected");
        }
        if (!persistence.batchExists(request.getBatchId())) {
            return Optional.of("Batch " + request.getBatchId() + " no longer exists");
        }
        return Optional.empty();
    }

    private RunStatus aggregate(List<ProcessedDocument> saved, List<UnitFailure> failures, RunContext context) {
        if (context.abortKind() == ErrorKind.PRECONDITION_FAILED) {
            return RunStatus.PRECONDITION_FAILED;
        }
        if (context.abortKind() == ErrorKind.CANCELLED) {
            return RunStatus.CANCELLED;
        }
        if (failures.isEmpty()) {
            return RunStatus.SUCCEEDED;
        }
        return saved.isEmpty() ? RunStatus.FAILED : RunStatus.PARTIAL_SUCCESS;
    }

    /**
     * Reserve quota, recognize, save, then consume. The reservation is released on every path that does not save.
     */
    UnitResult processUnit(LogicalDocument unit, RunContext context) {
        if (!persistence.batchExists(context.batchId)) {
            return context.batchVanished(unit);
        }

        Optional<ResourceGate.Reservation> reservation = resourceGate.reserve(1);
        if (reservation.isEmpty()) {
            context.journal.warn("quota_exceeded", Map.of("unit", unit.getName()));
            return UnitResult.failed(unit, ErrorKind.QUOTA_EXCEEDED, "Insufficient document capacity for " + unit.getName());
        }

        try {
            StrategyOutcome outcome = strategyChain.recognize(unit, context.settings);
            if (!outcome.isResult()) {
                context.journal.warn("recognition_failed", Map.of(
                        "unit", unit.getName(), "cause", outcome.getFailureCause().name()));
                return UnitResult.failed(unit, errorKindOf(outcome.getFailureCause()), outcome.getMessage());
            }

            if (!persistence.batchExists(context.batchId)) {
                return context.batchVanished(unit);
            }

            String documentId;
            try {
                documentId = persistence.saveDocument(toRecord(unit, outcome, context));
            } catch (PersistenceException e) {
                logger.error("Failed to save {}: {}", unit.getName(), e.getMessage());
                context.journal.error("save_failed", Map.of("unit", unit.getName(), "message", String.valueOf(e.getMessage())));
                return UnitResult.failed(unit, ErrorKind.PERSISTENCE_FAILED, "Failed to save " + unit.getName() + ": " + e.getMessage());
            }

            if (!reservation.get().commit(documentId)) {
                logger.warn("Document {} saved but quota was not updated", documentId);
                context.journal.warn("quota_not_updated", Map.of("unit", unit.getName(), "document_id", documentId));
            }

            try {
                persistence.incrementBatchCounters(context.batchId);
            } catch (PersistenceException e) {
                logger.warn("Document {} saved but batch counters were not updated: {}", documentId, e.getMessage());
            }

            context.journal.info("saved", Map.of(
                    "unit", unit.getName(), "document_id", documentId, "image_mode", outcome.isImageMode()));
            return UnitResult.saved(new ProcessedDocument(documentId, unit.getName(), unit.getSourceIndex(),
                    unit.getOrdinal(), unit.getStartPage(), unit.getEndPage(), outcome.isImageMode(), outcome.getResult()));
        } finally {
            reservation.get().release();
        }
    }

    private DocumentRecord toRecord(LogicalDocument unit, StrategyOutcome outcome, RunContext context) {
        return DocumentRecord.builder()
                .batchId(context.batchId)
                .projectId(context.projectId)
                .name(unit.getName())
                .mimeType(unit.getKind() == DocumentKind.PDF ? DocumentKind.PDF.getMimeType() : ImageNormalizer.JPEG_MIME)
                .ordinal(unit.getPosition())
                .startPage(unit.getStartPage())
                .endPage(unit.getEndPage())
                .contentRef(outcome.getContentRef())
                .text(outcome.getResult().getText())
                .metadata(outcome.getResult().getMetadata())
                .lineItems(outcome.getResult().getLineItems())
                .documentType(outcome.getResult().getDocumentType())
                .confidence(outcome.getResult().getConfidence())
                .build();
    }

    static ErrorKind errorKindOf(FailureCause cause) {
        if (cause == FailureCause.UNREADABLE_SOURCE) {
            return ErrorKind.CORRUPT_DOCUMENT;
        }
        return ErrorKind.RECOGNITION_UNAVAILABLE;
    }

    private void transition(RunHandle handle, IngestionJournal journal, IngestionState next) {
        logger.debug("Run {}: {} -> {}", handle.getRunId(), handle.getState(), next);
        handle.setState(next);
        journal.info("state", Map.of("state", next.name()));
    }

    private IngestionReport alreadyRunning(RunHandle handle) {
        Instant now = Instant.now();
        return IngestionReport.builder()
                .runId(handle.getRunId())
                .batchId(handle.getBatchId())
                .status(RunStatus.PRECONDITION_FAILED)
                .failure(new UnitFailure(handle.getBatchId(), ErrorKind.PRECONDITION_FAILED,
                        "Batch " + handle.getBatchId() + " is already being processed"))
                .startedAt(now)
                .finishedAt(now)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Per-run state shared by the workers.
     */
    static final class RunContext {
        final String projectId;
        final String batchId;
        final ProjectSettings settings;
        final CancellationToken token;
        final IngestionJournal journal;
        private final AtomicReference<UnitFailure> abort = new AtomicReference<>();

        RunContext(String projectId, String batchId, ProjectSettings settings,
                   CancellationToken token, IngestionJournal journal) {
            this.projectId = projectId;
            this.batchId = batchId;
            this.settings = settings;
            this.token = token;
            this.journal = journal;
        }

        /**
         * The batch was deleted by someone else: stop pulling units and fail this one.
         */
        UnitResult batchVanished(LogicalDocument unit) {
            String message = "Batch " + batchId + " was deleted during processing";
            if (abort.compareAndSet(null, new UnitFailure(batchId, ErrorKind.PRECONDITION_FAILED, message))) {
                logger.warn(message);
                journal.error("batch_vanished", Map.of("unit", unit.getName()));
            }
            token.cancel(message);
            return UnitResult.failed(unit, ErrorKind.PRECONDITION_FAILED, message);
        }

        ErrorKind abortKind() {
            UnitFailure failure = abort.get();
            if (failure != null) {
                return failure.getErrorKind();
            }
            return token.isCancelled() ? ErrorKind.CANCELLED : null;
        }

        String abortMessage() {
            UnitFailure failure = abort.get();
            return failure != null ? failure.getMessage() : token.getReason();
        }
    }
}
