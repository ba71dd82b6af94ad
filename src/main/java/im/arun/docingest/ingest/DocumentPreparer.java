package im.arun.docingest.ingest;

import im.arun.docingest.config.IngestConfig;
import im.arun.docingest.image.ImageNormalizer;
import im.arun.docingest.image.PageImageSource;
import im.arun.docingest.model.DocumentBoundary;
import im.arun.docingest.model.DocumentKind;
import im.arun.docingest.model.ErrorKind;
import im.arun.docingest.model.LogicalDocument;
import im.arun.docingest.model.PdfPage;
import im.arun.docingest.model.SeparationPolicy;
import im.arun.docingest.model.UnitFailure;
import im.arun.docingest.model.UploadUnit;
import im.arun.docingest.pdf.CorruptDocumentException;
import im.arun.docingest.pdf.PdfBoundaryAnalyzer;
import im.arun.docingest.pdf.PdfExtractor;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns uploaded files into logical documents: PDFs are split by the separation policy,
 * images become one document each. Files that cannot be read, or that fail unexpectedly, become
 * failures, not documents.
 */
public class DocumentPreparer {
    private static final Logger logger = LoggerFactory.getLogger(DocumentPreparer.class);

    private final PdfExtractor pdfExtractor;
    private final PdfBoundaryAnalyzer boundaryAnalyzer;
    private final ImageNormalizer imageNormalizer;
    private final IngestConfig config;

    public DocumentPreparer(PdfExtractor pdfExtractor, PdfBoundaryAnalyzer boundaryAnalyzer,
                            ImageNormalizer imageNormalizer, IngestConfig config) {
        this.pdfExtractor = pdfExtractor;
        this.boundaryAnalyzer = boundaryAnalyzer;
        this.imageNormalizer = imageNormalizer;
        this.config = config;
    }

    public Preparation prepare(List<UploadUnit> files, SeparationPolicy policy) {
        List<LogicalDocument> documents = new ArrayList<>();
        List<UnitFailure> failures = new ArrayList<>();

        for (int sourceIndex = 0; sourceIndex < files.size(); sourceIndex++) {
            UploadUnit file = files.get(sourceIndex);
            DocumentKind kind = file.getKind();
            try {
                switch (kind) {
                    case PDF:
                        splitPdf(file, sourceIndex, policy, documents);
                        break;
                    case TIFF:
                        byte[] png = imageNormalizer.toPng(file.getContent(), file.getFileName());
                        documents.add(imageDocument(file, png, sourceIndex, documents.size()));
                        break;
                    case IMAGE:
                        documents.add(imageDocument(file, file.getContent(), sourceIndex, documents.size()));
                        break;
                    default:
                        throw new CorruptDocumentException(file.getFileName(),
                                "Unsupported file type " + file.getMimeType() + " for " + file.getFileName());
                }
            } catch (CorruptDocumentException e) {
                logger.warn("Skipping {}: {}", file.getFileName(), e.getMessage());
                failures.add(new UnitFailure(file.getFileName(), ErrorKind.CORRUPT_DOCUMENT, e.getMessage()));
            } catch (RuntimeException e) {
                logger.error("Unexpected error preparing {}", file.getFileName(), e);
                failures.add(new UnitFailure(file.getFileName(), ErrorKind.CORRUPT_DOCUMENT,
                        "Unable to prepare " + file.getFileName() + ": " + e.getMessage()));
            }
        }

        return new Preparation(documents, failures);
    }

    private void splitPdf(UploadUnit file, int sourceIndex, SeparationPolicy policy,
                          List<LogicalDocument> documents) throws CorruptDocumentException {
        List<LogicalDocument> split = new ArrayList<>();
        try (PDDocument pdf = pdfExtractor.open(file.getContent(), file.getFileName())) {
            int pageCount = pdf.getNumberOfPages();
            List<PdfPage> pages = pdfExtractor.extractPages(pdf);
            SeparationPolicy effective = policy.effectiveFor(pageCount);
            List<DocumentBoundary> boundaries = boundaryAnalyzer.analyze(pageCount, pages, effective);

            for (int i = 0; i < boundaries.size(); i++) {
                DocumentBoundary boundary = boundaries.get(i);
                split.add(LogicalDocument.builder()
                        .sourceIndex(sourceIndex)
                        .ordinal(i)
                        .position(documents.size() + i)
                        .name(PdfBoundaryAnalyzer.documentName(file.getFileName(), i, boundaries.size()))
                        .sourceFileName(file.getFileName())
                        .kind(DocumentKind.PDF)
                        .boundary(boundary)
                        .extractedText(pdfExtractor.getTextOfPages(pages, boundary.getStartPage(),
                                boundary.getEndPage(), config.getMaxTextPages()))
                        .imageSource(pdfPageSource(file, boundary.getStartPage()))
                        .build());
            }
            logger.info("{}: {} pages split into {} documents ({})",
                    file.getFileName(), pageCount, boundaries.size(), effective.getMethod());
        } catch (IOException e) {
            throw new CorruptDocumentException(file.getFileName(),
                    "Unable to read PDF " + file.getFileName() + ": " + e.getMessage(), e);
        }
        // Only add once the whole file has been analyzed
        documents.addAll(split);
    }

    /**
     * Renders lazily on the worker with its own PDDocument, since PDFBox documents are not thread-safe.
     */
    private PageImageSource pdfPageSource(UploadUnit file, int pageNumber) {
        return maxDimension -> {
            try (PDDocument pdf = pdfExtractor.open(file.getContent(), file.getFileName())) {
                return pdfExtractor.renderPage(pdf, pageNumber, config.getRenderScale(), maxDimension);
            } catch (CorruptDocumentException e) {
                throw new IOException(e.getMessage(), e);
            }
        };
    }

    private LogicalDocument imageDocument(UploadUnit file, byte[] imageBytes, int sourceIndex, int position) {
        return LogicalDocument.builder()
                .sourceIndex(sourceIndex)
                .ordinal(0)
                .position(position)
                .name(file.getFileName())
                .sourceFileName(file.getFileName())
                .kind(file.getKind())
                .imageSource(maxDimension -> imageNormalizer.decode(imageBytes))
                .build();
    }

    /**
     * Logical documents ready for scheduling plus the files that could not be split.
     */
    public static final class Preparation {
        private final List<LogicalDocument> documents;
        private final List<UnitFailure> failures;

        Preparation(List<LogicalDocument> documents, List<UnitFailure> failures) {
            this.documents = List.copyOf(documents);
            this.failures = List.copyOf(failures);
        }

        public List<LogicalDocument> getDocuments() {
            return documents;
        }

        public List<UnitFailure> getFailures() {
            return failures;
        }
    }
}
