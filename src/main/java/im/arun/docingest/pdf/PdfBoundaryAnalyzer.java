package im.arun.docingest.pdf;

import im.arun.docingest.model.DocumentBoundary;
import im.arun.docingest.model.PdfPage;
import im.arun.docingest.model.SeparationMethod;
import im.arun.docingest.model.SeparationPolicy;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Partitions the pages of a PDF into logical documents according to a {@link SeparationPolicy}.
 */
public class PdfBoundaryAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(PdfBoundaryAnalyzer.class);
    private static final List<String> DEFAULT_SEPARATOR_WORDS = List.of("separator", "divider");

    private final PdfExtractor pdfExtractor;

    public PdfBoundaryAnalyzer(PdfExtractor pdfExtractor) {
        this.pdfExtractor = pdfExtractor;
    }

    /**
     * Open {@code pdfBytes} and compute its boundaries. Nothing is returned for a file that cannot be parsed.
     */
    public List<DocumentBoundary> analyze(byte[] pdfBytes, String fileName, SeparationPolicy policy)
            throws CorruptDocumentException {
        try (PDDocument document = pdfExtractor.open(pdfBytes, fileName)) {
            List<PdfPage> pages = policy.getMethod() == SeparationMethod.BLANK_PAGE
                    || policy.getMethod() == SeparationMethod.BARCODE
                    ? pdfExtractor.extractPages(document)
                    : List.of();
            return analyze(document.getNumberOfPages(), pages, policy);
        } catch (IOException e) {
            throw new CorruptDocumentException(fileName, "Unable to analyze PDF " + fileName + ": " + e.getMessage(), e);
        }
    }

    /**
     * Compute boundaries for a document of {@code totalPages} pages.
     *
     * @param pages text layer per page; only consulted by the separator-based methods
     */
    public List<DocumentBoundary> analyze(int totalPages, List<PdfPage> pages, SeparationPolicy policy) {
        if (totalPages < 1) {
            throw new IllegalArgumentException("A PDF must have at least one page");
        }

        List<DocumentBoundary> boundaries;
        switch (policy.getMethod()) {
            case PAGE_COUNT:
                boundaries = splitByPageCount(totalPages, policy.getPagesPerDocument());
                break;
            case BLANK_PAGE:
                boundaries = splitOnSeparatorPages(totalPages, SeparationMethod.BLANK_PAGE,
                        page -> page.getContentLength() < policy.getBlankPageThreshold(), pages);
                break;
            case BARCODE:
                boundaries = splitOnSeparatorPages(totalPages, SeparationMethod.BARCODE,
                        separatorSheetMatcher(policy.getSeparatorPatterns()), pages);
                break;
            case NONE:
            default:
                boundaries = List.of(wholeDocument(totalPages));
                break;
        }

        logger.debug("Policy {} split {} pages into {} documents", policy.getMethod(), totalPages, boundaries.size());
        return boundaries;
    }

    static List<DocumentBoundary> splitByPageCount(int totalPages, int pagesPerDocument) {
        List<DocumentBoundary> boundaries = new ArrayList<>();
        int start = 1;
        while (true) {
            int end = (int) Math.min((long) start + pagesPerDocument - 1, totalPages);
            boundaries.add(new DocumentBoundary(start, end, SeparationMethod.PAGE_COUNT));
            if (end == totalPages) {
                return boundaries;
            }
            start = end + 1;
        }
    }

    private List<DocumentBoundary> splitOnSeparatorPages(int totalPages, SeparationMethod method,
                                                         Predicate<PdfPage> isSeparator, List<PdfPage> pages) {
        List<DocumentBoundary> boundaries = new ArrayList<>();
        int currentStart = 1;

        for (PdfPage page : pages) {
            if (!isSeparator.test(page)) {
                continue;
            }
            int separatorPage = page.getPageNumber();
            if (separatorPage > currentStart) {
                boundaries.add(new DocumentBoundary(currentStart, separatorPage - 1, method));
            }
            currentStart = separatorPage + 1;
        }

        if (currentStart <= totalPages) {
            boundaries.add(new DocumentBoundary(currentStart, totalPages, method));
        }

        // A file made only of separators is still one document
        return boundaries.isEmpty() ? List.of(wholeDocument(totalPages)) : boundaries;
    }

    private Predicate<PdfPage> separatorSheetMatcher(List<String> patterns) {
        List<String> needles = new ArrayList<>(DEFAULT_SEPARATOR_WORDS);
        for (String pattern : patterns) {
            if (pattern != null && !pattern.isBlank()) {
                needles.add(pattern.toLowerCase(Locale.ROOT));
            }
        }
        return page -> {
            String text = page.getText() == null ? "" : page.getText().toLowerCase(Locale.ROOT);
            return needles.stream().anyMatch(text::contains);
        };
    }

    private DocumentBoundary wholeDocument(int totalPages) {
        return new DocumentBoundary(1, totalPages, SeparationMethod.NONE);
    }

    /**
     * Display name for a boundary: the file name itself when the file is one document,
     * otherwise {@code <base>_doc<n>.pdf} numbered from 1 in page order.
     */
    public static String documentName(String fileName, int boundaryIndex, int totalBoundaries) {
        if (totalBoundaries == 1) {
            return fileName;
        }
        String baseName = fileName.replaceAll("(?i)\\.pdf$", "");
        return String.format("%s_doc%d.pdf", baseName, boundaryIndex + 1);
    }
}
