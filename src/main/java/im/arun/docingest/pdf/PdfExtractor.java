package im.arun.docingest.pdf;

import im.arun.docingest.model.PdfPage;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * PDF access using Apache PDFBox: loading, per-page text and page rendering.
 * A {@link PDDocument} is not thread-safe, so callers open their own instance per worker.
 */
public class PdfExtractor {
    private static final Logger logger = LoggerFactory.getLogger(PdfExtractor.class);

    /**
     * Load a PDF, translating any parse failure into {@link CorruptDocumentException}.
     *
     * @param pdfBytes raw file content
     * @param fileName name used in error reporting
     */
    public PDDocument open(byte[] pdfBytes, String fileName) throws CorruptDocumentException {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new CorruptDocumentException(fileName, "Empty PDF: " + fileName);
        }
        try {
            PDDocument document = Loader.loadPDF(pdfBytes);
            if (document.getNumberOfPages() == 0) {
                document.close();
                throw new CorruptDocumentException(fileName, "PDF has no pages: " + fileName);
            }
            return document;
        } catch (IOException e) {
            throw new CorruptDocumentException(fileName, "Unable to read PDF " + fileName + ": " + e.getMessage(), e);
        }
    }

    /**
     * Extract the text layer of every page.
     */
    public List<PdfPage> extractPages(PDDocument document) throws IOException {
        int totalPages = document.getNumberOfPages();
        List<PdfPage> pages = new ArrayList<>(totalPages);

        PDFTextStripper stripper = new PDFTextStripper();
        for (int i = 0; i < totalPages; i++) {
            stripper.setStartPage(i + 1);
            stripper.setEndPage(i + 1);
            pages.add(new PdfPage(i + 1, stripper.getText(document)));
        }

        logger.debug("Extracted text from {} pages", totalPages);
        return pages;
    }

    /**
     * Text of a page range, capped at {@code maxPages} pages from the start of the range.
     *
     * @param pages     all pages of the document
     * @param startPage start page (1-indexed, inclusive)
     * @param endPage   end page (1-indexed, inclusive)
     * @param maxPages  upper bound on pages read
     */
    public String getTextOfPages(List<PdfPage> pages, int startPage, int endPage, int maxPages) {
        int last = (int) Math.min(endPage, (long) startPage + Math.max(maxPages, 1) - 1);
        StringBuilder text = new StringBuilder();
        for (int i = startPage - 1; i < last && i < pages.size(); i++) {
            text.append(pages.get(i).getText()).append('\n');
        }
        return text.toString();
    }

    /**
     * Render one page at {@code scale}, reduced so the longer edge does not exceed {@code maxDimension} pixels.
     *
     * @param pageNumber 1-indexed page
     */
    public BufferedImage renderPage(PDDocument document, int pageNumber, float scale, int maxDimension) throws IOException {
        int pageIndex = pageNumber - 1;
        PDRectangle box = document.getPage(pageIndex).getCropBox();
        float longer = Math.max(box.getWidth(), box.getHeight());
        float effectiveScale = longer > 0 ? Math.min(scale, maxDimension / longer) : scale;

        PDFRenderer renderer = new PDFRenderer(document);
        BufferedImage image = renderer.renderImage(pageIndex, effectiveScale, ImageType.RGB);
        logger.debug("Rendered page {} at scale {} to {}x{}", pageNumber, effectiveScale, image.getWidth(), image.getHeight());
        return image;
    }
}
