package im.arun.docingest.pdf;

import im.arun.docingest.model.PdfPage;
import im.arun.docingest.testsupport.TestPdfs;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfExtractorTest {

    private final PdfExtractor extractor = new PdfExtractor();

    @Test
    void extractsTextPerPage() throws Exception {
        byte[] pdf = TestPdfs.withPages("Alpha page text", "", "Gamma page text");

        try (PDDocument document = extractor.open(pdf, "three.pdf")) {
            List<PdfPage> pages = extractor.extractPages(document);

            assertThat(pages).extracting(PdfPage::getPageNumber).containsExactly(1, 2, 3);
            assertThat(pages.get(0).getText()).contains("Alpha");
            assertThat(pages.get(1).getContentLength()).isZero();
            assertThat(pages.get(2).getText()).contains("Gamma");
        }
    }

    /**
     * Text for a range is capped at the configured number of leading pages.
     */
    @Test
    void textOfPagesIsCapped() {
        List<PdfPage> pages = List.of(
                new PdfPage(1, "one"), new PdfPage(2, "two"), new PdfPage(3, "three"), new PdfPage(4, "four"));

        String text = extractor.getTextOfPages(pages, 2, 4, 2);

        assertThat(text).contains("two", "three").doesNotContain("four").doesNotContain("one");
    }

    @Test
    void unboundedTextCapKeepsWholeRange() {
        List<PdfPage> pages = List.of(new PdfPage(1, "one"), new PdfPage(2, "two"), new PdfPage(3, "three"));

        String text = extractor.getTextOfPages(pages, 2, 3, Integer.MAX_VALUE);

        assertThat(text).contains("two", "three").doesNotContain("one");
    }

    /**
     * Rendering honours the dimension cap even when the requested scale would exceed it.
     */
    @Test
    void renderRespectsMaxDimension() throws Exception {
        byte[] pdf = TestPdfs.textPages(1);

        try (PDDocument document = extractor.open(pdf, "one.pdf")) {
            BufferedImage image = extractor.renderPage(document, 1, 1.5f, 500);

            assertThat(Math.max(image.getWidth(), image.getHeight())).isLessThanOrEqualTo(500);
            assertThat(image.getHeight()).isGreaterThan(image.getWidth());
        }
    }

    @Test
    void emptyInputIsCorrupt() {
        assertThatThrownBy(() -> extractor.open(new byte[0], "empty.pdf"))
                .isInstanceOf(CorruptDocumentException.class)
                .hasMessageContaining("empty.pdf");
    }
}
