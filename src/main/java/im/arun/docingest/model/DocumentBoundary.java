package im.arun.docingest.model;

import lombok.Value;

/**
 * Contiguous, 1-based inclusive page range of a source PDF assigned to one logical document.
 */
@Value
public class DocumentBoundary {
    int startPage;
    int endPage;
    SeparationMethod separatorType;

    public DocumentBoundary(int startPage, int endPage, SeparationMethod separatorType) {
        if (startPage < 1 || endPage < startPage) {
            throw new IllegalArgumentException("Invalid page range [" + startPage + ", " + endPage + "]");
        }
        this.startPage = startPage;
        this.endPage = endPage;
        this.separatorType = separatorType;
    }

    public int getPageCount() {
        return endPage - startPage + 1;
    }
}
