package im.arun.docingest.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A single PDF page's text layer.
 */
@Data
@AllArgsConstructor
public class PdfPage {
    private int pageNumber;
    private String text;

    /**
     * Length of the text without surrounding whitespace.
     */
    public int getContentLength() {
        return text == null ? 0 : text.trim().length();
    }
}
