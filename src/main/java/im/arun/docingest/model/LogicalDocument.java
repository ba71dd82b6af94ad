package im.arun.docingest.model;

import im.arun.docingest.image.PageImageSource;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * The unit of recognition and persistence. A PDF may yield several; an image yields exactly one.
 * {@code sourceIndex}, {@code ordinal} and {@code position} are fixed before scheduling and decide
 * the persisted name and ordering, whatever order the documents finish in.
 */
@Value
@Builder
public class LogicalDocument {
    /** Position of the source file in the upload. */
    int sourceIndex;
    /** Boundary index within the source file. */
    int ordinal;
    /** Position across the whole run. */
    int position;
    @NonNull String name;
    @NonNull String sourceFileName;
    @NonNull DocumentKind kind;
    DocumentBoundary boundary;
    /** Text layer of the boundary's pages; empty for images and scanned PDFs. */
    @Builder.Default String extractedText = "";
    @NonNull PageImageSource imageSource;

    public int getStartPage() {
        return boundary == null ? 1 : boundary.getStartPage();
    }

    public int getEndPage() {
        return boundary == null ? 1 : boundary.getEndPage();
    }
}
