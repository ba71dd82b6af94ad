package im.arun.docingest.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * How a multi-page PDF is split into logical documents.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SeparationPolicy {
    public static final int DEFAULT_BLANK_PAGE_THRESHOLD = 50;

    SeparationMethod method;
    int pagesPerDocument;
    int blankPageThreshold;
    List<String> separatorPatterns;

    public static SeparationPolicy pageCount(int pagesPerDocument) {
        if (pagesPerDocument < 1) {
            throw new IllegalArgumentException("pagesPerDocument must be >= 1, got " + pagesPerDocument);
        }
        return new SeparationPolicy(SeparationMethod.PAGE_COUNT, pagesPerDocument, DEFAULT_BLANK_PAGE_THRESHOLD, List.of());
    }

    public static SeparationPolicy none() {
        return new SeparationPolicy(SeparationMethod.NONE, 0, DEFAULT_BLANK_PAGE_THRESHOLD, List.of());
    }

    public static SeparationPolicy blankPage(int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("blankPageThreshold must be >= 1, got " + threshold);
        }
        return new SeparationPolicy(SeparationMethod.BLANK_PAGE, 0, threshold, List.of());
    }

    public static SeparationPolicy barcode(List<String> patterns) {
        return new SeparationPolicy(SeparationMethod.BARCODE, 0, DEFAULT_BLANK_PAGE_THRESHOLD,
                patterns == null ? List.of() : List.copyOf(patterns));
    }

    /**
     * "none" is only meaningful for single-page sources; anything longer is split one page per document.
     */
    public SeparationPolicy effectiveFor(int pageCount) {
        if (method == SeparationMethod.NONE && pageCount > 1) {
            return pageCount(1);
        }
        return this;
    }
}
