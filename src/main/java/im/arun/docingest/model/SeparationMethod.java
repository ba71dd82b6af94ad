package im.arun.docingest.model;

public enum SeparationMethod {
    /** Fixed number of pages per document. */
    PAGE_COUNT,
    /** Whole file is one document; only valid for single-page sources. */
    NONE,
    /** Near-empty pages separate documents. */
    BLANK_PAGE,
    /** Separator sheets recognised by their printed text. */
    BARCODE
}
