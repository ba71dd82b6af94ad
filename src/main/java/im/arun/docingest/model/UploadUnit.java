package im.arun.docingest.model;

import lombok.NonNull;
import lombok.Value;

/**
 * One file as submitted by the user. Lives only for the duration of a run.
 */
@Value
public class UploadUnit {
    @NonNull byte[] content;
    String mimeType;
    @NonNull String fileName;

    public DocumentKind getKind() {
        return DocumentKind.resolve(mimeType, fileName);
    }

    public int getSize() {
        return content.length;
    }
}
