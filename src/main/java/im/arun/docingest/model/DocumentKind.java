package im.arun.docingest.model;

import java.util.Locale;

/**
 * Declared kind of an uploaded file, resolved from its MIME type and falling back to the file extension.
 */
public enum DocumentKind {
    PDF("application/pdf"),
    IMAGE("image/*"),
    TIFF("image/tiff"),
    UNSUPPORTED("application/octet-stream");

    private final String mimeType;

    DocumentKind(String mimeType) {
        this.mimeType = mimeType;
    }

    public String getMimeType() {
        return mimeType;
    }

    public static DocumentKind resolve(String mimeType, String fileName) {
        String type = mimeType == null ? "" : mimeType.trim().toLowerCase(Locale.ROOT);
        String name = fileName == null ? "" : fileName.trim().toLowerCase(Locale.ROOT);

        if (type.equals("application/pdf")) {
            return PDF;
        }
        if (type.equals("image/tiff") || type.equals("image/tif")) {
            return TIFF;
        }
        if (type.startsWith("image/")) {
            return IMAGE;
        }

        // Browsers and scanners often send an empty or generic type
        if (name.endsWith(".pdf")) {
            return PDF;
        }
        if (name.endsWith(".tif") || name.endsWith(".tiff")) {
            return TIFF;
        }
        if (name.endsWith(".png") || name.endsWith(".jpg") || name.endsWith(".jpeg")
                || name.endsWith(".gif") || name.endsWith(".bmp")) {
            return IMAGE;
        }
        return UNSUPPORTED;
    }
}
