package im.arun.docingest.pdf;

/**
 * Thrown when an uploaded file cannot be opened or decoded.
 */
public class CorruptDocumentException extends Exception {

    private final String fileName;

    public CorruptDocumentException(String fileName, String message, Throwable cause) {
        super(message, cause);
        this.fileName = fileName;
    }

    public CorruptDocumentException(String fileName, String message) {
        this(fileName, message, null);
    }

    public String getFileName() {
        return fileName;
    }
}
