package im.arun.docingest.model;

import lombok.Value;

import java.util.Base64;

/**
 * Compact encoded raster ready for transport.
 */
@Value
public class EncodedImage {
    byte[] bytes;
    int width;
    int height;
    String mimeType;

    public int getLongerEdge() {
        return Math.max(width, height);
    }

    public String toDataUrl() {
        return "data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(bytes);
    }
}
