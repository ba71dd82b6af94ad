package im.arun.docingest.image;

import im.arun.docingest.model.EncodedImage;
import im.arun.docingest.pdf.CorruptDocumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Downscales and re-encodes rasters into a compact JPEG payload for the recognition service.
 * Output depends only on the input pixels and the parameters.
 */
public class ImageNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(ImageNormalizer.class);
    public static final String JPEG_MIME = "image/jpeg";

    /**
     * Scale the longer edge down to {@code maxDimension} (never up) and encode as JPEG at {@code quality}.
     *
     * @param quality JPEG quality in (0, 1]
     */
    public EncodedImage normalize(BufferedImage source, int maxDimension, float quality) throws IOException {
        if (maxDimension < 1) {
            throw new IllegalArgumentException("maxDimension must be positive");
        }
        if (quality <= 0f || quality > 1f) {
            throw new IllegalArgumentException("quality must be in (0, 1], got " + quality);
        }

        BufferedImage scaled = scaleToFit(source, maxDimension);
        byte[] encoded = encodeJpeg(scaled, quality);
        logger.debug("Normalized {}x{} to {}x{} ({} bytes)", source.getWidth(), source.getHeight(),
                scaled.getWidth(), scaled.getHeight(), encoded.length);
        return new EncodedImage(encoded, scaled.getWidth(), scaled.getHeight(), JPEG_MIME);
    }

    /**
     * Decode an encoded image and normalize it.
     */
    public EncodedImage normalize(byte[] imageBytes, int maxDimension, float quality) throws IOException {
        return normalize(decode(imageBytes), maxDimension, quality);
    }

    /**
     * Decode any format ImageIO understands (PNG, JPEG, GIF, BMP, TIFF) into an RGB raster.
     */
    public BufferedImage decode(byte[] imageBytes) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        if (image == null) {
            throw new IOException("Unrecognized image format");
        }
        return toRgb(image);
    }

    /**
     * Convert the first frame of a TIFF scan into PNG so the rest of the pipeline sees a standard raster.
     */
    public byte[] toPng(byte[] tiffBytes, String fileName) throws CorruptDocumentException {
        try {
            BufferedImage image = decode(tiffBytes);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            if (!ImageIO.write(image, "png", out)) {
                throw new IOException("No PNG writer available");
            }
            logger.debug("Converted TIFF {} ({}x{}) to PNG", fileName, image.getWidth(), image.getHeight());
            return out.toByteArray();
        } catch (IOException e) {
            throw new CorruptDocumentException(fileName, "Failed to decode TIFF image " + fileName + ": " + e.getMessage(), e);
        }
    }

    BufferedImage scaleToFit(BufferedImage source, int maxDimension) {
        int width = source.getWidth();
        int height = source.getHeight();
        int longer = Math.max(width, height);
        if (longer <= maxDimension) {
            return toRgb(source);
        }

        double ratio = (double) maxDimension / longer;
        int targetWidth = Math.max(1, Math.min(maxDimension, (int) Math.round(width * ratio)));
        int targetHeight = Math.max(1, Math.min(maxDimension, (int) Math.round(height * ratio)));

        BufferedImage scaled = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, targetWidth, targetHeight, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    private BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        // JPEG has no alpha channel; flatten onto white
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private byte[] encodeJpeg(BufferedImage image, float quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }
}
