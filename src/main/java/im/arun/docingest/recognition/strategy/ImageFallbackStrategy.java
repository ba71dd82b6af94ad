package im.arun.docingest.recognition.strategy;

import im.arun.docingest.image.ImageNormalizer;
import im.arun.docingest.model.EncodedImage;
import im.arun.docingest.model.LogicalDocument;
import im.arun.docingest.model.ProjectSettings;
import im.arun.docingest.model.RecognitionRequest;
import im.arun.docingest.recognition.FailureCause;
import im.arun.docingest.recognition.RecognitionClient;
import im.arun.docingest.recognition.RecognitionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Rasterizes the document (first page of the boundary, or the uploaded image), normalizes it
 * and sends it as an image request.
 */
public class ImageFallbackStrategy implements RecognitionStrategy {
    private static final Logger logger = LoggerFactory.getLogger(ImageFallbackStrategy.class);

    private final RecognitionClient client;
    private final ImageNormalizer normalizer;
    private final int maxDimension;
    private final float quality;
    private final int maxRetries;

    public ImageFallbackStrategy(RecognitionClient client, ImageNormalizer normalizer,
                                 int maxDimension, float quality, int maxRetries) {
        this.client = client;
        this.normalizer = normalizer;
        this.maxDimension = maxDimension;
        this.quality = quality;
        this.maxRetries = maxRetries;
    }

    @Override
    public String name() {
        return "image";
    }

    @Override
    public StrategyOutcome attempt(LogicalDocument unit, ProjectSettings settings) {
        EncodedImage image;
        try {
            BufferedImage raster = unit.getImageSource().render(maxDimension);
            image = normalizer.normalize(raster, maxDimension, quality);
        } catch (IOException e) {
            logger.error("Failed to rasterize {}: {}", unit.getName(), e.getMessage());
            return StrategyOutcome.failure(FailureCause.UNREADABLE_SOURCE, "Could not rasterize " + unit.getName() + ": " + e.getMessage());
        }

        RecognitionOutcome outcome = client.recognize(RecognitionRequest.forImage(image, settings), maxRetries);
        if (!outcome.isSuccess()) {
            return StrategyOutcome.failure(outcome);
        }

        return StrategyOutcome.result(outcome.getResult(), true, image.toDataUrl());
    }
}
