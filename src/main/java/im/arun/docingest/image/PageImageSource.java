package im.arun.docingest.image;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Produces the raster a logical document is recognised from when its text layer is not enough.
 * Called on the worker thread that processes the document.
 */
@FunctionalInterface
public interface PageImageSource {

    /**
     * @param maxDimension upper bound on the longer edge for sources that render (PDF pages)
     */
    BufferedImage render(int maxDimension) throws IOException;
}
