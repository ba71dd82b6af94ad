package im.arun.docingest.testsupport;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

public final class TestImages {

    private TestImages() {}

    public static BufferedImage gradient(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            for (int x = 0; x < width; x += 8) {
                g.setColor(new Color((x * 255) / Math.max(width, 1), 128, 200));
                g.fillRect(x, 0, 8, height);
            }
            g.setColor(Color.BLACK);
            g.drawString("SCAN", width / 4, height / 2);
        } finally {
            g.dispose();
        }
        return image;
    }

    public static byte[] encode(BufferedImage image, String format) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(image, format, out)) {
            throw new IOException("No writer for " + format);
        }
        return out.toByteArray();
    }

    public static byte[] png(int width, int height) throws IOException {
        return encode(gradient(width, height), "png");
    }
}
