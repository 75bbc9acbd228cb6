package uk.gegc.docpond.features.pdf.domain;

import uk.gegc.docpond.shared.exception.PdfProcessingException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * A page rendered to pixels. Closing it releases the raster; page jobs hold one per worker.
 */
public class RasterizedPage implements AutoCloseable {

    private BufferedImage image;

    public RasterizedPage(BufferedImage image) {
        this.image = image;
    }

    public BufferedImage image() {
        if (image == null) {
            throw new IllegalStateException("Raster already released");
        }
        return image;
    }

    public int width() {
        return image().getWidth();
    }

    public int height() {
        return image().getHeight();
    }

    public byte[] toPng() {
        return encode("png");
    }

    public byte[] toJpeg() {
        return encode("jpg");
    }

    private byte[] encode(String format) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image(), format, out)) {
                throw new PdfProcessingException("No image writer for format " + format);
            }
        } catch (IOException e) {
            throw new PdfProcessingException("Failed to encode page as " + format, e);
        }
        return out.toByteArray();
    }

    @Override
    public void close() {
        if (image != null) {
            image.flush();
            image = null;
        }
    }
}
