package uk.gegc.docpond.features.pdf.application;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.multipdf.Splitter;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;
import uk.gegc.docpond.features.pdf.domain.RasterizedPage;
import uk.gegc.docpond.shared.exception.PdfProcessingException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * PDF operations used by the pipeline, on top of Apache PDFBox.
 */
@Component
@Slf4j
public class PdfPageRasterizer {

    private static final byte[] PDF_SIGNATURE = "%PDF".getBytes(StandardCharsets.US_ASCII);
    private static final float BASE_DPI = 72f;

    /**
     * True when the bytes are non-empty and start with the {@code %PDF} signature.
     */
    public static boolean isPdf(byte[] bytes) {
        if (bytes == null || bytes.length < PDF_SIGNATURE.length) {
            return false;
        }
        for (int i = 0; i < PDF_SIGNATURE.length; i++) {
            if (bytes[i] != PDF_SIGNATURE[i]) {
                return false;
            }
        }
        return true;
    }

    public int countPages(byte[] pdf) {
        try (PDDocument document = PDDocument.load(new ByteArrayInputStream(pdf))) {
            return document.getNumberOfPages();
        } catch (IOException e) {
            throw new PdfProcessingException("Failed to open PDF: " + e.getMessage(), e);
        }
    }

    /**
     * Renders one page at {@code zoom} times the PDF's 72 dpi base resolution.
     */
    public RasterizedPage render(byte[] pdf, int pageIndex, float zoom) {
        if (!isPdf(pdf)) {
            throw new PdfProcessingException("Bytes are empty or not a PDF");
        }
        try (PDDocument document = PDDocument.load(new ByteArrayInputStream(pdf))) {
            if (pageIndex < 0 || pageIndex >= document.getNumberOfPages()) {
                throw new PdfProcessingException("Page index %d out of range (%d pages)"
                        .formatted(pageIndex, document.getNumberOfPages()));
            }
            PDFRenderer renderer = new PDFRenderer(document);
            return new RasterizedPage(renderer.renderImageWithDPI(pageIndex, BASE_DPI * zoom, ImageType.RGB));
        } catch (IOException e) {
            throw new PdfProcessingException("Failed to render page " + pageIndex + ": " + e.getMessage(), e);
        }
    }

    /**
     * Splits a PDF into single-page PDFs, in page order.
     */
    public List<byte[]> split(byte[] pdf) {
        try (PDDocument document = PDDocument.load(new ByteArrayInputStream(pdf))) {
            List<PDDocument> parts = new Splitter().split(document);
            List<byte[]> pages = new ArrayList<>(parts.size());
            try {
                for (PDDocument part : parts) {
                    ByteArrayOutputStream out = new ByteArrayOutputStream();
                    part.save(out);
                    pages.add(out.toByteArray());
                }
            } finally {
                for (PDDocument part : parts) {
                    closeQuietly(part);
                }
            }
            log.debug("Split PDF into {} pages", pages.size());
            return pages;
        } catch (IOException e) {
            throw new PdfProcessingException("Failed to split PDF: " + e.getMessage(), e);
        }
    }

    private void closeQuietly(PDDocument document) {
        try {
            document.close();
        } catch (IOException e) {
            log.warn("Failed to close split page document: {}", e.getMessage());
        }
    }
}
