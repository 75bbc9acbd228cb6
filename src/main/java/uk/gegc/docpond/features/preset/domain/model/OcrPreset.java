package uk.gegc.docpond.features.preset.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/**
 * OCRmyPDF options used to add a text layer to a whole document before it is split.
 */
@Entity
@Table(name = "ocr_presets")
@Getter
@Setter
public class OcrPreset extends BasePreset {

    public static final int DEFAULT_JPEG_QUALITY = 75;
    public static final int DEFAULT_PNG_QUALITY = 70;

    @Column(name = "force_ocr", nullable = false)
    private boolean forceOcr;

    @Column(name = "skip_text", nullable = false)
    private boolean skipText;

    @Column(name = "redo_ocr", nullable = false)
    private boolean redoOcr;

    @Enumerated(EnumType.STRING)
    @Column(name = "ocr_engine", nullable = false)
    private OcrEngine ocrEngine = OcrEngine.TESSERACT;

    /**
     * Tesseract language codes joined with {@code +}, e.g. {@code eng+nld}.
     */
    @Column(name = "language", nullable = false, length = 50)
    private String language = "eng";

    /**
     * 0 none, 1 lossless, 2 lossy, 3 aggressive.
     */
    @Column(name = "optimize", nullable = false)
    private int optimize = 1;

    @Column(name = "jpeg_quality", nullable = false)
    private int jpegQuality = DEFAULT_JPEG_QUALITY;

    @Column(name = "png_quality", nullable = false)
    private int pngQuality = DEFAULT_PNG_QUALITY;

    @Column(name = "deskew", nullable = false)
    private boolean deskew;

    @Column(name = "rotate_pages", nullable = false)
    private boolean rotatePages;

    public enum OcrEngine {
        TESSERACT, CUNEIFORM, EASYOCR
    }
}
