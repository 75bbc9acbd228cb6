package uk.gegc.docpond.features.ocr.domain;

/**
 * What a backend may consume for one page: the single-page PDF and its rendering.
 */
public record OcrInput(int pageNumber, byte[] pdfBytes, byte[] pngBytes, BackendSettings settings) {
}
