package uk.gegc.docpond.features.ocr.domain;

/**
 * A pluggable OCR or layout engine. Implementations are stateless and safe to call from
 * several page workers at once.
 */
public interface OcrBackend {

    BackendType type();

    OcrOutput run(OcrInput input);
}
