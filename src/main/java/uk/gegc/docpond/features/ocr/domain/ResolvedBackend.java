package uk.gegc.docpond.features.ocr.domain;

public record ResolvedBackend(OcrBackend backend, BackendSettings settings) {
}
