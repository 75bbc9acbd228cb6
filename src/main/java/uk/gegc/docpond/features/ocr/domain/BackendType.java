package uk.gegc.docpond.features.ocr.domain;

public enum BackendType {
    /**
     * Vision model emitting grounding-tagged text for a rendered page image.
     */
    GROUNDING,
    /**
     * Document-layout engine converting a page PDF straight to Markdown.
     */
    LAYOUT
}
