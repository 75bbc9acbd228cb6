package uk.gegc.docpond.features.ocr.domain;

/**
 * Final address of a persisted region, keyed by the region index its placeholder carries.
 */
public record ImageLink(int regionIndex, String url) {
}
