package uk.gegc.docpond.features.ocr.domain;

/**
 * A cropped region encoded as PNG, handed to a {@link RegionImageSink}.
 */
public record RegionImage(int regionIndex, Reference reference, byte[] png, int width, int height) {
}
