package uk.gegc.docpond.features.ocr.domain;

public record ExtractedRegion(int regionIndex, long byteSize, int width, int height) {
}
