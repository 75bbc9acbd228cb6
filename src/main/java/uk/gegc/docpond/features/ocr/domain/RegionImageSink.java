package uk.gegc.docpond.features.ocr.domain;

@FunctionalInterface
public interface RegionImageSink {

    /**
     * Persists one region. Throwing skips this region only.
     */
    void accept(RegionImage image);
}
