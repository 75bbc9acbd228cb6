package uk.gegc.docpond.features.ocr.domain;

import java.util.List;

/**
 * Maps model bounding boxes onto a raster. Boxes are taken as normalized to 0..1000 when no
 * coordinate on the page exceeds 1000 while the raster is larger than 1000 on some axis;
 * otherwise they are already pixels.
 */
public record CoordinateScale(double scaleX, double scaleY, boolean normalized) {

    public static final int NORMALIZED_RANGE = 1000;

    public static CoordinateScale detect(List<Reference> references, int imageWidth, int imageHeight) {
        int maxCoordinate = references.stream().mapToInt(Reference::maxCoordinate).max().orElse(0);
        boolean normalized = maxCoordinate <= NORMALIZED_RANGE
                && (imageWidth > NORMALIZED_RANGE || imageHeight > NORMALIZED_RANGE);
        if (!normalized) {
            return new CoordinateScale(1.0, 1.0, false);
        }
        return new CoordinateScale(
                imageWidth / (double) NORMALIZED_RANGE,
                imageHeight / (double) NORMALIZED_RANGE,
                true);
    }

    /**
     * Scales the first four values of a box, truncating to whole pixels.
     */
    public int[] apply(List<Integer> box) {
        if (box.size() < 4) {
            throw new IllegalArgumentException("Bounding box needs 4 values, got " + box.size());
        }
        return new int[]{
                (int) (box.get(0) * scaleX),
                (int) (box.get(1) * scaleY),
                (int) (box.get(2) * scaleX),
                (int) (box.get(3) * scaleY)
        };
    }
}
