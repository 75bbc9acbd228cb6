package uk.gegc.docpond.features.ocr.domain;

/**
 * Produces the URL written into a Markdown image line.
 * {@code imageIndex} counts image regions only, in encounter order.
 */
@FunctionalInterface
public interface ImageUrlResolver {

    String resolve(int imageIndex, Reference reference);

    static ImageUrlResolver defaultResolver() {
        return (imageIndex, reference) -> "output/image_" + imageIndex + ".png";
    }
}
