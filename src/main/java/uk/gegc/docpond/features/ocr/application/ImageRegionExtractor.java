package uk.gegc.docpond.features.ocr.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.docpond.features.ocr.domain.CoordinateScale;
import uk.gegc.docpond.features.ocr.domain.ExtractedRegion;
import uk.gegc.docpond.features.ocr.domain.Reference;
import uk.gegc.docpond.features.ocr.domain.RegionImage;
import uk.gegc.docpond.features.ocr.domain.RegionImageSink;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Crops image-typed regions out of a rendered page.
 */
@Component
@Slf4j
public class ImageRegionExtractor {

    /**
     * Crops and hands each image region to the sink. {@code regionIndex} is the ordinal among image
     * references, so it matches the parser's image index. A region that cannot be cropped or saved is
     * skipped; later regions are still processed.
     */
    public List<ExtractedRegion> extract(BufferedImage source, List<Reference> references, RegionImageSink sink) {
        List<ExtractedRegion> extracted = new ArrayList<>();
        CoordinateScale scale = CoordinateScale.detect(references, source.getWidth(), source.getHeight());
        if (scale.normalized()) {
            log.debug("Treating boxes as normalized coordinates (scale {}x{})", scale.scaleX(), scale.scaleY());
        }

        int regionIndex = 0;
        for (Reference reference : references) {
            if (!reference.isImage()) {
                continue;
            }
            int index = regionIndex++;
            if (!reference.hasCompleteBox()) {
                log.warn("Skipping image region {}: bounding box {} is incomplete", index, reference.boundingBox());
                continue;
            }
            int[] box = clamp(scale.apply(reference.boundingBox()), source.getWidth(), source.getHeight());
            int width = box[2] - box[0];
            int height = box[3] - box[1];
            if (width <= 0 || height <= 0) {
                log.warn("Skipping image region {}: empty crop for box {}", index, reference.boundingBox());
                continue;
            }
            try {
                byte[] png = encodePng(source.getSubimage(box[0], box[1], width, height));
                sink.accept(new RegionImage(index, reference, png, width, height));
                extracted.add(new ExtractedRegion(index, png.length, width, height));
            } catch (Exception e) {
                log.warn("Skipping image region {}: {}", index, e.getMessage(), e);
            }
        }
        return extracted;
    }

    private static int[] clamp(int[] box, int width, int height) {
        return new int[]{
                Math.max(0, Math.min(box[0], width)),
                Math.max(0, Math.min(box[1], height)),
                Math.max(0, Math.min(box[2], width)),
                Math.max(0, Math.min(box[3], height))
        };
    }

    static byte[] encodePng(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }
}
