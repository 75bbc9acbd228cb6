package uk.gegc.docpond.features.ocr.application;

import org.springframework.stereotype.Component;
import uk.gegc.docpond.features.ocr.domain.CoordinateScale;
import uk.gegc.docpond.features.ocr.domain.Reference;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Draws every region box over a copy of the page, for debugging OCR layouts.
 */
@Component
public class BoundingBoxVisualizer {

    private static final Map<String, Color> COLORS = Map.of(
            Reference.TYPE_IMAGE, Color.RED,
            Reference.TYPE_TEXT, Color.BLUE,
            Reference.TYPE_SUB_TITLE, Color.GREEN,
            Reference.TYPE_TITLE, new Color(128, 0, 128)
    );
    private static final Color DEFAULT_COLOR = Color.YELLOW;
    private static final int LABEL_OFFSET = 15;

    public byte[] render(BufferedImage source, List<Reference> references) throws IOException {
        BufferedImage copy = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = copy.createGraphics();
        try {
            g.drawImage(source, 0, 0, null);
            g.setStroke(new BasicStroke(3));
            CoordinateScale scale = CoordinateScale.detect(references, source.getWidth(), source.getHeight());
            int ascent = g.getFontMetrics().getAscent();

            for (int i = 0; i < references.size(); i++) {
                Reference reference = references.get(i);
                if (!reference.hasCompleteBox()) {
                    continue;
                }
                int[] box = scale.apply(reference.boundingBox());
                g.setColor(COLORS.getOrDefault(reference.type(), DEFAULT_COLOR));
                g.drawRect(box[0], box[1], box[2] - box[0], box[3] - box[1]);
                g.drawString((i + 1) + ": " + reference.type(), box[0], box[1] - LABEL_OFFSET + ascent);
            }
        } finally {
            g.dispose();
        }
        return ImageRegionExtractor.encodePng(copy);
    }
}
