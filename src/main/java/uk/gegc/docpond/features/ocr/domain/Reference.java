package uk.gegc.docpond.features.ocr.domain;

import java.util.List;

/**
 * One tagged region of grounding OCR output.
 *
 * @param type        region type tag such as {@code text}, {@code image}, {@code sub_title}
 * @param boundingBox {@code [x1, y1, x2, y2]}; may be shorter when the model emitted a malformed box
 * @param content     trimmed text following the tag
 */
public record Reference(String type, List<Integer> boundingBox, String content) {

    public static final String TYPE_IMAGE = "image";
    public static final String TYPE_TEXT = "text";
    public static final String TYPE_SUB_TITLE = "sub_title";
    public static final String TYPE_TITLE = "title";

    public Reference {
        boundingBox = boundingBox == null ? List.of() : List.copyOf(boundingBox);
        content = content == null ? "" : content;
    }

    public boolean isImage() {
        return TYPE_IMAGE.equals(type);
    }

    public boolean hasCompleteBox() {
        return boundingBox.size() >= 4;
    }

    public int maxCoordinate() {
        return boundingBox.stream().mapToInt(Integer::intValue).max().orElse(0);
    }
}
