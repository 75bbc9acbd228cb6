package uk.gegc.docpond.features.ocr.domain;

import java.util.List;

/**
 * Result of one backend call.
 * <p>
 * Grounding backends return only {@code rawOutput}, which the caller parses. Layout backends also
 * return Markdown whose image lines carry placeholders; {@code images.get(i)} is the PNG or JPEG
 * payload for placeholder {@code i}.
 */
public record OcrOutput(String rawOutput, String markdown, List<byte[]> images, String structuredJson) {

    public OcrOutput {
        images = images == null ? List.of() : List.copyOf(images);
    }

    public static OcrOutput grounding(String rawOutput) {
        return new OcrOutput(rawOutput, null, List.of(), null);
    }

    public boolean needsParsing() {
        return markdown == null;
    }
}
