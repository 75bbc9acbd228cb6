package uk.gegc.docpond.features.ocr.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.docpond.features.ocr.domain.ImageUrlResolver;
import uk.gegc.docpond.features.ocr.domain.ParsedOcrOutput;
import uk.gegc.docpond.features.ocr.domain.Reference;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns grounding-tagged OCR output into typed regions and Markdown.
 * <p>
 * A segment looks like {@code <|ref|>type<|/ref|><|det|>[[x1, y1, x2, y2]]<|/det|>content}; the plain
 * {@code <ref>...</ref><det>...</det>} delimiters are accepted as well. Content runs to the next
 * opening ref tag or the end of input. Text outside segments is dropped.
 */
@Component
@Slf4j
public class BoundingBoxReferenceParser {

    private static final Pattern SEGMENT = Pattern.compile(
            "<\\|?ref\\|?>(\\w+)<\\|?/ref\\|?><\\|?det\\|?>(\\[\\[.*?]])<\\|?/det\\|?>(.*?)(?=<\\|?ref\\|?>|\\z)",
            Pattern.DOTALL);
    private static final Pattern NUMBER = Pattern.compile("\\d+");
    private static final Pattern NUMBERED_ITEM = Pattern.compile("^(\\d+)\\s");

    public ParsedOcrOutput parse(String rawText) {
        return parse(rawText, null);
    }

    public ParsedOcrOutput parse(String rawText, ImageUrlResolver imageUrlResolver) {
        ImageUrlResolver resolver = imageUrlResolver != null ? imageUrlResolver : ImageUrlResolver.defaultResolver();
        List<Reference> references = new ArrayList<>();
        List<String> blocks = new ArrayList<>();
        if (rawText == null || rawText.isEmpty()) {
            return new ParsedOcrOutput(references, "");
        }

        int imageIndex = 0;
        Matcher matcher = SEGMENT.matcher(rawText);
        while (matcher.find()) {
            Reference reference = new Reference(
                    matcher.group(1),
                    parseBoundingBox(matcher.group(2)),
                    matcher.group(3).strip());
            references.add(reference);

            if (reference.isImage()) {
                blocks.add("![Image](" + resolver.resolve(imageIndex, reference) + ")\n");
                imageIndex++;
            } else {
                blocks.add(renderText(reference) + "\n");
            }
        }
        return new ParsedOcrOutput(references, String.join("\n", blocks));
    }

    /**
     * Extracts up to four integers, in order. A malformed payload yields a shorter list; a number
     * outside the int range ends the box there.
     */
    static List<Integer> parseBoundingBox(String payload) {
        List<Integer> box = new ArrayList<>(4);
        Matcher matcher = NUMBER.matcher(payload);
        while (box.size() < 4 && matcher.find()) {
            try {
                box.add(Integer.parseInt(matcher.group()));
            } catch (NumberFormatException e) {
                log.warn("Bounding box value out of range: {}", matcher.group());
                break;
            }
        }
        return box;
    }

    private String renderText(Reference reference) {
        String content = reference.content();
        return switch (reference.type()) {
            case Reference.TYPE_SUB_TITLE -> content.startsWith("#") ? content : "## " + content;
            case Reference.TYPE_TEXT -> NUMBERED_ITEM.matcher(content).replaceFirst("$1. ");
            default -> content;
        };
    }
}
