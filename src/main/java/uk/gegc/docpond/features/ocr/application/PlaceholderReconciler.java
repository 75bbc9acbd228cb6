package uk.gegc.docpond.features.ocr.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.docpond.features.ocr.domain.ImageLink;
import uk.gegc.docpond.features.ocr.domain.ImageUrlResolver;
import uk.gegc.docpond.features.ocr.domain.ReconciledMarkdown;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Links image placeholders to persisted images.
 * <ol>
 *   <li>The parser writes {@code __IMAGE_PLACEHOLDER_<index>__} for each image region
 *   ({@link #placeholderResolver()}).</li>
 *   <li>Regions are persisted; each save yields an {@link ImageLink}.</li>
 *   <li>{@link #reconcile(String, List)} substitutes linked placeholders and removes every line that
 *   still carries one.</li>
 * </ol>
 */
@Component
@Slf4j
public class PlaceholderReconciler {

    public static final String PLACEHOLDER_PREFIX = "__IMAGE_PLACEHOLDER_";
    private static final String PLACEHOLDER_FORMAT = PLACEHOLDER_PREFIX + "%d__";
    private static final Pattern PLACEHOLDER = Pattern.compile("__IMAGE_PLACEHOLDER_(\\d+)__");
    private static final Pattern ORPHAN_LINE = Pattern.compile("(?m)^.*__IMAGE_PLACEHOLDER_\\d+__.*(\\r?\\n)?");

    public static String placeholder(int index) {
        return PLACEHOLDER_FORMAT.formatted(index);
    }

    public ImageUrlResolver placeholderResolver() {
        return (imageIndex, reference) -> placeholder(imageIndex);
    }

    public ReconciledMarkdown reconcile(String markdown, List<ImageLink> links) {
        if (markdown == null || markdown.isEmpty()) {
            return new ReconciledMarkdown("", 0, List.of());
        }
        String result = markdown;
        int linked = 0;
        for (ImageLink link : links) {
            String token = placeholder(link.regionIndex());
            if (result.contains(token)) {
                result = result.replace(token, link.url());
                linked++;
            }
        }

        TreeSet<Integer> orphans = new TreeSet<>();
        Matcher matcher = PLACEHOLDER.matcher(result);
        while (matcher.find()) {
            orphans.add(Integer.parseInt(matcher.group(1)));
        }
        if (!orphans.isEmpty()) {
            result = ORPHAN_LINE.matcher(result).replaceAll("");
            log.warn("Partial image extraction: removed {} image line(s) with no saved image, region indices {}",
                    orphans.size(), orphans);
        }
        return new ReconciledMarkdown(result, linked, new ArrayList<>(orphans));
    }

    /**
     * Positional form: the i-th url replaces placeholder i.
     */
    public ReconciledMarkdown reconcileOrdered(String markdown, List<String> orderedUrls) {
        List<ImageLink> links = new ArrayList<>(orderedUrls.size());
        for (int i = 0; i < orderedUrls.size(); i++) {
            links.add(new ImageLink(i, orderedUrls.get(i)));
        }
        return reconcile(markdown, links);
    }
}
