package uk.gegc.docpond.features.document.application;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.docpond.features.document.domain.model.Document;
import uk.gegc.docpond.features.document.domain.model.Page;
import uk.gegc.docpond.features.document.infra.repository.PageRepository;
import uk.gegc.docpond.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class PageSearchService {

    static final int SNIPPET_LENGTH = 300;
    static final int MAX_LIMIT = 200;
    private static final String ELLIPSIS = "...";

    private final PageRepository pageRepository;

    /**
     * Case-insensitive substring search over completed pages, grouped by document.
     */
    @Transactional(readOnly = true)
    public List<DocumentHits> search(String query, UUID documentId, int limit) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Search query must not be blank");
        }
        String q = query.strip();
        int size = Math.max(1, Math.min(limit, MAX_LIMIT));
        List<Page> pages = pageRepository.searchCompletedMarkdown(q, documentId, PageRequest.of(0, size));

        Map<UUID, DocumentHits> grouped = new LinkedHashMap<>();
        for (Page page : pages) {
            Document document = page.getDocument();
            grouped.computeIfAbsent(document.getId(),
                            id -> new DocumentHits(id, document.getTitle(), document.getCollectionName(), new ArrayList<>()))
                    .pages()
                    .add(new PageHit(page.getId(), page.getPageNumber(), snippet(page.getMarkdown(), q, SNIPPET_LENGTH)));
        }
        return List.copyOf(grouped.values());
    }

    /**
     * Window of {@code maxLength} characters centred on the first match, with ellipses where text
     * was cut. Without a match the start of the text is returned.
     */
    static String snippet(String text, String query, int maxLength) {
        if (text == null) {
            return "";
        }
        int index = text.toLowerCase(Locale.ROOT).indexOf(query.toLowerCase(Locale.ROOT));
        if (index < 0) {
            return text.length() > maxLength ? text.substring(0, maxLength) + ELLIPSIS : text;
        }
        int start = Math.max(0, index - maxLength / 2);
        int end = Math.min(text.length(), start + maxLength);
        if (end - start < maxLength) {
            start = Math.max(0, end - maxLength);
        }
        String snippet = text.substring(start, end);
        if (start > 0) {
            snippet = ELLIPSIS + snippet;
        }
        if (end < text.length()) {
            snippet = snippet + ELLIPSIS;
        }
        return snippet;
    }

    public record DocumentHits(UUID documentId, String title, String collectionName, List<PageHit> pages) {
    }

    public record PageHit(UUID pageId, int pageNumber, String snippet) {
    }
}
