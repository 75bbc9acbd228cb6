package uk.gegc.docpond.features.document.domain.event;

import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Published when a page PDF is stored and the page is waiting for OCR.
 */
public class PageProcessingRequestedEvent extends ApplicationEvent {

    private final UUID pageId;

    public PageProcessingRequestedEvent(Object source, UUID pageId) {
        super(source);
        this.pageId = pageId;
    }

    public UUID getPageId() {
        return pageId;
    }
}
