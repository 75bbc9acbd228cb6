package uk.gegc.docpond.features.document.domain.event;

import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Published when the source PDF has been counted and can be split into page PDFs.
 */
public class PageSplitRequestedEvent extends ApplicationEvent {

    private final UUID documentId;

    public PageSplitRequestedEvent(Object source, UUID documentId) {
        super(source);
        this.documentId = documentId;
    }

    public UUID getDocumentId() {
        return documentId;
    }
}
