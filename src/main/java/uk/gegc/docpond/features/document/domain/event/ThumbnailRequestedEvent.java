package uk.gegc.docpond.features.document.domain.event;

import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Published when the source PDF has been counted and a cover image can be rendered.
 */
public class ThumbnailRequestedEvent extends ApplicationEvent {

    private final UUID documentId;

    public ThumbnailRequestedEvent(Object source, UUID documentId) {
        super(source);
        this.documentId = documentId;
    }

    public UUID getDocumentId() {
        return documentId;
    }
}
