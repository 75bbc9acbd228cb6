package uk.gegc.docpond.features.document.domain.event;

import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Published when a document has been uploaded or reset and is ready for the document pipeline.
 */
public class DocumentProcessingRequestedEvent extends ApplicationEvent {

    private final UUID documentId;

    public DocumentProcessingRequestedEvent(Object source, UUID documentId) {
        super(source);
        this.documentId = documentId;
    }

    public UUID getDocumentId() {
        return documentId;
    }
}
