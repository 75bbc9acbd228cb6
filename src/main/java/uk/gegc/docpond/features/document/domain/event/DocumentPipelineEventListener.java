package uk.gegc.docpond.features.document.domain.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.docpond.features.document.application.DocumentProcessor;
import uk.gegc.docpond.features.document.application.PageSplitter;
import uk.gegc.docpond.features.document.application.ThumbnailService;

/**
 * Runs document-level stages on the document pool after the publishing transaction commits.
 * Events published outside a transaction are handled straight away.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentPipelineEventListener {

    private final DocumentProcessor documentProcessor;
    private final ThumbnailService thumbnailService;
    private final PageSplitter pageSplitter;

    @Async("documentTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleDocumentProcessingRequested(DocumentProcessingRequestedEvent event) {
        log.debug("Received DocumentProcessingRequestedEvent for document {}", event.getDocumentId());
        documentProcessor.process(event.getDocumentId());
    }

    @Async("documentTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleThumbnailRequested(ThumbnailRequestedEvent event) {
        log.debug("Received ThumbnailRequestedEvent for document {}", event.getDocumentId());
        thumbnailService.generate(event.getDocumentId());
    }

    @Async("documentTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handlePageSplitRequested(PageSplitRequestedEvent event) {
        log.debug("Received PageSplitRequestedEvent for document {}", event.getDocumentId());
        pageSplitter.split(event.getDocumentId());
    }
}
