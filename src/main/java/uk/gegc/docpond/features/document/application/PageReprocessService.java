package uk.gegc.docpond.features.document.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.docpond.features.document.domain.event.DocumentProcessingRequestedEvent;
import uk.gegc.docpond.features.document.domain.event.PageProcessingRequestedEvent;
import uk.gegc.docpond.features.document.domain.model.Document;
import uk.gegc.docpond.features.document.domain.model.Page;
import uk.gegc.docpond.features.document.domain.model.ProcessingStatus;
import uk.gegc.docpond.features.document.infra.repository.DocumentRepository;
import uk.gegc.docpond.features.document.infra.repository.PageRepository;
import uk.gegc.docpond.features.storage.application.StorageService;
import uk.gegc.docpond.shared.exception.DocumentNotFoundException;
import uk.gegc.docpond.shared.exception.PageNotFoundException;
import uk.gegc.docpond.shared.exception.StorageException;

import java.time.Instant;
import java.util.UUID;

/**
 * Explicit reset-and-requeue. Jobs already in flight are not cancelled.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PageReprocessService {

    private final PageRepository pageRepository;
    private final DocumentRepository documentRepository;
    private final ExtractedImageService imageService;
    private final StorageService storageService;
    private final ProgressAggregator progressAggregator;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public Page reprocessPage(UUID pageId) {
        Page page = pageRepository.findById(pageId)
                .orElseThrow(() -> new PageNotFoundException(pageId));

        int removed = imageService.deleteForPage(pageId);
        if (page.getBboxVisualizationKey() != null) {
            try {
                storageService.delete(page.getBboxVisualizationKey());
            } catch (StorageException e) {
                log.warn("Failed to delete overlay {}: {}", page.getBboxVisualizationKey(), e.getMessage());
            }
        }
        page.clearOcrResults();
        page.setStatus(ProcessingStatus.PENDING);
        Page saved = pageRepository.saveAndFlush(page);

        UUID documentId = saved.getDocument().getId();
        progressAggregator.update(documentId);
        eventPublisher.publishEvent(new PageProcessingRequestedEvent(this, pageId));
        log.info("Page {} of document {} reset for reprocessing ({} images removed)", saved.getPageNumber(), documentId, removed);
        return saved;
    }

    @Transactional
    public Document reprocessDocument(UUID documentId) {
        Document document = documentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        documentRepository.updateStatus(documentId, ProcessingStatus.PENDING, Instant.now());
        document.setStatus(ProcessingStatus.PENDING);
        eventPublisher.publishEvent(new DocumentProcessingRequestedEvent(this, documentId));
        log.info("Document {} reset for reprocessing", documentId);
        return document;
    }
}
