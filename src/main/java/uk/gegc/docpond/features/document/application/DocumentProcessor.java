package uk.gegc.docpond.features.document.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import uk.gegc.docpond.features.document.config.PipelineProperties;
import uk.gegc.docpond.features.document.domain.event.PageSplitRequestedEvent;
import uk.gegc.docpond.features.document.domain.event.ThumbnailRequestedEvent;
import uk.gegc.docpond.features.document.domain.model.Document;
import uk.gegc.docpond.features.document.domain.model.ProcessingStatus;
import uk.gegc.docpond.features.document.infra.repository.DocumentRepository;
import uk.gegc.docpond.features.ocr.application.TextLayerService;
import uk.gegc.docpond.features.pdf.application.PdfPageRasterizer;
import uk.gegc.docpond.features.storage.application.StorageService;
import uk.gegc.docpond.shared.exception.DocumentNotFoundException;
import uk.gegc.docpond.shared.exception.DocumentProcessingException;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Document-level pipeline: optional text layer, page count, then thumbnail and page split, both
 * dispatched asynchronously.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentProcessor {

    private final DocumentRepository documentRepository;
    private final StorageService storageService;
    private final PdfPageRasterizer rasterizer;
    private final TextLayerService textLayerService;
    private final ApplicationEventPublisher eventPublisher;
    private final PipelineProperties pipelineProperties;

    /**
     * @throws DocumentNotFoundException   when the document is still missing after every lookup attempt
     * @throws DocumentProcessingException when the source PDF cannot be read; the document is FAILED
     */
    public void process(UUID documentId) {
        Document document = findWithRetry(documentId);
        log.info("Processing document {} '{}'", documentId, document.getTitle());
        documentRepository.updateStatus(documentId, ProcessingStatus.PROCESSING, Instant.now());

        if (document.getOcrPreset() != null && !document.isTextLayerApplied()) {
            applyTextLayer(document);
        }

        int pageCount;
        try {
            byte[] source = storageService.read(document.getSourcePdfKey());
            pageCount = rasterizer.countPages(source);
        } catch (RuntimeException e) {
            log.error("Cannot read source PDF of document {}", documentId, e);
            documentRepository.updateStatus(documentId, ProcessingStatus.FAILED, Instant.now());
            throw new DocumentProcessingException(documentId.toString(), "read", e.getMessage());
        }

        if (documentRepository.initializePageCount(documentId, pageCount, Instant.now()) > 0) {
            log.info("Document {} has {} pages", documentId, pageCount);
        } else {
            log.debug("Page count of document {} already recorded, leaving it unchanged", documentId);
        }

        eventPublisher.publishEvent(new ThumbnailRequestedEvent(this, documentId));
        eventPublisher.publishEvent(new PageSplitRequestedEvent(this, documentId));
    }

    private void applyTextLayer(Document document) {
        try {
            byte[] source = storageService.read(document.getSourcePdfKey());
            byte[] withText = textLayerService.addTextLayer(source, document.getOcrPreset());
            storageService.save(document.getSourcePdfKey(), withText, "application/pdf");
            documentRepository.markTextLayerApplied(document.getId(), Instant.now());
            document.setTextLayerApplied(true);
            log.info("Applied text layer to document {} with preset '{}'", document.getId(), document.getOcrPreset().getName());
        } catch (Exception e) {
            log.warn("Text layer failed for document {}, continuing with the original PDF: {}",
                    document.getId(), e.getMessage(), e);
        }
    }

    private Document findWithRetry(UUID documentId) {
        int maxAttempts = pipelineProperties.getLookup().getMaxAttempts();
        for (int attempt = 1; ; attempt++) {
            Optional<Document> document = documentRepository.findById(documentId);
            if (document.isPresent()) {
                return document.get();
            }
            if (attempt >= maxAttempts) {
                log.error("Document {} not found after {} attempts", documentId, attempt);
                throw new DocumentNotFoundException(documentId);
            }
            long delayMs = calculateBackoffDelay(attempt);
            log.warn("Document {} not found (attempt {}/{}), retrying in {} ms", documentId, attempt, maxAttempts, delayMs);
            sleep(delayMs);
        }
    }

    private long calculateBackoffDelay(int attempt) {
        long base = pipelineProperties.getLookup().getBaseDelay().toMillis();
        long max = pipelineProperties.getLookup().getMaxDelay().toMillis();
        return Math.min(base * (1L << Math.min(attempt - 1, 20)), max);
    }

    /**
     * Overridden in tests to avoid real waiting.
     */
    protected void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new DocumentProcessingException("Interrupted while waiting for document lookup", ie);
        }
    }
}
