package uk.gegc.docpond.features.document.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import uk.gegc.docpond.features.document.domain.event.PageProcessingRequestedEvent;
import uk.gegc.docpond.features.document.domain.model.Document;
import uk.gegc.docpond.features.document.domain.model.Page;
import uk.gegc.docpond.features.document.domain.model.ProcessingStatus;
import uk.gegc.docpond.features.document.domain.model.StorageKeys;
import uk.gegc.docpond.features.document.infra.repository.DocumentRepository;
import uk.gegc.docpond.features.document.infra.repository.PageRepository;
import uk.gegc.docpond.features.pdf.application.PdfPageRasterizer;
import uk.gegc.docpond.features.storage.application.StorageService;
import uk.gegc.docpond.shared.exception.DocumentNotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Splits a document into single-page PDFs and queues OCR for each page.
 * <p>
 * Safe to run again for the same document: pages are looked up by number before being created,
 * and pages that already completed are neither rewritten nor requeued.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PageSplitter {

    private static final String PDF = "application/pdf";

    private final DocumentRepository documentRepository;
    private final PageRepository pageRepository;
    private final StorageService storageService;
    private final PdfPageRasterizer rasterizer;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * @return ids of the pages queued for processing
     */
    public List<UUID> split(UUID documentId) {
        Document document = documentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        List<byte[]> pagePdfs = rasterizer.split(storageService.read(document.getSourcePdfKey()));
        log.info("Splitting document {} into {} pages", documentId, pagePdfs.size());

        List<UUID> queued = new ArrayList<>();
        for (int i = 0; i < pagePdfs.size(); i++) {
            int pageNumber = i + 1;
            byte[] bytes = pagePdfs.get(i);
            if (!PdfPageRasterizer.isPdf(bytes)) {
                log.warn("Skipping page {} of document {}: split output is empty or not a PDF", pageNumber, documentId);
                continue;
            }

            Page page = getOrCreate(document, pageNumber);
            if (page.getStatus() == ProcessingStatus.COMPLETED) {
                log.debug("Page {} of document {} already completed", pageNumber, documentId);
                continue;
            }
            String key = StorageKeys.pagePdf(document, pageNumber);
            storageService.save(key, bytes, PDF);
            if (!key.equals(page.getPagePdfKey())) {
                page.setPagePdfKey(key);
                page = pageRepository.save(page);
            }
            queued.add(page.getId());
            eventPublisher.publishEvent(new PageProcessingRequestedEvent(this, page.getId()));
        }
        log.info("Queued {} pages of document {} for processing", queued.size(), documentId);
        return queued;
    }

    /**
     * Looks the page up by number and creates it when missing. A concurrent insert of the same
     * page surfaces as a unique-constraint violation, after which the winner's row is returned.
     */
    Page getOrCreate(Document document, int pageNumber) {
        return pageRepository.findByDocument_IdAndPageNumber(document.getId(), pageNumber)
                .orElseGet(() -> {
                    Page page = new Page();
                    page.setDocument(document);
                    page.setPageNumber(pageNumber);
                    page.setStatus(ProcessingStatus.PENDING);
                    try {
                        return pageRepository.saveAndFlush(page);
                    } catch (DataIntegrityViolationException e) {
                        log.debug("Page {} of document {} was created concurrently", pageNumber, document.getId());
                        return pageRepository.findByDocument_IdAndPageNumber(document.getId(), pageNumber)
                                .orElseThrow(() -> e);
                    }
                });
    }
}
