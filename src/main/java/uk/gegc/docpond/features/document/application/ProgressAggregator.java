package uk.gegc.docpond.features.document.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.docpond.features.document.domain.model.Document;
import uk.gegc.docpond.features.document.domain.model.ProcessingStatus;
import uk.gegc.docpond.features.document.domain.model.ProgressSnapshot;
import uk.gegc.docpond.features.document.infra.repository.DocumentRepository;
import uk.gegc.docpond.features.document.infra.repository.PageRepository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Recomputes a document's progress from its pages after every page outcome. The document row is
 * locked before the pages are counted, so the last writer always sees every committed page.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProgressAggregator {

    private final DocumentRepository documentRepository;
    private final PageRepository pageRepository;

    @Transactional
    public Optional<ProgressSnapshot> update(UUID documentId) {
        Optional<Document> maybeDocument = documentRepository.findByIdForUpdate(documentId);
        if (maybeDocument.isEmpty()) {
            log.warn("Cannot update progress: document {} not found", documentId);
            return Optional.empty();
        }
        int pageCount = maybeDocument.get().getPageCount();
        if (pageCount <= 0) {
            log.debug("Document {} has no page count yet, progress left unchanged", documentId);
            return Optional.empty();
        }

        long completed = pageRepository.countByDocument_IdAndStatus(documentId, ProcessingStatus.COMPLETED);
        long terminal = pageRepository.countByDocument_IdAndStatusIn(documentId, ProcessingStatus.TERMINAL);
        ProgressSnapshot snapshot = ProgressSnapshot.of(pageCount, completed, terminal);

        documentRepository.updateProgress(documentId, snapshot.processedPages(), snapshot.status(), Instant.now());
        log.info("Document {} progress: {}/{} pages, status {}", documentId,
                snapshot.processedPages(), pageCount, snapshot.status());
        return Optional.of(snapshot);
    }
}
