package uk.gegc.docpond.features.document.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.docpond.features.document.domain.model.Document;
import uk.gegc.docpond.features.document.domain.model.Page;
import uk.gegc.docpond.features.document.infra.repository.DocumentRepository;
import uk.gegc.docpond.features.document.infra.repository.PageRepository;
import uk.gegc.docpond.shared.exception.DocumentNotFoundException;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DocumentQueryService {

    private final DocumentRepository documentRepository;
    private final PageRepository pageRepository;

    public Document getDocument(UUID documentId) {
        return documentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
    }

    /**
     * Pages ordered by page number.
     */
    public List<Page> getPages(UUID documentId) {
        if (!documentRepository.existsById(documentId)) {
            throw new DocumentNotFoundException(documentId);
        }
        return pageRepository.findByDocument_IdOrderByPageNumberAsc(documentId);
    }
}
