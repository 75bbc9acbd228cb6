package uk.gegc.docpond.features.document.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.docpond.features.document.config.PipelineProperties;
import uk.gegc.docpond.features.document.domain.model.Document;
import uk.gegc.docpond.features.document.domain.model.StorageKeys;
import uk.gegc.docpond.features.document.infra.repository.DocumentRepository;
import uk.gegc.docpond.features.pdf.application.PdfPageRasterizer;
import uk.gegc.docpond.features.pdf.domain.RasterizedPage;
import uk.gegc.docpond.features.storage.application.StorageService;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Renders the first page of a document as its JPEG cover.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ThumbnailService {

    private final DocumentRepository documentRepository;
    private final StorageService storageService;
    private final PdfPageRasterizer rasterizer;
    private final PipelineProperties pipelineProperties;

    /**
     * Returns the stored key, or empty when the document is gone or the cover could not be rendered.
     */
    public Optional<String> generate(UUID documentId) {
        Optional<Document> maybeDocument = documentRepository.findById(documentId);
        if (maybeDocument.isEmpty()) {
            log.warn("Cannot generate thumbnail: document {} not found", documentId);
            return Optional.empty();
        }
        Document document = maybeDocument.get();
        byte[] source = storageService.read(document.getSourcePdfKey());
        try (RasterizedPage cover = rasterizer.render(source, 0, pipelineProperties.getThumbnailZoom())) {
            String key = StorageKeys.thumbnail(document);
            storageService.save(key, cover.toJpeg(), "image/jpeg");
            documentRepository.updateThumbnailKey(documentId, key, Instant.now());
            log.info("Stored thumbnail for document {} at {}", documentId, key);
            return Optional.of(key);
        }
    }
}
