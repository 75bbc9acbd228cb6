package uk.gegc.docpond.features.document.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.docpond.features.document.domain.event.DocumentProcessingRequestedEvent;
import uk.gegc.docpond.features.document.domain.model.Document;
import uk.gegc.docpond.features.document.domain.model.ProcessingStatus;
import uk.gegc.docpond.features.document.domain.model.StorageKeys;
import uk.gegc.docpond.features.document.infra.repository.DocumentRepository;
import uk.gegc.docpond.features.pdf.application.PdfPageRasterizer;
import uk.gegc.docpond.features.preset.application.PresetService;
import uk.gegc.docpond.features.storage.application.StorageService;
import uk.gegc.docpond.shared.exception.ValidationException;

import java.util.UUID;

/**
 * Entry point for new documents: stores the upload and queues the document pipeline once the
 * record is committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIngestionService {

    private final DocumentRepository documentRepository;
    private final StorageService storageService;
    private final PresetService presetService;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public Document ingest(DocumentUpload upload) {
        if (upload.title() == null || upload.title().isBlank()) {
            throw new ValidationException("Title is required");
        }
        if (upload.collectionName() == null || upload.collectionName().isBlank()) {
            throw new ValidationException("Collection is required");
        }
        if (!PdfPageRasterizer.isPdf(upload.pdfBytes())) {
            throw new ValidationException("Uploaded file is empty or not a PDF");
        }
        String title = upload.title().strip();
        String collection = upload.collectionName().strip();
        if (StorageKeys.cleanName(title).isEmpty()) {
            throw new ValidationException("Title must contain letters or digits");
        }
        if (documentRepository.existsByCollectionNameAndTitle(collection, title)) {
            throw new ValidationException("Collection '%s' already has a document titled '%s'".formatted(collection, title));
        }

        Document document = new Document();
        document.setTitle(title);
        document.setCollectionName(collection);
        document.setStatus(ProcessingStatus.PENDING);
        document.setOcrModel(upload.ocrModel());
        if (upload.doclingPresetId() != null) {
            document.setDoclingPreset(presetService.getDoclingPreset(upload.doclingPresetId()));
        }
        if (upload.ocrPresetId() != null) {
            document.setOcrPreset(presetService.getOcrPreset(upload.ocrPresetId()));
        }
        String key = StorageKeys.sourcePdf(collection, title);
        storageService.save(key, upload.pdfBytes(), "application/pdf");
        document.setSourcePdfKey(key);

        Document saved = documentRepository.save(document);
        eventPublisher.publishEvent(new DocumentProcessingRequestedEvent(this, saved.getId()));
        log.info("Ingested document {} '{}' into collection '{}' ({} bytes)", saved.getId(), title, collection,
                upload.pdfBytes().length);
        return saved;
    }

    public record DocumentUpload(String title,
                                 String collectionName,
                                 byte[] pdfBytes,
                                 UUID doclingPresetId,
                                 UUID ocrPresetId,
                                 String ocrModel) {
    }
}
