package uk.gegc.docpond.features.document.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
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
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PageReprocessServiceTest {

    @Mock
    private PageRepository pageRepository;
    @Mock
    private DocumentRepository documentRepository;
    @Mock
    private ExtractedImageService imageService;
    @Mock
    private StorageService storageService;
    @Mock
    private ProgressAggregator progressAggregator;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private PageReprocessService service;
    private Document document;

    @BeforeEach
    void setUp() {
        service = new PageReprocessService(pageRepository, documentRepository, imageService, storageService,
                progressAggregator, eventPublisher);
        document = new Document();
        document.setId(UUID.randomUUID());
    }

    @Test
    void reprocessPage_clearsResultsAndRequeues() {
        Page page = new Page();
        page.setId(UUID.randomUUID());
        page.setDocument(document);
        page.setStatus(ProcessingStatus.FAILED);
        page.setMarkdown("old");
        page.setOcrRaw("old raw");
        page.setBboxVisualizationKey("c/t/1/page-1-bbox.png");
        when(pageRepository.findById(page.getId())).thenReturn(Optional.of(page));
        when(pageRepository.saveAndFlush(page)).thenReturn(page);
        doThrow(new StorageException("missing")).when(storageService).delete("c/t/1/page-1-bbox.png");

        Page result = service.reprocessPage(page.getId());

        assertThat(result.getStatus()).isEqualTo(ProcessingStatus.PENDING);
        assertThat(result.getMarkdown()).isNull();
        assertThat(result.getOcrRaw()).isNull();
        assertThat(result.getBboxVisualizationKey()).isNull();
        InOrder order = inOrder(imageService, pageRepository, progressAggregator, eventPublisher);
        order.verify(imageService).deleteForPage(page.getId());
        order.verify(pageRepository).saveAndFlush(page);
        order.verify(progressAggregator).update(document.getId());
        order.verify(eventPublisher).publishEvent(any(PageProcessingRequestedEvent.class));
    }

    @Test
    void reprocessPage_missing_throws() {
        UUID id = UUID.randomUUID();
        when(pageRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.reprocessPage(id)).isInstanceOf(PageNotFoundException.class);
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void reprocessDocument_resetsStatusAndRequeues() {
        document.setStatus(ProcessingStatus.FAILED);
        when(documentRepository.findById(document.getId())).thenReturn(Optional.of(document));

        Document result = service.reprocessDocument(document.getId());

        assertThat(result.getStatus()).isEqualTo(ProcessingStatus.PENDING);
        verify(documentRepository).updateStatus(eq(document.getId()), eq(ProcessingStatus.PENDING), any(Instant.class));
        verify(eventPublisher).publishEvent(any(DocumentProcessingRequestedEvent.class));
    }

    @Test
    void reprocessDocument_missing_throws() {
        UUID id = UUID.randomUUID();
        when(documentRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.reprocessDocument(id)).isInstanceOf(DocumentNotFoundException.class);
    }
}
