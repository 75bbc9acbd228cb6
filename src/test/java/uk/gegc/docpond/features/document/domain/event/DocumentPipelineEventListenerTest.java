package uk.gegc.docpond.features.document.domain.event;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.docpond.features.document.application.DocumentProcessor;
import uk.gegc.docpond.features.document.application.PageProcessor;
import uk.gegc.docpond.features.document.application.PageSplitter;
import uk.gegc.docpond.features.document.application.ThumbnailService;

import java.util.UUID;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class DocumentPipelineEventListenerTest {

    @Mock
    private DocumentProcessor documentProcessor;
    @Mock
    private ThumbnailService thumbnailService;
    @Mock
    private PageSplitter pageSplitter;
    @Mock
    private PageProcessor pageProcessor;

    @InjectMocks
    private DocumentPipelineEventListener listener;

    @Test
    void eachEventReachesItsStage() {
        UUID documentId = UUID.randomUUID();

        listener.handleDocumentProcessingRequested(new DocumentProcessingRequestedEvent(this, documentId));
        listener.handleThumbnailRequested(new ThumbnailRequestedEvent(this, documentId));
        listener.handlePageSplitRequested(new PageSplitRequestedEvent(this, documentId));

        verify(documentProcessor).process(documentId);
        verify(thumbnailService).generate(documentId);
        verify(pageSplitter).split(documentId);
    }

    @Test
    void pageEventReachesPageProcessor() {
        UUID pageId = UUID.randomUUID();

        new PageProcessingRequestedEventListener(pageProcessor)
                .handlePageProcessingRequest(new PageProcessingRequestedEvent(this, pageId));

        verify(pageProcessor).process(pageId);
        verifyNoInteractions(documentProcessor);
    }
}
