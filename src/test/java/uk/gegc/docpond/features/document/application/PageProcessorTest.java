package uk.gegc.docpond.features.document.application;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;
import uk.gegc.docpond.features.document.config.PipelineProperties;
import uk.gegc.docpond.features.document.domain.model.Document;
import uk.gegc.docpond.features.document.domain.model.Page;
import uk.gegc.docpond.features.document.domain.model.ProcessingStatus;
import uk.gegc.docpond.features.document.domain.model.StorageKeys;
import uk.gegc.docpond.features.document.infra.repository.PageRepository;
import uk.gegc.docpond.features.ocr.application.BoundingBoxReferenceParser;
import uk.gegc.docpond.features.ocr.application.BoundingBoxVisualizer;
import uk.gegc.docpond.features.ocr.application.ImageRegionExtractor;
import uk.gegc.docpond.features.ocr.application.OcrBackendResolver;
import uk.gegc.docpond.features.ocr.application.PlaceholderReconciler;
import uk.gegc.docpond.features.ocr.domain.BackendSettings;
import uk.gegc.docpond.features.ocr.domain.ImageLink;
import uk.gegc.docpond.features.ocr.domain.OcrBackend;
import uk.gegc.docpond.features.ocr.domain.OcrInput;
import uk.gegc.docpond.features.ocr.domain.OcrOutput;
import uk.gegc.docpond.features.ocr.domain.RegionImage;
import uk.gegc.docpond.features.ocr.domain.ResolvedBackend;
import uk.gegc.docpond.features.pdf.application.PdfPageRasterizer;
import uk.gegc.docpond.features.pdf.domain.RasterizedPage;
import uk.gegc.docpond.features.storage.application.StorageService;
import uk.gegc.docpond.shared.exception.OcrBackendException;
import uk.gegc.docpond.shared.exception.StorageException;

import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyFloat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PageProcessorTest {

    private static final byte[] PAGE_PDF = "%PDF-1.4 page".getBytes(StandardCharsets.US_ASCII);

    @Mock
    private PageRepository pageRepository;
    @Mock
    private StorageService storageService;
    @Mock
    private PdfPageRasterizer rasterizer;
    @Mock
    private OcrBackendResolver backendResolver;
    @Mock
    private OcrBackend backend;
    @Mock
    private ExtractedImageService imageService;
    @Mock
    private ProgressAggregator progressAggregator;

    private PipelineProperties pipelineProperties;
    private PageProcessor processor;
    private Document document;
    private Page page;
    private RasterizedPage raster;

    @BeforeEach
    void setUp() {
        pipelineProperties = new PipelineProperties();
        processor = new PageProcessor(pageRepository, storageService, rasterizer, backendResolver,
                new BoundingBoxReferenceParser(), new ImageRegionExtractor(), new BoundingBoxVisualizer(),
                new PlaceholderReconciler(), imageService, progressAggregator, pipelineProperties, new ObjectMapper());

        document = new Document();
        document.setId(UUID.randomUUID());
        document.setTitle("Field Guide");
        document.setCollectionName("Birds");
        document.setPageCount(2);

        page = new Page();
        page.setId(UUID.randomUUID());
        page.setDocument(document);
        page.setPageNumber(1);
        page.setPagePdfKey(StorageKeys.pagePdf(document, 1));

        raster = new RasterizedPage(new BufferedImage(200, 200, BufferedImage.TYPE_INT_RGB));
    }

    @Test
    @DisplayName("grounding output is parsed, images linked, overlay stored and page completed")
    void process_grounding_completesPage() {
        givenRenderablePage();
        when(backend.run(any(OcrInput.class))).thenReturn(OcrOutput.grounding(
                "<|ref|>text<|/ref|><|det|>[[10,10,190,40]]<|/det|>A robin."
                        + "<|ref|>image<|/ref|><|det|>[[20,50,120,150]]<|/det|>"));
        when(imageService.saveRegion(eq(page), eq(document), any(RegionImage.class)))
                .thenReturn(new ImageLink(0, "/images/abc/robin.png"));

        processor.process(page.getId());

        assertThat(page.getStatus()).isEqualTo(ProcessingStatus.COMPLETED);
        assertThat(page.getMarkdown()).contains("A robin.").contains("![Image](/images/abc/robin.png)");
        assertThat(page.getOcrRaw()).contains("<|ref|>");
        assertThat(page.getReferencesJson()).contains("\"type\":\"image\"");
        assertThat(page.getBboxVisualizationKey()).isEqualTo("Birds/Field-Guide/1/page-1-bbox.png");
        verify(storageService).save(eq("Birds/Field-Guide/1/page-1-bbox.png"), any(byte[].class), eq("image/png"));
        verify(progressAggregator).update(document.getId());
        assertThatThrownBy(raster::image).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("a region that fails to save is dropped from the markdown")
    void process_regionSaveFails_orphanRemoved() {
        pipelineProperties.setVisualize(false);
        givenRenderablePage();
        when(backend.run(any(OcrInput.class))).thenReturn(OcrOutput.grounding(
                "<|ref|>image<|/ref|><|det|>[[0,0,50,50]]<|/det|>"
                        + "<|ref|>image<|/ref|><|det|>[[60,60,120,120]]<|/det|>"));
        when(imageService.saveRegion(eq(page), eq(document), any(RegionImage.class)))
                .thenThrow(new StorageException("bucket unavailable"))
                .thenReturn(new ImageLink(1, "/images/def/second.png"));

        Logger logger = (Logger) LoggerFactory.getLogger(PageProcessor.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            processor.process(page.getId());
        } finally {
            logger.detachAppender(appender);
        }

        assertThat(appender.list)
                .anySatisfy(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.WARN);
                    assertThat(event.getFormattedMessage()).startsWith("Extracted 1 of 2 image regions on page 1");
                });
        assertThat(page.getStatus()).isEqualTo(ProcessingStatus.COMPLETED);
        assertThat(page.getMarkdown())
                .contains("/images/def/second.png")
                .doesNotContain(PlaceholderReconciler.PLACEHOLDER_PREFIX);
        assertThat(page.getBboxVisualizationKey()).isNull();
        verify(storageService, never()).save(anyString(), any(byte[].class), anyString());
    }

    @Test
    @DisplayName("layout output is used as is and its images are stored by index")
    void process_layout_storesEncodedImages() {
        givenRenderablePage();
        byte[] first = {1};
        byte[] second = {2};
        when(backend.run(any(OcrInput.class))).thenReturn(new OcrOutput("{raw}",
                "# Heading\n\n![Image](__IMAGE_PLACEHOLDER_0__)\n\n![Image](__IMAGE_PLACEHOLDER_1__)\n",
                List.of(first, second), "{\"pages\":1}"));
        when(imageService.saveEncoded(page, document, 0, first)).thenReturn(new ImageLink(0, "/images/1/a.png"));
        when(imageService.saveEncoded(page, document, 1, second)).thenThrow(new StorageException("not an image"));

        processor.process(page.getId());

        assertThat(page.getStatus()).isEqualTo(ProcessingStatus.COMPLETED);
        assertThat(page.getMarkdown()).isEqualTo("# Heading\n\n![Image](/images/1/a.png)\n\n");
        assertThat(page.getStructuredJson()).isEqualTo("{\"pages\":1}");
        assertThat(page.getReferencesJson()).isNull();
        verify(imageService, never()).saveRegion(any(), any(), any());
    }

    @Test
    @DisplayName("backend failure marks the page FAILED and still updates progress")
    void process_backendFails_pageFailed() {
        givenRenderablePage();
        when(backend.run(any(OcrInput.class))).thenThrow(new OcrBackendException("model unavailable"));
        when(pageRepository.findById(page.getId())).thenReturn(Optional.of(page));

        processor.process(page.getId());

        assertThat(page.getStatus()).isEqualTo(ProcessingStatus.FAILED);
        verify(progressAggregator).update(document.getId());
    }

    @Test
    void process_invalidPagePdf_pageFailedWithoutRendering() {
        when(pageRepository.findWithDocumentById(page.getId())).thenReturn(Optional.of(page));
        when(pageRepository.save(any(Page.class))).thenAnswer(inv -> inv.getArgument(0));
        when(storageService.read(page.getPagePdfKey())).thenReturn(new byte[0]);
        when(pageRepository.findById(page.getId())).thenReturn(Optional.of(page));

        processor.process(page.getId());

        assertThat(page.getStatus()).isEqualTo(ProcessingStatus.FAILED);
        verify(rasterizer, never()).render(any(), anyInt(), anyFloat());
        verify(progressAggregator).update(document.getId());
    }

    @Test
    void process_missingPage_noop() {
        when(pageRepository.findWithDocumentById(page.getId())).thenReturn(Optional.empty());

        processor.process(page.getId());

        verifyNoInteractions(storageService, backendResolver, progressAggregator);
    }

    private void givenRenderablePage() {
        when(pageRepository.findWithDocumentById(page.getId())).thenReturn(Optional.of(page));
        when(pageRepository.save(any(Page.class))).thenAnswer(inv -> inv.getArgument(0));
        when(storageService.read(page.getPagePdfKey())).thenReturn(PAGE_PDF);
        when(rasterizer.render(PAGE_PDF, 0, pipelineProperties.getRenderZoom())).thenReturn(raster);
        when(backendResolver.resolve(document))
                .thenReturn(new ResolvedBackend(backend, BackendSettings.grounding("deepseek-ocr", "prompt")));
    }
}
