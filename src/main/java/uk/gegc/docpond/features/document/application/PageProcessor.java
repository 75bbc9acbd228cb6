package uk.gegc.docpond.features.document.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
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
import uk.gegc.docpond.features.ocr.domain.ExtractedRegion;
import uk.gegc.docpond.features.ocr.domain.ImageLink;
import uk.gegc.docpond.features.ocr.domain.OcrInput;
import uk.gegc.docpond.features.ocr.domain.OcrOutput;
import uk.gegc.docpond.features.ocr.domain.ParsedOcrOutput;
import uk.gegc.docpond.features.ocr.domain.ReconciledMarkdown;
import uk.gegc.docpond.features.ocr.domain.Reference;
import uk.gegc.docpond.features.ocr.domain.ResolvedBackend;
import uk.gegc.docpond.features.pdf.application.PdfPageRasterizer;
import uk.gegc.docpond.features.pdf.domain.RasterizedPage;
import uk.gegc.docpond.features.storage.application.StorageService;
import uk.gegc.docpond.shared.exception.PdfProcessingException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs OCR for one page: {@code PENDING -> PROCESSING -> COMPLETED | FAILED}.
 * <p>
 * Failures end in FAILED and never propagate to the caller, so sibling pages are unaffected.
 * The document's progress is recomputed after every outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PageProcessor {

    private final PageRepository pageRepository;
    private final StorageService storageService;
    private final PdfPageRasterizer rasterizer;
    private final OcrBackendResolver backendResolver;
    private final BoundingBoxReferenceParser referenceParser;
    private final ImageRegionExtractor regionExtractor;
    private final BoundingBoxVisualizer visualizer;
    private final PlaceholderReconciler reconciler;
    private final ExtractedImageService imageService;
    private final ProgressAggregator progressAggregator;
    private final PipelineProperties pipelineProperties;
    private final ObjectMapper objectMapper;

    public void process(UUID pageId) {
        Optional<Page> maybePage = pageRepository.findWithDocumentById(pageId);
        if (maybePage.isEmpty()) {
            log.warn("Page {} not found, skipping", pageId);
            return;
        }
        Page page = maybePage.get();
        Document document = page.getDocument();
        UUID documentId = document.getId();
        log.info("Processing page {} of document {}", page.getPageNumber(), documentId);

        page.setStatus(ProcessingStatus.PROCESSING);
        page = pageRepository.save(page);

        RasterizedPage raster = null;
        try {
            byte[] pdf = storageService.read(page.getPagePdfKey());
            if (!PdfPageRasterizer.isPdf(pdf)) {
                throw new PdfProcessingException("Page %d PDF is empty or invalid".formatted(page.getPageNumber()));
            }
            raster = rasterizer.render(pdf, 0, pipelineProperties.getRenderZoom());

            ResolvedBackend resolved = backendResolver.resolve(document);
            OcrOutput output = resolved.backend().run(
                    new OcrInput(page.getPageNumber(), pdf, raster.toPng(), resolved.settings()));

            List<ImageLink> links = new ArrayList<>();
            List<Reference> references = List.of();
            String markdown;
            String overlayKey = null;
            if (output.needsParsing()) {
                ParsedOcrOutput parsed = referenceParser.parse(output.rawOutput(), reconciler.placeholderResolver());
                references = parsed.references();
                markdown = parsed.markdown();
                Page owner = page;
                List<ExtractedRegion> regions = regionExtractor.extract(raster.image(), references,
                        region -> links.add(imageService.saveRegion(owner, document, region)));
                long imageReferences = references.stream().filter(Reference::isImage).count();
                if (regions.size() < imageReferences) {
                    log.warn("Extracted {} of {} image regions on page {} of document {}",
                            regions.size(), imageReferences, page.getPageNumber(), documentId);
                }
                overlayKey = storeOverlay(raster, references, document, page.getPageNumber());
            } else {
                markdown = output.markdown();
                for (int i = 0; i < output.images().size(); i++) {
                    try {
                        links.add(imageService.saveEncoded(page, document, i, output.images().get(i)));
                    } catch (Exception e) {
                        log.warn("Skipping image {} of page {}: {}", i, page.getPageNumber(), e.getMessage());
                    }
                }
            }

            ReconciledMarkdown reconciled = reconciler.reconcile(markdown, links);

            page.setOcrRaw(output.rawOutput());
            page.setMarkdown(reconciled.markdown());
            page.setReferencesJson(references.isEmpty() ? null : toJson(references));
            page.setStructuredJson(output.structuredJson());
            page.setBboxVisualizationKey(overlayKey);
            page.setStatus(ProcessingStatus.COMPLETED);
            pageRepository.save(page);
            log.info("Completed page {} of document {} ({} images, {} orphaned)", page.getPageNumber(), documentId,
                    reconciled.linkedCount(), reconciled.orphanedIndices().size());
        } catch (Exception e) {
            log.error("Failed to process page {} of document {}", page.getPageNumber(), documentId, e);
            markFailed(pageId);
        } finally {
            if (raster != null) {
                raster.close();
            }
            progressAggregator.update(documentId);
        }
    }

    private void markFailed(UUID pageId) {
        try {
            pageRepository.findById(pageId).ifPresent(failed -> {
                failed.setStatus(ProcessingStatus.FAILED);
                pageRepository.save(failed);
            });
        } catch (Exception e) {
            log.error("Could not record failure of page {}", pageId, e);
        }
    }

    /**
     * Overlay failures are logged and never fail the page.
     */
    private String storeOverlay(RasterizedPage raster, List<Reference> references, Document document, int pageNumber) {
        if (!pipelineProperties.isVisualize() || references.isEmpty()) {
            return null;
        }
        try {
            String key = StorageKeys.pageOverlay(document, pageNumber);
            storageService.save(key, visualizer.render(raster.image(), references), "image/png");
            return key;
        } catch (Exception e) {
            log.warn("Could not store bounding-box overlay for page {}: {}", pageNumber, e.getMessage());
            return null;
        }
    }

    private String toJson(List<Reference> references) throws JsonProcessingException {
        return objectMapper.writeValueAsString(references);
    }
}
