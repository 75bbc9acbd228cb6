package uk.gegc.docpond.features.document.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.docpond.features.document.api.dto.DocumentProgressResponse;
import uk.gegc.docpond.features.document.api.dto.DocumentResponse;
import uk.gegc.docpond.features.document.api.dto.PageResponse;
import uk.gegc.docpond.features.document.application.DocumentIngestionService;
import uk.gegc.docpond.features.document.application.DocumentQueryService;
import uk.gegc.docpond.features.document.application.PageReprocessService;
import uk.gegc.docpond.features.document.application.PageSearchService;
import uk.gegc.docpond.features.document.domain.model.Document;
import uk.gegc.docpond.features.document.infra.mapper.DocumentMapper;
import uk.gegc.docpond.shared.exception.ValidationException;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
@Slf4j
@Tag(name = "Documents", description = "Upload, progress, pages, reprocessing and search")
public class DocumentController {

    private final DocumentIngestionService ingestionService;
    private final DocumentQueryService queryService;
    private final PageReprocessService reprocessService;
    private final PageSearchService searchService;
    private final DocumentMapper mapper;

    @Operation(summary = "Upload a scanned PDF", description = "Stores the PDF and queues it for splitting and OCR")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Document created and queued"),
            @ApiResponse(responseCode = "400", description = "Missing fields or the file is not a PDF"),
            @ApiResponse(responseCode = "404", description = "Referenced preset not found")
    })
    @PostMapping(value = "/documents", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DocumentResponse> upload(
            @Parameter(description = "PDF file", required = true) @RequestParam("file") MultipartFile file,
            @RequestParam("title") String title,
            @RequestParam("collection") String collection,
            @RequestParam(value = "doclingPresetId", required = false) UUID doclingPresetId,
            @RequestParam(value = "ocrPresetId", required = false) UUID ocrPresetId,
            @Parameter(description = "Grounding OCR model override") @RequestParam(value = "ocrModel", required = false) String ocrModel)
            throws IOException {

        if (file == null || file.isEmpty()) {
            throw new ValidationException("File is required");
        }
        log.info("Uploading document '{}' to collection '{}' ({} bytes)", title, collection, file.getSize());
        Document document = ingestionService.ingest(new DocumentIngestionService.DocumentUpload(
                title, collection, file.getBytes(), doclingPresetId, ocrPresetId, ocrModel));
        return ResponseEntity.created(URI.create("/api/v1/documents/" + document.getId()))
                .body(mapper.toResponse(document));
    }

    @Operation(summary = "Get document progress")
    @GetMapping("/documents/{id}/progress")
    public DocumentProgressResponse getProgress(@PathVariable UUID id) {
        return mapper.toProgress(queryService.getDocument(id));
    }

    @Operation(summary = "List pages of a document", description = "Ordered by page number")
    @GetMapping("/documents/{id}/pages")
    public List<PageResponse> getPages(@PathVariable UUID id) {
        return queryService.getPages(id).stream().map(mapper::toResponse).toList();
    }

    @Operation(summary = "Reprocess a document", description = "Resets the document to PENDING and queues it again")
    @PostMapping("/documents/{id}/reprocess")
    public ResponseEntity<DocumentResponse> reprocessDocument(@PathVariable UUID id) {
        return ResponseEntity.accepted().body(mapper.toResponse(reprocessService.reprocessDocument(id)));
    }

    @Operation(summary = "Reprocess a page",
            description = "Deletes extracted images, clears OCR output, resets the page to PENDING and queues it again")
    @PostMapping("/pages/{id}/reprocess")
    public ResponseEntity<PageResponse> reprocessPage(@PathVariable UUID id) {
        return ResponseEntity.accepted().body(mapper.toResponse(reprocessService.reprocessPage(id)));
    }

    @Operation(summary = "Search page Markdown", description = "Case-insensitive match over completed pages, grouped by document")
    @GetMapping("/search")
    public List<PageSearchService.DocumentHits> search(
            @RequestParam("q") String query,
            @RequestParam(value = "documentId", required = false) UUID documentId,
            @RequestParam(value = "limit", defaultValue = "50") @Min(1) @Max(200) int limit) {
        return searchService.search(query, documentId, limit);
    }
}
