package uk.gegc.docpond.features.document.infra.mapper;

import org.springframework.stereotype.Component;
import uk.gegc.docpond.features.document.api.dto.DocumentProgressResponse;
import uk.gegc.docpond.features.document.api.dto.DocumentResponse;
import uk.gegc.docpond.features.document.api.dto.PageResponse;
import uk.gegc.docpond.features.document.domain.model.Document;
import uk.gegc.docpond.features.document.domain.model.Page;

@Component
public class DocumentMapper {

    public DocumentResponse toResponse(Document document) {
        return new DocumentResponse(
                document.getId(),
                document.getTitle(),
                document.getCollectionName(),
                document.getStatus(),
                document.getPageCount(),
                document.getProcessedPages(),
                document.getThumbnailKey(),
                document.getCreatedAt()
        );
    }

    public DocumentProgressResponse toProgress(Document document) {
        return new DocumentProgressResponse(
                document.getId(),
                document.getStatus(),
                document.getPageCount(),
                document.getProcessedPages(),
                Math.round(document.progressPercent() * 100.0) / 100.0
        );
    }

    public PageResponse toResponse(Page page) {
        return new PageResponse(
                page.getId(),
                page.getPageNumber(),
                page.getStatus(),
                page.getMarkdown(),
                page.getPagePdfKey(),
                page.getBboxVisualizationKey()
        );
    }
}
