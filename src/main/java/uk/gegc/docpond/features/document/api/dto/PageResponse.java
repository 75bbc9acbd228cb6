package uk.gegc.docpond.features.document.api.dto;

import uk.gegc.docpond.features.document.domain.model.ProcessingStatus;

import java.util.UUID;

public record PageResponse(
        UUID id,
        int pageNumber,
        ProcessingStatus status,
        String markdown,
        String pagePdfKey,
        String bboxVisualizationKey
) {
}
