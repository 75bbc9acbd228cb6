package uk.gegc.docpond.features.document.api.dto;

import uk.gegc.docpond.features.document.domain.model.ProcessingStatus;

import java.util.UUID;

public record DocumentProgressResponse(
        UUID id,
        ProcessingStatus status,
        int pageCount,
        int processedPages,
        double progressPercent
) {
}
