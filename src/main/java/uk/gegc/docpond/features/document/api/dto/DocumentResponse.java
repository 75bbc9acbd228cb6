package uk.gegc.docpond.features.document.api.dto;

import uk.gegc.docpond.features.document.domain.model.ProcessingStatus;

import java.time.Instant;
import java.util.UUID;

public record DocumentResponse(
        UUID id,
        String title,
        String collectionName,
        ProcessingStatus status,
        int pageCount,
        int processedPages,
        String thumbnailKey,
        Instant createdAt
) {
}
