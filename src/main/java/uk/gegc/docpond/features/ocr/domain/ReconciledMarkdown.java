package uk.gegc.docpond.features.ocr.domain;

import java.util.List;

public record ReconciledMarkdown(String markdown, int linkedCount, List<Integer> orphanedIndices) {

    public ReconciledMarkdown {
        orphanedIndices = List.copyOf(orphanedIndices);
    }

    public boolean hasOrphans() {
        return !orphanedIndices.isEmpty();
    }
}
