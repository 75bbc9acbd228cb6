package uk.gegc.docpond.features.document.domain.model;

/**
 * Document progress derived from page counts. COMPLETED when every page completed, FAILED when
 * every page is terminal and at least one failed, PROCESSING otherwise.
 */
public record ProgressSnapshot(int processedPages, ProcessingStatus status) {

    public static ProgressSnapshot of(int pageCount, long completedPages, long terminalPages) {
        int processed = (int) completedPages;
        ProcessingStatus status;
        if (processed == pageCount) {
            status = ProcessingStatus.COMPLETED;
        } else if (terminalPages == pageCount) {
            status = ProcessingStatus.FAILED;
        } else {
            status = ProcessingStatus.PROCESSING;
        }
        return new ProgressSnapshot(processed, status);
    }
}
