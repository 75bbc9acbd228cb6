package uk.gegc.docpond.shared.exception;

/**
 * Raised when PDF bytes cannot be opened, rendered or split.
 */
public class PdfProcessingException extends RuntimeException {

    public PdfProcessingException(String message) {
        super(message);
    }

    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
