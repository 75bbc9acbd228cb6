package uk.gegc.docpond.shared.exception;

public class OcrBackendException extends RuntimeException {

    public OcrBackendException(String message) {
        super(message);
    }

    public OcrBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
