package uk.gegc.docpond.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://docpond.dev/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");
    public static final URI DOCUMENT_NOT_FOUND = URI.create(BASE_URL + "/document-not-found");
    public static final URI PAGE_NOT_FOUND = URI.create(BASE_URL + "/page-not-found");
    public static final URI PRESET_NOT_FOUND = URI.create(BASE_URL + "/preset-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");

    // ==================== Processing Errors ====================
    public static final URI DOCUMENT_PROCESSING_FAILED = URI.create(BASE_URL + "/document-processing-failed");
    public static final URI STORAGE_FAILED = URI.create(BASE_URL + "/storage-failed");
    public static final URI OCR_BACKEND_FAILED = URI.create(BASE_URL + "/ocr-backend-failed");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
