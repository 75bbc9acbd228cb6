package uk.gegc.docpond.shared.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.docpond.shared.api.problem.ErrorTypes;
import uk.gegc.docpond.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.docpond.shared.exception.DocumentNotFoundException;
import uk.gegc.docpond.shared.exception.DocumentProcessingException;
import uk.gegc.docpond.shared.exception.OcrBackendException;
import uk.gegc.docpond.shared.exception.PageNotFoundException;
import uk.gegc.docpond.shared.exception.PresetNotFoundException;
import uk.gegc.docpond.shared.exception.ResourceNotFoundException;
import uk.gegc.docpond.shared.exception.StorageException;
import uk.gegc.docpond.shared.exception.ValidationException;

import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleDocumentNotFound(DocumentNotFoundException ex, HttpServletRequest request) {
        return ProblemDetailBuilder.notFound(ErrorTypes.DOCUMENT_NOT_FOUND, "Document Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(PageNotFoundException.class)
    public ResponseEntity<ProblemDetail> handlePageNotFound(PageNotFoundException ex, HttpServletRequest request) {
        return ProblemDetailBuilder.notFound(ErrorTypes.PAGE_NOT_FOUND, "Page Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(PresetNotFoundException.class)
    public ResponseEntity<ProblemDetail> handlePresetNotFound(PresetNotFoundException ex, HttpServletRequest request) {
        return ProblemDetailBuilder.notFound(ErrorTypes.PRESET_NOT_FOUND, "Preset Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleResourceNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        return ProblemDetailBuilder.notFound(ErrorTypes.RESOURCE_NOT_FOUND, "Resource Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(ValidationException ex, HttpServletRequest request) {
        return ProblemDetailBuilder.validationFailed(ex.getMessage(), request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ProblemDetail> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest request) {
        String detail = ex.getConstraintViolations().stream()
                .map(ConstraintViolation::getMessage)
                .sorted()
                .collect(Collectors.joining("; "));
        return ProblemDetailBuilder.validationFailed(detail, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        return ProblemDetailBuilder.respond(HttpStatus.BAD_REQUEST, ErrorTypes.TYPE_MISMATCH, "Type Mismatch",
                "Invalid value for parameter '%s'".formatted(ex.getName()), request);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ProblemDetail> handleStorage(StorageException ex, HttpServletRequest request) {
        logger.error("Storage failure on {}", request.getRequestURI(), ex);
        return ProblemDetailBuilder.respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorTypes.STORAGE_FAILED,
                "Storage Failed", ex.getMessage(), request);
    }

    @ExceptionHandler(DocumentProcessingException.class)
    public ResponseEntity<ProblemDetail> handleProcessing(DocumentProcessingException ex, HttpServletRequest request) {
        logger.error("Document processing failure on {}", request.getRequestURI(), ex);
        return ProblemDetailBuilder.respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorTypes.DOCUMENT_PROCESSING_FAILED,
                "Document Processing Failed", ex.getMessage(), request);
    }

    @ExceptionHandler(OcrBackendException.class)
    public ResponseEntity<ProblemDetail> handleOcrBackend(OcrBackendException ex, HttpServletRequest request) {
        logger.error("OCR backend failure on {}", request.getRequestURI(), ex);
        return ProblemDetailBuilder.respond(HttpStatus.BAD_GATEWAY, ErrorTypes.OCR_BACKEND_FAILED,
                "OCR Backend Failed", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex, HttpServletRequest request) {
        logger.error("Unhandled exception on {}", request.getRequestURI(), ex);
        return ProblemDetailBuilder.respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorTypes.INTERNAL_SERVER_ERROR,
                "Internal Server Error", "An unexpected error occurred", request);
    }
}
