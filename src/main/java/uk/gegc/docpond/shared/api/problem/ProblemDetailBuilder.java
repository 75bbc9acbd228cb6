package uk.gegc.docpond.shared.api.problem;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;

import java.net.URI;
import java.time.Instant;

/**
 * Helper functions for building RFC 7807 {@link ProblemDetail} instances in a consistent way.
 */
public final class ProblemDetailBuilder {

    private ProblemDetailBuilder() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Creates a {@link ProblemDetail} using the provided HTTP request to populate the {@code instance} field.
     */
    public static ProblemDetail create(
            HttpStatus status,
            URI type,
            String title,
            String detail,
            HttpServletRequest request
    ) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(type);
        problem.setTitle(title);
        if (request != null) {
            problem.setInstance(URI.create(request.getRequestURI()));
        }
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }

    /**
     * Wraps {@link #create} in a response carrying the same status.
     */
    public static ResponseEntity<ProblemDetail> respond(
            HttpStatus status,
            URI type,
            String title,
            String detail,
            HttpServletRequest request
    ) {
        return ResponseEntity.status(status).body(create(status, type, title, detail, request));
    }

    public static ResponseEntity<ProblemDetail> notFound(URI type, String title, String detail,
                                                         HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, type, title, detail, request);
    }

    public static ResponseEntity<ProblemDetail> validationFailed(String detail, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ErrorTypes.VALIDATION_FAILED, "Validation Failed", detail, request);
    }
}
