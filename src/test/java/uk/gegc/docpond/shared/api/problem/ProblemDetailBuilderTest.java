package uk.gegc.docpond.shared.api.problem;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class ProblemDetailBuilderTest {

    @Test
    void notFound_setsStatusTypeAndInstance() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/documents/42/progress");

        ResponseEntity<ProblemDetail> response = ProblemDetailBuilder.notFound(
                ErrorTypes.DOCUMENT_NOT_FOUND, "Document Not Found", "Document 42 not found", request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        ProblemDetail problem = response.getBody();
        assertThat(problem).isNotNull();
        assertThat(problem.getStatus()).isEqualTo(404);
        assertThat(problem.getType()).isEqualTo(ErrorTypes.DOCUMENT_NOT_FOUND);
        assertThat(problem.getDetail()).isEqualTo("Document 42 not found");
        assertThat(problem.getInstance()).isEqualTo(URI.create("/api/v1/documents/42/progress"));
        assertThat(problem.getProperties()).containsKey("timestamp");
    }

    @Test
    void validationFailed_isBadRequest() {
        ResponseEntity<ProblemDetail> response = ProblemDetailBuilder.validationFailed("limit must be at most 200", null);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getType()).isEqualTo(ErrorTypes.VALIDATION_FAILED);
        assertThat(response.getBody().getTitle()).isEqualTo("Validation Failed");
        assertThat(response.getBody().getInstance()).isNull();
    }

    @Test
    void respond_keepsGivenStatus() {
        ResponseEntity<ProblemDetail> response = ProblemDetailBuilder.respond(HttpStatus.BAD_GATEWAY,
                ErrorTypes.OCR_BACKEND_FAILED, "OCR Backend Failed", "docling returned 503", null);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().getStatus()).isEqualTo(502);
    }
}
