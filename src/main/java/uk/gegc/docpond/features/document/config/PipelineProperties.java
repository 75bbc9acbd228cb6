package uk.gegc.docpond.features.document.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

    /**
     * Zoom applied when rendering a page for OCR (1.0 = 72 dpi).
     */
    @DecimalMin("0.1")
    private float renderZoom = 2.0f;

    @DecimalMin("0.1")
    private float thumbnailZoom = 2.0f;

    /**
     * Store a bounding-box overlay next to each page processed by a grounding backend.
     */
    private boolean visualize = true;

    @Valid
    @NotNull
    private Lookup lookup = new Lookup();

    @Data
    public static class Lookup {
        /**
         * Attempts to find a freshly created document before giving up.
         */
        @Min(1)
        private int maxAttempts = 5;

        @NotNull
        private Duration baseDelay = Duration.ofMillis(500);

        @NotNull
        private Duration maxDelay = Duration.ofSeconds(8);
    }
}
