package uk.gegc.docpond.features.ocr.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.ocr")
public class OcrProperties {

    @Valid
    @NotNull
    private Grounding grounding = new Grounding();

    @Valid
    @NotNull
    private Docling docling = new Docling();

    @Valid
    @NotNull
    private TextLayer textLayer = new TextLayer();

    @Valid
    @NotNull
    private AltText altText = new AltText();

    @Data
    public static class Grounding {
        /**
         * Ollama model used when a document does not name its own.
         */
        @NotBlank
        private String model = "deepseek-ocr";

        @NotBlank
        private String prompt = "<|grounding|>Convert the document to markdown.";

        @Min(1)
        private int maxRetries = 3;

        @Min(0)
        private long baseDelayMs = 1000;

        @Min(0)
        private long maxDelayMs = 30000;
    }

    @Data
    public static class Docling {
        @NotBlank
        private String baseUrl = "http://localhost:5001";

        @NotNull
        private Duration timeout = Duration.ofMinutes(5);

        /**
         * Optional API key sent as {@code X-Api-Key}.
         */
        private String apiKey;
    }

    @Data
    public static class TextLayer {
        @NotBlank
        private String command = "ocrmypdf";

        @NotNull
        private Duration timeout = Duration.ofMinutes(30);
    }

    @Data
    public static class AltText {
        private boolean enabled = false;

        @NotBlank
        private String model = "qwen2-vl";

        @NotBlank
        private String prompt = "Describe this image concisely in 5-10 words suitable for a filename. Focus on the main subject.";
    }
}
