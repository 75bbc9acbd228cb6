package uk.gegc.docpond.features.ocr.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.stereotype.Component;
import org.springframework.util.MimeTypeUtils;
import uk.gegc.docpond.features.ocr.config.OcrProperties;
import uk.gegc.docpond.features.ocr.domain.BackendType;
import uk.gegc.docpond.features.ocr.domain.OcrBackend;
import uk.gegc.docpond.features.ocr.domain.OcrInput;
import uk.gegc.docpond.features.ocr.domain.OcrOutput;
import uk.gegc.docpond.shared.exception.OcrBackendException;

import java.time.Duration;
import java.time.Instant;

/**
 * Sends the rendered page to a grounding OCR vision model served by Ollama and returns its tagged
 * reply unparsed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GroundingOcrBackend implements OcrBackend {

    private final ChatModel chatModel;
    private final OcrProperties ocrProperties;

    @Override
    public BackendType type() {
        return BackendType.GROUNDING;
    }

    @Override
    public OcrOutput run(OcrInput input) {
        if (input.pngBytes() == null || input.pngBytes().length == 0) {
            throw new OcrBackendException("Page %d has no rendered image".formatted(input.pageNumber()));
        }
        String model = input.settings().model() != null ? input.settings().model() : ocrProperties.getGrounding().getModel();
        String promptText = input.settings().prompt() != null ? input.settings().prompt() : ocrProperties.getGrounding().getPrompt();

        UserMessage message = UserMessage.builder()
                .text(promptText)
                .media(new Media(MimeTypeUtils.IMAGE_PNG, new ByteArrayResource(input.pngBytes())))
                .build();
        Prompt prompt = new Prompt(message, OllamaOptions.builder().model(model).build());

        int maxRetries = ocrProperties.getGrounding().getMaxRetries();
        int attempt = 0;
        while (true) {
            attempt++;
            Instant start = Instant.now();
            try {
                ChatResponse response = chatModel.call(prompt);
                if (response == null || response.getResult() == null) {
                    throw new OcrBackendException("No response received from model " + model);
                }
                String text = response.getResult().getOutput().getText();
                log.info("OCR response for page {} from {} in {}ms ({} chars)", input.pageNumber(), model,
                        Duration.between(start, Instant.now()).toMillis(), text == null ? 0 : text.length());
                return OcrOutput.grounding(text == null ? "" : text);
            } catch (Exception e) {
                if (attempt >= maxRetries) {
                    throw new OcrBackendException("OCR failed for page %d after %d attempts: %s"
                            .formatted(input.pageNumber(), attempt, e.getMessage()), e);
                }
                long delayMs = calculateBackoffDelay(attempt);
                log.warn("OCR attempt {} for page {} failed, retrying in {} ms: {}",
                        attempt, input.pageNumber(), delayMs, e.getMessage());
                sleep(delayMs);
            }
        }
    }

    private long calculateBackoffDelay(int attempt) {
        long exponentialDelay = ocrProperties.getGrounding().getBaseDelayMs() * (1L << (attempt - 1));
        return Math.min(exponentialDelay, ocrProperties.getGrounding().getMaxDelayMs());
    }

    /**
     * Overridden in tests to avoid real waiting.
     */
    protected void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new OcrBackendException("Interrupted while waiting to retry OCR", ie);
        }
    }
}
