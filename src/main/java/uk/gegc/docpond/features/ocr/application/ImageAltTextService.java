package uk.gegc.docpond.features.ocr.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.stereotype.Service;
import org.springframework.util.MimeTypeUtils;
import uk.gegc.docpond.features.ocr.config.OcrProperties;

import java.util.Optional;

/**
 * Short descriptions of extracted images from a vision model. Off unless
 * {@code app.ocr.alt-text.enabled} is set.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImageAltTextService {

    private final ChatModel chatModel;
    private final OcrProperties ocrProperties;

    public boolean isEnabled() {
        return ocrProperties.getAltText().isEnabled();
    }

    /**
     * Empty when disabled or when the model call fails.
     */
    public Optional<String> describe(byte[] png) {
        if (!isEnabled() || png == null || png.length == 0) {
            return Optional.empty();
        }
        OcrProperties.AltText settings = ocrProperties.getAltText();
        try {
            UserMessage message = UserMessage.builder()
                    .text(settings.getPrompt())
                    .media(new Media(MimeTypeUtils.IMAGE_PNG, new ByteArrayResource(png)))
                    .build();
            ChatResponse response = chatModel.call(new Prompt(message,
                    OllamaOptions.builder().model(settings.getModel()).build()));
            if (response == null || response.getResult() == null) {
                return Optional.empty();
            }
            String text = response.getResult().getOutput().getText();
            return text == null || text.isBlank() ? Optional.empty() : Optional.of(text.strip());
        } catch (Exception e) {
            log.warn("Alt text generation failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
