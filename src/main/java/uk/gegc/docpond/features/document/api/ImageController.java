package uk.gegc.docpond.features.document.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.docpond.features.document.application.ExtractedImageService;
import uk.gegc.docpond.features.document.domain.model.ExtractedImage;

import java.time.Duration;
import java.util.UUID;

/**
 * Serves the image links written into page Markdown. The filename segment is cosmetic.
 */
@RestController
@RequiredArgsConstructor
@Tag(name = "Images")
public class ImageController {

    private final ExtractedImageService imageService;

    @Operation(summary = "Get an extracted image")
    @GetMapping("/images/{id}/{filename}")
    public ResponseEntity<byte[]> getImage(@PathVariable UUID id, @PathVariable String filename) {
        ExtractedImage image = imageService.getImage(id);
        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_PNG)
                .cacheControl(CacheControl.maxAge(Duration.ofDays(7)))
                .body(imageService.readImage(image));
    }
}
