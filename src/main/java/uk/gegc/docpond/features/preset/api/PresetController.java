package uk.gegc.docpond.features.preset.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.docpond.features.preset.api.dto.PresetResponse;
import uk.gegc.docpond.features.preset.application.PresetService;
import uk.gegc.docpond.shared.exception.ValidationException;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/presets")
@RequiredArgsConstructor
@Tag(name = "Presets", description = "Default OCR and layout presets")
public class PresetController {

    private static final String OCR = "ocr";
    private static final String DOCLING = "docling";

    private final PresetService presetService;

    @Operation(summary = "Make an OCR preset the default")
    @PostMapping("/ocr/{id}/default")
    public PresetResponse setDefaultOcr(@PathVariable UUID id) {
        return PresetResponse.of(OCR, presetService.setDefaultOcrPreset(id));
    }

    @Operation(summary = "Make a Docling preset the default")
    @PostMapping("/docling/{id}/default")
    public PresetResponse setDefaultDocling(@PathVariable UUID id) {
        return PresetResponse.of(DOCLING, presetService.setDefaultDoclingPreset(id));
    }

    @Operation(summary = "Get the default preset of a kind", description = "Creates a preset named 'default' when none exists")
    @GetMapping("/{kind}/default")
    public PresetResponse getDefault(@PathVariable String kind) {
        return switch (kind) {
            case OCR -> PresetResponse.of(OCR, presetService.getDefaultOcrPreset());
            case DOCLING -> PresetResponse.of(DOCLING, presetService.getDefaultDoclingPreset());
            default -> throw new ValidationException("Unknown preset kind '%s', expected ocr or docling".formatted(kind));
        };
    }
}
