package uk.gegc.docpond.features.preset.api.dto;

import uk.gegc.docpond.features.preset.domain.model.BasePreset;

import java.util.UUID;

public record PresetResponse(UUID id, String kind, String name, boolean defaultPreset) {

    public static PresetResponse of(String kind, BasePreset preset) {
        return new PresetResponse(preset.getId(), kind, preset.getName(), preset.isDefaultPreset());
    }
}
