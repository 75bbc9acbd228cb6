package uk.gegc.docpond.features.ocr.domain;

import java.util.List;
import java.util.Map;

/**
 * Per-document backend configuration.
 *
 * @param model   model name for grounding backends
 * @param prompt  instruction sent with the page image
 * @param options form options for layout backends, multi-valued
 */
public record BackendSettings(String model, String prompt, Map<String, List<String>> options) {

    public BackendSettings {
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public static BackendSettings grounding(String model, String prompt) {
        return new BackendSettings(model, prompt, Map.of());
    }

    public static BackendSettings layout(Map<String, List<String>> options) {
        return new BackendSettings(null, null, options);
    }
}
