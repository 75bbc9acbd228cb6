package uk.gegc.docpond.features.ocr.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.docpond.features.document.domain.model.Document;
import uk.gegc.docpond.features.ocr.config.OcrProperties;
import uk.gegc.docpond.features.ocr.domain.BackendSettings;
import uk.gegc.docpond.features.ocr.domain.BackendType;
import uk.gegc.docpond.features.ocr.domain.OcrBackend;
import uk.gegc.docpond.features.ocr.domain.ResolvedBackend;
import uk.gegc.docpond.features.ocr.infra.DoclingServeBackend;
import uk.gegc.docpond.features.preset.domain.model.DoclingPreset;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the backend for a document from its configuration: a Docling preset selects the layout
 * engine, anything else the grounding OCR model. The choice depends only on document fields, so
 * every page of a document resolves the same way.
 */
@Service
@Slf4j
public class OcrBackendResolver {

    private final Map<BackendType, OcrBackend> backends = new EnumMap<>(BackendType.class);
    private final OcrProperties ocrProperties;

    public OcrBackendResolver(List<OcrBackend> backends, OcrProperties ocrProperties) {
        for (OcrBackend backend : backends) {
            OcrBackend previous = this.backends.put(backend.type(), backend);
            if (previous != null) {
                throw new IllegalStateException("Two OCR backends registered for " + backend.type());
            }
        }
        this.ocrProperties = ocrProperties;
    }

    public ResolvedBackend resolve(Document document) {
        DoclingPreset preset = document.getDoclingPreset();
        if (preset != null) {
            return new ResolvedBackend(require(BackendType.LAYOUT),
                    BackendSettings.layout(DoclingServeBackend.convertOptions(preset)));
        }
        String model = document.getOcrModel() != null && !document.getOcrModel().isBlank()
                ? document.getOcrModel()
                : ocrProperties.getGrounding().getModel();
        return new ResolvedBackend(require(BackendType.GROUNDING),
                BackendSettings.grounding(model, ocrProperties.getGrounding().getPrompt()));
    }

    private OcrBackend require(BackendType type) {
        OcrBackend backend = backends.get(type);
        if (backend == null) {
            throw new IllegalStateException("No OCR backend registered for " + type);
        }
        return backend;
    }
}
