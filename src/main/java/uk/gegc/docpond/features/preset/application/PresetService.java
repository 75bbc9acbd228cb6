package uk.gegc.docpond.features.preset.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.docpond.features.preset.domain.model.DoclingPreset;
import uk.gegc.docpond.features.preset.domain.model.OcrPreset;
import uk.gegc.docpond.features.preset.infra.repository.DoclingPresetRepository;
import uk.gegc.docpond.features.preset.infra.repository.OcrPresetRepository;
import uk.gegc.docpond.shared.exception.PresetNotFoundException;

import java.util.UUID;

/**
 * Owns the "at most one default per preset kind" rule. Changing the default clears the flag on
 * every preset of the kind and sets it on the target inside one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PresetService {

    static final String DEFAULT_PRESET_NAME = "default";
    static final String OCR_KIND = "OCR";
    static final String DOCLING_KIND = "Docling";

    private final OcrPresetRepository ocrPresetRepository;
    private final DoclingPresetRepository doclingPresetRepository;

    @Transactional(readOnly = true)
    public OcrPreset getOcrPreset(UUID id) {
        return ocrPresetRepository.findById(id)
                .orElseThrow(() -> new PresetNotFoundException(OCR_KIND, id));
    }

    @Transactional(readOnly = true)
    public DoclingPreset getDoclingPreset(UUID id) {
        return doclingPresetRepository.findById(id)
                .orElseThrow(() -> new PresetNotFoundException(DOCLING_KIND, id));
    }

    @Transactional
    public OcrPreset setDefaultOcrPreset(UUID id) {
        if (!ocrPresetRepository.existsById(id)) {
            throw new PresetNotFoundException(OCR_KIND, id);
        }
        int cleared = ocrPresetRepository.clearDefaultFlag();
        OcrPreset target = getOcrPreset(id);
        target.setDefaultPreset(true);
        OcrPreset saved = ocrPresetRepository.save(target);
        log.info("OCR preset '{}' is now the default ({} flag(s) cleared)", saved.getName(), cleared);
        return saved;
    }

    @Transactional
    public DoclingPreset setDefaultDoclingPreset(UUID id) {
        if (!doclingPresetRepository.existsById(id)) {
            throw new PresetNotFoundException(DOCLING_KIND, id);
        }
        int cleared = doclingPresetRepository.clearDefaultFlag();
        DoclingPreset target = getDoclingPreset(id);
        target.setDefaultPreset(true);
        DoclingPreset saved = doclingPresetRepository.save(target);
        log.info("Docling preset '{}' is now the default ({} flag(s) cleared)", saved.getName(), cleared);
        return saved;
    }

    /**
     * Returns the flagged preset, falling back to (and creating if needed) the one named {@code default}.
     */
    @Transactional
    public OcrPreset getDefaultOcrPreset() {
        return ocrPresetRepository.findFirstByDefaultPresetTrue()
                .or(() -> ocrPresetRepository.findByName(DEFAULT_PRESET_NAME))
                .orElseGet(() -> {
                    OcrPreset preset = new OcrPreset();
                    preset.setName(DEFAULT_PRESET_NAME);
                    preset.setDefaultPreset(true);
                    preset.setSkipText(true);
                    preset.setOcrEngine(OcrPreset.OcrEngine.TESSERACT);
                    preset.setLanguage("eng");
                    preset.setOptimize(1);
                    log.info("No default OCR preset found, creating '{}'", DEFAULT_PRESET_NAME);
                    return ocrPresetRepository.save(preset);
                });
    }

    @Transactional
    public DoclingPreset getDefaultDoclingPreset() {
        return doclingPresetRepository.findFirstByDefaultPresetTrue()
                .or(() -> doclingPresetRepository.findByName(DEFAULT_PRESET_NAME))
                .orElseGet(() -> {
                    DoclingPreset preset = new DoclingPreset();
                    preset.setName(DEFAULT_PRESET_NAME);
                    preset.setDefaultPreset(true);
                    preset.setPipelineType(DoclingPreset.PipelineType.STANDARD);
                    preset.setOcrEngine(DoclingPreset.OcrEngine.AUTO);
                    preset.setForceOcr(true);
                    preset.setOcrLanguages("en");
                    log.info("No default Docling preset found, creating '{}'", DEFAULT_PRESET_NAME);
                    return doclingPresetRepository.save(preset);
                });
    }
}
