package uk.gegc.docpond.features.preset.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.Arrays;
import java.util.List;

/**
 * Layout-engine options. A document carrying one of these is converted page by page through
 * the layout backend instead of the grounding OCR model.
 */
@Entity
@Table(name = "docling_presets")
@Getter
@Setter
public class DoclingPreset extends BasePreset {

    @Enumerated(EnumType.STRING)
    @Column(name = "pipeline_type", nullable = false)
    private PipelineType pipelineType = PipelineType.STANDARD;

    @Enumerated(EnumType.STRING)
    @Column(name = "ocr_engine", nullable = false)
    private OcrEngine ocrEngine = OcrEngine.AUTO;

    @Column(name = "force_ocr", nullable = false)
    private boolean forceOcr;

    /**
     * Comma-separated language codes in the format the selected engine expects.
     */
    @Column(name = "ocr_languages")
    private String ocrLanguages;

    @Column(name = "vlm_model", length = 200)
    private String vlmModel;

    @Column(name = "enable_picture_description", nullable = false)
    private boolean enablePictureDescription;

    @Column(name = "picture_description_prompt", columnDefinition = "TEXT")
    private String pictureDescriptionPrompt = "Describe this image in a few sentences.";

    @Column(name = "enable_table_structure", nullable = false)
    private boolean enableTableStructure = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "table_former_mode", nullable = false)
    private TableFormerMode tableFormerMode = TableFormerMode.ACCURATE;

    @Column(name = "enable_code_enrichment", nullable = false)
    private boolean enableCodeEnrichment;

    @Column(name = "enable_formula_enrichment", nullable = false)
    private boolean enableFormulaEnrichment;

    public List<String> languageList() {
        if (ocrLanguages == null || ocrLanguages.isBlank()) {
            return List.of();
        }
        return Arrays.stream(ocrLanguages.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public enum PipelineType {
        STANDARD, VLM
    }

    public enum OcrEngine {
        AUTO, EASYOCR, TESSERACT, RAPIDOCR, OCRMAC
    }

    public enum TableFormerMode {
        FAST, ACCURATE
    }
}
