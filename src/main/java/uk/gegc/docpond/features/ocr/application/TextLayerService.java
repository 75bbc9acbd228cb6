package uk.gegc.docpond.features.ocr.application;

import uk.gegc.docpond.features.preset.domain.model.OcrPreset;

/**
 * Adds a searchable text layer to a whole PDF.
 */
public interface TextLayerService {

    byte[] addTextLayer(byte[] pdfBytes, OcrPreset preset);
}
