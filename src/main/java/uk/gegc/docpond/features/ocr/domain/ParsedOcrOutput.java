package uk.gegc.docpond.features.ocr.domain;

import java.util.List;

public record ParsedOcrOutput(List<Reference> references, String markdown) {

    public ParsedOcrOutput {
        references = List.copyOf(references);
    }

    public List<Reference> imageReferences() {
        return references.stream().filter(Reference::isImage).toList();
    }
}
