package uk.gegc.docpond.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class PresetNotFoundException extends RuntimeException {

    public PresetNotFoundException(String kind, UUID presetId) {
        super("%s preset %s not found".formatted(kind, presetId));
    }
}
