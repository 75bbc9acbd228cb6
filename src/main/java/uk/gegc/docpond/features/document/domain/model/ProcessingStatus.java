package uk.gegc.docpond.features.document.domain.model;

import java.util.EnumSet;
import java.util.Set;

public enum ProcessingStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public static final Set<ProcessingStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
