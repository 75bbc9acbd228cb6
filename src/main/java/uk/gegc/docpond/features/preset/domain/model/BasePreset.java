package uk.gegc.docpond.features.preset.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.docpond.shared.config.JsonMapConverter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Fields shared by every preset kind. The default flag is only changed through
 * {@code PresetService}; saving a preset never touches its siblings.
 */
@MappedSuperclass
@Getter
@Setter
public abstract class BasePreset {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "name", nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "is_default", nullable = false)
    private boolean defaultPreset;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "advanced_settings", columnDefinition = "TEXT")
    private Map<String, Object> advancedSettings = new LinkedHashMap<>();

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
