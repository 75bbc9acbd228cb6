package uk.gegc.docpond.features.document.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.DynamicUpdate;
import uk.gegc.docpond.features.preset.domain.model.DoclingPreset;
import uk.gegc.docpond.features.preset.domain.model.OcrPreset;
import uk.gegc.docpond.shared.config.JsonMapConverter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A scanned book. {@code pageCount} stays 0 until the source PDF is first counted and is never
 * rewritten afterwards; {@code processedPages} and {@code status} are owned by the progress
 * aggregator once pages exist.
 */
@Entity
@Table(name = "documents")
@DynamicUpdate
@Getter
@Setter
public class Document {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "collection_name", nullable = false)
    private String collectionName;

    @Column(name = "source_pdf_key", nullable = false, length = 1024)
    private String sourcePdfKey;

    @Column(name = "thumbnail_key", length = 1024)
    private String thumbnailKey;

    @Column(name = "page_count", nullable = false)
    private int pageCount;

    @Column(name = "processed_pages", nullable = false)
    private int processedPages;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private ProcessingStatus status = ProcessingStatus.PENDING;

    /**
     * Overrides the configured grounding OCR model for this document.
     */
    @Column(name = "ocr_model")
    private String ocrModel;

    @ManyToOne
    @JoinColumn(name = "docling_preset_id")
    private DoclingPreset doclingPreset;

    @ManyToOne
    @JoinColumn(name = "ocr_preset_id")
    private OcrPreset ocrPreset;

    @Column(name = "text_layer_applied", nullable = false)
    private boolean textLayerApplied;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", columnDefinition = "TEXT")
    private Map<String, Object> metadata = new LinkedHashMap<>();

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

    public double progressPercent() {
        if (pageCount <= 0) {
            return 0.0;
        }
        return processedPages * 100.0 / pageCount;
    }
}
