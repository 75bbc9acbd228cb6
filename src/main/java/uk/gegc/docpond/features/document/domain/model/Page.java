package uk.gegc.docpond.features.document.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.docpond.shared.config.JsonMapConverter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "pages",
        uniqueConstraints = @UniqueConstraint(name = "uk_pages_document_page_number",
                columnNames = {"document_id", "page_number"}))
@Getter
@Setter
public class Page {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "document_id", nullable = false)
    private Document document;

    /**
     * 1-based.
     */
    @Column(name = "page_number", nullable = false)
    private int pageNumber;

    @Column(name = "page_pdf_key", length = 1024)
    private String pagePdfKey;

    @Column(name = "bbox_visualization_key", length = 1024)
    private String bboxVisualizationKey;

    @Column(name = "ocr_raw", columnDefinition = "LONGTEXT")
    private String ocrRaw;

    @Column(name = "markdown", columnDefinition = "LONGTEXT")
    private String markdown;

    @Column(name = "references_json", columnDefinition = "LONGTEXT")
    private String referencesJson;

    @Column(name = "structured_json", columnDefinition = "LONGTEXT")
    private String structuredJson;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private ProcessingStatus status = ProcessingStatus.PENDING;

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

    /**
     * Drops everything a previous OCR run produced.
     */
    public void clearOcrResults() {
        ocrRaw = null;
        markdown = null;
        referencesJson = null;
        structuredJson = null;
        bboxVisualizationKey = null;
    }
}
