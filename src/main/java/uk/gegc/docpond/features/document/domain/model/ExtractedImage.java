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
@Table(name = "extracted_images")
@Getter
@Setter
public class ExtractedImage {

    public static final String REGION_INDEX_KEY = "regionIndex";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "page_id", nullable = false)
    private Page page;

    @Column(name = "file_key", nullable = false, length = 1024)
    private String fileKey;

    @Column(name = "width", nullable = false)
    private int width;

    @Column(name = "height", nullable = false)
    private int height;

    @Column(name = "caption", columnDefinition = "TEXT")
    private String caption;

    @Column(name = "alt_text", columnDefinition = "TEXT")
    private String altText;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", columnDefinition = "TEXT")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(name = "created_at")
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    /**
     * Public path of the image: {@code /images/{id}/{filename}}, the filename taken from the
     * cleaned alt text when there is one.
     */
    public String urlPath() {
        return "/images/" + id + "/" + filename();
    }

    public String filename() {
        String extension = extension();
        if (altText != null) {
            String clean = StorageKeys.cleanName(altText);
            if (!clean.isEmpty()) {
                return clean + extension;
            }
        }
        return id + extension;
    }

    private String extension() {
        if (fileKey != null) {
            int dot = fileKey.lastIndexOf('.');
            if (dot > fileKey.lastIndexOf('/')) {
                return fileKey.substring(dot);
            }
        }
        return ".png";
    }
}
