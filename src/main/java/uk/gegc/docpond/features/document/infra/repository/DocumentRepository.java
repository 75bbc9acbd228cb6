package uk.gegc.docpond.features.document.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.docpond.features.document.domain.model.Document;
import uk.gegc.docpond.features.document.domain.model.ProcessingStatus;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

    boolean existsByCollectionNameAndTitle(String collectionName, String title);

    /**
     * Row lock held until the caller's transaction ends; serializes progress recomputation per document.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Document d WHERE d.id = :id")
    Optional<Document> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Writes only the aggregated counters so concurrent page jobs never overwrite other columns.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Document d SET d.processedPages = :processedPages, d.status = :status, d.updatedAt = :now WHERE d.id = :id")
    int updateProgress(@Param("id") UUID id,
                       @Param("processedPages") int processedPages,
                       @Param("status") ProcessingStatus status,
                       @Param("now") Instant now);

    /**
     * Sets the page count only while it is still 0; returns 0 when it was already known.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Document d SET d.pageCount = :pageCount, d.updatedAt = :now WHERE d.id = :id AND d.pageCount = 0")
    int initializePageCount(@Param("id") UUID id, @Param("pageCount") int pageCount, @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Document d SET d.status = :status, d.updatedAt = :now WHERE d.id = :id")
    int updateStatus(@Param("id") UUID id, @Param("status") ProcessingStatus status, @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Document d SET d.thumbnailKey = :thumbnailKey, d.updatedAt = :now WHERE d.id = :id")
    int updateThumbnailKey(@Param("id") UUID id, @Param("thumbnailKey") String thumbnailKey, @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Document d SET d.textLayerApplied = true, d.updatedAt = :now WHERE d.id = :id")
    int markTextLayerApplied(@Param("id") UUID id, @Param("now") Instant now);
}
