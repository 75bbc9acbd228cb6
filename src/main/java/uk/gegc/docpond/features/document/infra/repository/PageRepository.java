package uk.gegc.docpond.features.document.infra.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.docpond.features.document.domain.model.Page;
import uk.gegc.docpond.features.document.domain.model.ProcessingStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PageRepository extends JpaRepository<Page, UUID> {

    /**
     * Loads a page together with its document and the document's presets.
     */
    @Query("SELECT p FROM Page p JOIN FETCH p.document WHERE p.id = :id")
    Optional<Page> findWithDocumentById(@Param("id") UUID id);

    List<Page> findByDocument_IdOrderByPageNumberAsc(UUID documentId);

    Optional<Page> findByDocument_IdAndPageNumber(UUID documentId, int pageNumber);

    long countByDocument_Id(UUID documentId);

    long countByDocument_IdAndStatus(UUID documentId, ProcessingStatus status);

    long countByDocument_IdAndStatusIn(UUID documentId, Collection<ProcessingStatus> statuses);

    /**
     * Completed pages whose Markdown contains the query, case-insensitively.
     */
    @Query("""
        SELECT p FROM Page p JOIN FETCH p.document d
        WHERE p.status = uk.gegc.docpond.features.document.domain.model.ProcessingStatus.COMPLETED
          AND LOWER(p.markdown) LIKE LOWER(CONCAT('%', :query, '%'))
          AND (:documentId IS NULL OR d.id = :documentId)
        ORDER BY d.title ASC, p.pageNumber ASC
    """)
    List<Page> searchCompletedMarkdown(@Param("query") String query,
                                       @Param("documentId") UUID documentId,
                                       Pageable pageable);
}
