package uk.gegc.docpond.features.document.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.docpond.features.document.domain.model.ExtractedImage;

import java.util.List;
import java.util.UUID;

@Repository
public interface ExtractedImageRepository extends JpaRepository<ExtractedImage, UUID> {

    List<ExtractedImage> findByPage_Id(UUID pageId);

    long countByPage_Id(UUID pageId);
}
