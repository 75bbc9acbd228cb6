package uk.gegc.docpond.features.preset.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import uk.gegc.docpond.features.preset.domain.model.DoclingPreset;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface DoclingPresetRepository extends JpaRepository<DoclingPreset, UUID> {

    Optional<DoclingPreset> findFirstByDefaultPresetTrue();

    Optional<DoclingPreset> findByName(String name);

    long countByDefaultPresetTrue();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DoclingPreset p SET p.defaultPreset = false WHERE p.defaultPreset = true")
    int clearDefaultFlag();
}
