package uk.gegc.docpond.features.preset.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.docpond.features.preset.domain.model.DoclingPreset;
import uk.gegc.docpond.features.preset.domain.model.OcrPreset;
import uk.gegc.docpond.features.preset.infra.repository.DoclingPresetRepository;
import uk.gegc.docpond.features.preset.infra.repository.OcrPresetRepository;
import uk.gegc.docpond.shared.exception.PresetNotFoundException;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PresetServiceTest {

    @Mock
    private OcrPresetRepository ocrPresetRepository;
    @Mock
    private DoclingPresetRepository doclingPresetRepository;

    private PresetService service;

    @BeforeEach
    void setUp() {
        service = new PresetService(ocrPresetRepository, doclingPresetRepository);
    }

    @Test
    void setDefaultOcrPreset_clearsOthersBeforeFlaggingTarget() {
        OcrPreset target = new OcrPreset();
        target.setId(UUID.randomUUID());
        target.setName("books");
        when(ocrPresetRepository.existsById(target.getId())).thenReturn(true);
        when(ocrPresetRepository.clearDefaultFlag()).thenReturn(1);
        when(ocrPresetRepository.findById(target.getId())).thenReturn(Optional.of(target));
        when(ocrPresetRepository.save(target)).thenReturn(target);

        OcrPreset result = service.setDefaultOcrPreset(target.getId());

        assertThat(result.isDefaultPreset()).isTrue();
        InOrder order = inOrder(ocrPresetRepository);
        order.verify(ocrPresetRepository).clearDefaultFlag();
        order.verify(ocrPresetRepository).save(target);
    }

    @Test
    void setDefaultDoclingPreset_unknown_leavesFlagsAlone() {
        UUID id = UUID.randomUUID();
        when(doclingPresetRepository.existsById(id)).thenReturn(false);

        assertThatThrownBy(() -> service.setDefaultDoclingPreset(id))
                .isInstanceOf(PresetNotFoundException.class);
        verify(doclingPresetRepository, never()).clearDefaultFlag();
    }

    @Test
    void getDefaultOcrPreset_prefersFlagged() {
        OcrPreset flagged = new OcrPreset();
        when(ocrPresetRepository.findFirstByDefaultPresetTrue()).thenReturn(Optional.of(flagged));

        assertThat(service.getDefaultOcrPreset()).isSameAs(flagged);
        verify(ocrPresetRepository, never()).findByName(any());
    }

    @Test
    void getDefaultOcrPreset_fallsBackToNamedDefault() {
        OcrPreset named = new OcrPreset();
        when(ocrPresetRepository.findFirstByDefaultPresetTrue()).thenReturn(Optional.empty());
        when(ocrPresetRepository.findByName(PresetService.DEFAULT_PRESET_NAME)).thenReturn(Optional.of(named));

        assertThat(service.getDefaultOcrPreset()).isSameAs(named);
        verify(ocrPresetRepository, never()).save(any());
    }

    @Test
    void getDefaultDoclingPreset_createsWhenMissing() {
        when(doclingPresetRepository.findFirstByDefaultPresetTrue()).thenReturn(Optional.empty());
        when(doclingPresetRepository.findByName(PresetService.DEFAULT_PRESET_NAME)).thenReturn(Optional.empty());
        when(doclingPresetRepository.save(any(DoclingPreset.class))).thenAnswer(inv -> inv.getArgument(0));

        DoclingPreset created = service.getDefaultDoclingPreset();

        assertThat(created.getName()).isEqualTo("default");
        assertThat(created.isDefaultPreset()).isTrue();
        assertThat(created.isForceOcr()).isTrue();
        assertThat(created.getPipelineType()).isEqualTo(DoclingPreset.PipelineType.STANDARD);
        assertThat(created.languageList()).containsExactly("en");
    }

    @Test
    void getOcrPreset_unknown_throws() {
        UUID id = UUID.randomUUID();
        when(ocrPresetRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getOcrPreset(id))
                .isInstanceOf(PresetNotFoundException.class)
                .hasMessageContaining(id.toString());
    }
}
