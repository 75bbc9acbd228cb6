package uk.gegc.docpond.features.document.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.docpond.features.document.domain.model.Document;
import uk.gegc.docpond.features.document.domain.model.ExtractedImage;
import uk.gegc.docpond.features.document.domain.model.Page;
import uk.gegc.docpond.features.document.infra.repository.ExtractedImageRepository;
import uk.gegc.docpond.features.ocr.application.ImageAltTextService;
import uk.gegc.docpond.features.ocr.domain.ImageLink;
import uk.gegc.docpond.features.ocr.domain.Reference;
import uk.gegc.docpond.features.ocr.domain.RegionImage;
import uk.gegc.docpond.features.storage.application.StorageService;
import uk.gegc.docpond.shared.exception.ResourceNotFoundException;
import uk.gegc.docpond.shared.exception.StorageException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExtractedImageServiceTest {

    private static final String KEY = "Maps/Atlas/2/images/image_0.png";

    @Mock
    private ExtractedImageRepository imageRepository;
    @Mock
    private StorageService storageService;
    @Mock
    private ImageAltTextService altTextService;

    private ExtractedImageService service;
    private Document document;
    private Page page;

    @BeforeEach
    void setUp() {
        service = new ExtractedImageService(imageRepository, storageService, altTextService);
        document = new Document();
        document.setTitle("Atlas");
        document.setCollectionName("Maps");
        page = new Page();
        page.setId(UUID.randomUUID());
        page.setDocument(document);
        page.setPageNumber(2);
    }

    @Test
    void saveRegion_storesObjectThenRecord() {
        UUID id = UUID.randomUUID();
        when(altTextService.describe(any())).thenReturn(Optional.of("Coastline of Norway"));
        when(imageRepository.save(any(ExtractedImage.class))).thenAnswer(inv -> {
            ExtractedImage image = inv.getArgument(0);
            image.setId(id);
            return image;
        });

        ImageLink link = service.saveRegion(page, document,
                new RegionImage(0, new Reference("image", List.of(0, 0, 5, 5), ""), new byte[]{9}, 5, 5));

        assertThat(link).isEqualTo(new ImageLink(0, "/images/" + id + "/Coastline-of-Norway.png"));
        verify(storageService).save(KEY, new byte[]{9}, "image/png");
        ArgumentCaptor<ExtractedImage> captor = ArgumentCaptor.forClass(ExtractedImage.class);
        verify(imageRepository).save(captor.capture());
        assertThat(captor.getValue().getMetadata()).containsEntry(ExtractedImage.REGION_INDEX_KEY, 0);
        assertThat(captor.getValue().getFileKey()).isEqualTo(KEY);
    }

    @Test
    void saveRegion_recordFails_objectRemoved() {
        when(altTextService.describe(any())).thenReturn(Optional.empty());
        when(imageRepository.save(any(ExtractedImage.class))).thenThrow(new IllegalStateException("db down"));

        assertThatThrownBy(() -> service.saveRegion(page, document,
                new RegionImage(0, new Reference("image", List.of(), ""), new byte[]{1}, 1, 1)))
                .isInstanceOf(IllegalStateException.class);
        verify(storageService).delete(KEY);
    }

    @Test
    void saveEncoded_reencodesAsPng() throws Exception {
        BufferedImage jpeg = new BufferedImage(8, 6, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(jpeg, "jpg", out);
        when(altTextService.describe(any())).thenReturn(Optional.empty());
        when(imageRepository.save(any(ExtractedImage.class))).thenAnswer(inv -> inv.getArgument(0));

        service.saveEncoded(page, document, 0, out.toByteArray());

        ArgumentCaptor<ExtractedImage> captor = ArgumentCaptor.forClass(ExtractedImage.class);
        verify(imageRepository).save(captor.capture());
        assertThat(captor.getValue().getWidth()).isEqualTo(8);
        assertThat(captor.getValue().getHeight()).isEqualTo(6);
        verify(storageService).save(eq(KEY), any(byte[].class), eq("image/png"));
    }

    @Test
    void saveEncoded_unreadable_throws() {
        assertThatThrownBy(() -> service.saveEncoded(page, document, 0, new byte[]{1, 2, 3}))
                .isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> service.saveEncoded(page, document, 0, new byte[0]))
                .isInstanceOf(StorageException.class);
        verifyNoInteractions(storageService, imageRepository);
    }

    @Test
    void deleteForPage_toleratesStorageFailures() {
        ExtractedImage first = new ExtractedImage();
        first.setFileKey("a.png");
        ExtractedImage second = new ExtractedImage();
        second.setFileKey("b.png");
        when(imageRepository.findByPage_Id(page.getId())).thenReturn(List.of(first, second));
        doThrow(new StorageException("gone")).when(storageService).delete("a.png");

        assertThat(service.deleteForPage(page.getId())).isEqualTo(2);
        verify(storageService).delete("b.png");
        verify(imageRepository).deleteAll(List.of(first, second));
    }

    @Test
    void getImage_missing_notFound() {
        UUID id = UUID.randomUUID();
        when(imageRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getImage(id)).isInstanceOf(ResourceNotFoundException.class);
    }
}
