package uk.gegc.docpond.features.document.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.docpond.features.document.domain.model.Document;
import uk.gegc.docpond.features.document.domain.model.ExtractedImage;
import uk.gegc.docpond.features.document.domain.model.Page;
import uk.gegc.docpond.features.document.domain.model.StorageKeys;
import uk.gegc.docpond.features.document.infra.repository.ExtractedImageRepository;
import uk.gegc.docpond.features.ocr.application.ImageAltTextService;
import uk.gegc.docpond.features.ocr.domain.ImageLink;
import uk.gegc.docpond.features.ocr.domain.RegionImage;
import uk.gegc.docpond.features.storage.application.StorageService;
import uk.gegc.docpond.shared.exception.ResourceNotFoundException;
import uk.gegc.docpond.shared.exception.StorageException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * Stores extracted images and their records. The object is written first and the record second;
 * if the record cannot be saved the object is removed again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExtractedImageService {

    private static final String PNG = "image/png";

    private final ExtractedImageRepository imageRepository;
    private final StorageService storageService;
    private final ImageAltTextService altTextService;

    public ImageLink saveRegion(Page page, Document document, RegionImage region) {
        return persist(page, document, region.regionIndex(), region.png(), region.width(), region.height());
    }

    /**
     * Stores an image payload of any format ImageIO can read, re-encoded as PNG.
     */
    public ImageLink saveEncoded(Page page, Document document, int regionIndex, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new StorageException("Image %d of page %d is empty".formatted(regionIndex, page.getPageNumber()));
        }
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
            if (image == null) {
                throw new StorageException("Image %d of page %d is not a readable image"
                        .formatted(regionIndex, page.getPageNumber()));
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ImageIO.write(image, "png", out);
            return persist(page, document, regionIndex, out.toByteArray(), image.getWidth(), image.getHeight());
        } catch (IOException e) {
            throw new StorageException("Failed to decode image %d of page %d".formatted(regionIndex, page.getPageNumber()), e);
        }
    }

    private ImageLink persist(Page page, Document document, int regionIndex, byte[] png, int width, int height) {
        String key = StorageKeys.pageImage(document, page.getPageNumber(), regionIndex);
        storageService.save(key, png, PNG);

        ExtractedImage image = new ExtractedImage();
        image.setPage(page);
        image.setFileKey(key);
        image.setWidth(width);
        image.setHeight(height);
        image.getMetadata().put(ExtractedImage.REGION_INDEX_KEY, regionIndex);
        altTextService.describe(png).ifPresent(image::setAltText);

        ExtractedImage saved;
        try {
            saved = imageRepository.save(image);
        } catch (RuntimeException e) {
            deleteObject(key);
            throw e;
        }
        log.debug("Saved image {} for page {} region {} ({}x{})", saved.getId(), page.getPageNumber(), regionIndex, width, height);
        return new ImageLink(regionIndex, saved.urlPath());
    }

    /**
     * Removes every image of a page. Storage objects that cannot be deleted are logged and left behind.
     */
    public int deleteForPage(UUID pageId) {
        List<ExtractedImage> images = imageRepository.findByPage_Id(pageId);
        for (ExtractedImage image : images) {
            deleteObject(image.getFileKey());
        }
        imageRepository.deleteAll(images);
        return images.size();
    }

    public ExtractedImage getImage(UUID imageId) {
        return imageRepository.findById(imageId)
                .orElseThrow(() -> new ResourceNotFoundException("Image %s not found".formatted(imageId)));
    }

    public byte[] readImage(ExtractedImage image) {
        return storageService.read(image.getFileKey());
    }

    private void deleteObject(String key) {
        try {
            storageService.delete(key);
        } catch (StorageException e) {
            log.warn("Failed to delete stored image {}: {}", key, e.getMessage());
        }
    }
}
