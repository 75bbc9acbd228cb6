package uk.gegc.docpond.features.document.domain.model;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class StorageKeysTest {

    @Test
    void cleanName_stripsUnsafeCharacters() {
        assertThat(StorageKeys.cleanName("  The Hobbit: 2nd ed. (1951)! ")).isEqualTo("The-Hobbit-2nd-ed-1951");
        assertThat(StorageKeys.cleanName("a".repeat(150))).hasSize(100);
        assertThat(StorageKeys.cleanName("???")).isEmpty();
    }

    @Test
    void keys_followDocumentLayout() {
        Document document = new Document();
        document.setCollectionName("Old Maps");
        document.setTitle("Atlas 1890");

        assertThat(StorageKeys.sourcePdf("Old Maps", "Atlas 1890")).isEqualTo("Old-Maps/Atlas-1890/Atlas-1890.pdf");
        assertThat(StorageKeys.thumbnail(document)).isEqualTo("Old-Maps/Atlas-1890/Atlas-1890-cover.jpg");
        assertThat(StorageKeys.pagePdf(document, 7)).isEqualTo("Old-Maps/Atlas-1890/7/page-7.pdf");
        assertThat(StorageKeys.pageImage(document, 7, 2)).isEqualTo("Old-Maps/Atlas-1890/7/images/image_2.png");
    }

    @Test
    void extractedImage_filenamePrefersAltText() {
        ExtractedImage image = new ExtractedImage();
        UUID id = UUID.randomUUID();
        image.setId(id);
        image.setFileKey("c/t/1/images/image_0.png");

        assertThat(image.urlPath()).isEqualTo("/images/" + id + "/" + id + ".png");

        image.setAltText("A red barn, at dusk");
        assertThat(image.filename()).isEqualTo("A-red-barn-at-dusk.png");
    }
}
