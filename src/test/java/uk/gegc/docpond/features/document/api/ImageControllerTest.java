package uk.gegc.docpond.features.document.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.docpond.features.document.application.ExtractedImageService;
import uk.gegc.docpond.features.document.domain.model.ExtractedImage;
import uk.gegc.docpond.shared.exception.ResourceNotFoundException;

import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ImageController.class)
class ImageControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ExtractedImageService imageService;

    @Test
    void getImage_servesPng() throws Exception {
        UUID id = UUID.randomUUID();
        ExtractedImage image = new ExtractedImage();
        image.setId(id);
        image.setFileKey("c/t/1/images/image_0.png");
        when(imageService.getImage(id)).thenReturn(image);
        when(imageService.readImage(image)).thenReturn(new byte[]{(byte) 0x89, 'P', 'N', 'G'});

        mockMvc.perform(get("/images/{id}/{filename}", id, "lighthouse.png"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_PNG))
                .andExpect(content().bytes(new byte[]{(byte) 0x89, 'P', 'N', 'G'}));
    }

    @Test
    void getImage_unknown_notFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(imageService.getImage(id)).thenThrow(new ResourceNotFoundException("Image %s not found".formatted(id)));

        mockMvc.perform(get("/images/{id}/{filename}", id, "x.png"))
                .andExpect(status().isNotFound());
    }
}
