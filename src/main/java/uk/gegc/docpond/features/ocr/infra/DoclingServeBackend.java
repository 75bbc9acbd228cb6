package uk.gegc.docpond.features.ocr.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import uk.gegc.docpond.features.ocr.application.PlaceholderReconciler;
import uk.gegc.docpond.features.ocr.domain.BackendType;
import uk.gegc.docpond.features.ocr.domain.OcrBackend;
import uk.gegc.docpond.features.ocr.domain.OcrInput;
import uk.gegc.docpond.features.ocr.domain.OcrOutput;
import uk.gegc.docpond.features.preset.domain.model.DoclingPreset;
import uk.gegc.docpond.shared.exception.OcrBackendException;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts a single-page PDF through a docling-serve instance. Images come back embedded in the
 * Markdown as base64 data URIs; they are lifted out into payloads and replaced by placeholders.
 */
@Component
@Slf4j
public class DoclingServeBackend implements OcrBackend {

    static final String CONVERT_PATH = "/v1/convert/file";
    private static final Pattern EMBEDDED_IMAGE = Pattern.compile(
            "!\\[[^\\]]*]\\(data:image/[A-Za-z0-9.+-]+;base64,([A-Za-z0-9+/=\\s]+)\\)");

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public DoclingServeBackend(@Qualifier("doclingRestClient") RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public BackendType type() {
        return BackendType.LAYOUT;
    }

    @Override
    public OcrOutput run(OcrInput input) {
        if (input.pdfBytes() == null || input.pdfBytes().length == 0) {
            throw new OcrBackendException("Page %d has no PDF bytes".formatted(input.pageNumber()));
        }
        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("files", new ByteArrayResource(input.pdfBytes()) {
            @Override
            public String getFilename() {
                return "page-" + input.pageNumber() + ".pdf";
            }
        });
        input.settings().options().forEach((key, values) -> values.forEach(value -> form.add(key, value)));

        String body;
        try {
            body = restClient.post()
                    .uri(CONVERT_PATH)
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(form)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw new OcrBackendException("Layout conversion failed for page %d: %s"
                    .formatted(input.pageNumber(), e.getMessage()), e);
        }
        return toOutput(input.pageNumber(), body);
    }

    OcrOutput toOutput(int pageNumber, String body) {
        if (body == null || body.isBlank()) {
            throw new OcrBackendException("Empty layout response for page " + pageNumber);
        }
        JsonNode document;
        try {
            JsonNode root = objectMapper.readTree(body);
            document = root.path("document");
            String status = root.path("status").asText("success");
            if (!"success".equalsIgnoreCase(status) && !"partial_success".equalsIgnoreCase(status)) {
                throw new OcrBackendException("Layout conversion for page %d ended with status %s: %s"
                        .formatted(pageNumber, status, root.path("errors")));
            }
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new OcrBackendException("Unreadable layout response for page " + pageNumber, e);
        }

        String markdown = document.path("md_content").asText("");
        JsonNode jsonContent = document.path("json_content");
        String structuredJson = jsonContent.isMissingNode() || jsonContent.isNull() ? null : jsonContent.toString();

        List<byte[]> images = new ArrayList<>();
        Matcher matcher = EMBEDDED_IMAGE.matcher(markdown);
        StringBuilder rewritten = new StringBuilder();
        while (matcher.find()) {
            int index = images.size();
            images.add(decode(pageNumber, index, matcher.group(1)));
            matcher.appendReplacement(rewritten,
                    Matcher.quoteReplacement("![Image](" + PlaceholderReconciler.placeholder(index) + ")"));
        }
        matcher.appendTail(rewritten);
        log.debug("Layout conversion for page {} returned {} chars and {} images", pageNumber, rewritten.length(), images.size());
        return new OcrOutput(body, rewritten.toString(), images, structuredJson);
    }

    /**
     * Undecodable payloads become empty arrays so later placeholders keep their index.
     */
    private byte[] decode(int pageNumber, int index, String base64) {
        try {
            return Base64.getMimeDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            log.warn("Page {}: embedded image {} is not valid base64", pageNumber, index);
            return new byte[0];
        }
    }

    /**
     * Form options for a preset, in docling-serve's parameter names.
     */
    public static Map<String, List<String>> convertOptions(DoclingPreset preset) {
        Map<String, List<String>> options = new LinkedHashMap<>();
        options.put("to_formats", List.of("md", "json"));
        options.put("image_export_mode", List.of("embedded"));
        options.put("pipeline", List.of(lower(preset.getPipelineType())));
        options.put("do_ocr", List.of("true"));
        options.put("force_ocr", List.of(String.valueOf(preset.isForceOcr())));
        options.put("ocr_engine", List.of(lower(preset.getOcrEngine())));
        if (!preset.languageList().isEmpty()) {
            options.put("ocr_lang", preset.languageList());
        }
        options.put("do_table_structure", List.of(String.valueOf(preset.isEnableTableStructure())));
        options.put("table_mode", List.of(lower(preset.getTableFormerMode())));
        options.put("do_code_enrichment", List.of(String.valueOf(preset.isEnableCodeEnrichment())));
        options.put("do_formula_enrichment", List.of(String.valueOf(preset.isEnableFormulaEnrichment())));
        options.put("do_picture_description", List.of(String.valueOf(preset.isEnablePictureDescription())));
        if (preset.getPipelineType() == DoclingPreset.PipelineType.VLM && preset.getVlmModel() != null
                && !preset.getVlmModel().isBlank()) {
            options.put("vlm_pipeline_model", List.of(preset.getVlmModel()));
        }
        if (preset.getAdvancedSettings() != null) {
            preset.getAdvancedSettings().forEach((key, value) -> {
                if (value != null) {
                    options.put(key, List.of(String.valueOf(value)));
                }
            });
        }
        return options;
    }

    private static String lower(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
