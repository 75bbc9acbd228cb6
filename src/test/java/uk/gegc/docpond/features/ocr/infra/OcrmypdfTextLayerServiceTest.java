package uk.gegc.docpond.features.ocr.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import uk.gegc.docpond.features.ocr.config.OcrProperties;
import uk.gegc.docpond.features.preset.domain.model.OcrPreset;
import uk.gegc.docpond.shared.exception.OcrBackendException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OcrmypdfTextLayerService")
class OcrmypdfTextLayerServiceTest {

    @Test
    void buildArguments_defaultPreset() {
        OcrPreset preset = new OcrPreset();
        preset.setSkipText(true);

        List<String> args = OcrmypdfTextLayerService.buildArguments(preset);

        assertThat(args).containsExactly("--skip-text", "--language", "eng", "--optimize", "1");
    }

    @Test
    @DisplayName("redo_ocr wins over force_ocr and drops page preprocessing")
    void buildArguments_redoOcr_takesPrecedence() {
        OcrPreset preset = new OcrPreset();
        preset.setRedoOcr(true);
        preset.setForceOcr(true);
        preset.setSkipText(true);
        preset.setDeskew(true);
        preset.setRotatePages(true);
        Map<String, Object> advanced = new LinkedHashMap<>();
        advanced.put("clean_final", true);
        advanced.put("output_type", "pdfa");
        preset.setAdvancedSettings(advanced);

        List<String> args = OcrmypdfTextLayerService.buildArguments(preset);

        assertThat(args).contains("--redo-ocr", "--output-type", "pdfa")
                .doesNotContain("--force-ocr", "--skip-text", "--deskew", "--rotate-pages", "--clean-final");
    }

    @Test
    void buildArguments_forceOcrWithQualityAndFlags() {
        OcrPreset preset = new OcrPreset();
        preset.setForceOcr(true);
        preset.setLanguage("eng+nld");
        preset.setOptimize(0);
        preset.setJpegQuality(90);
        preset.setDeskew(true);
        Map<String, Object> advanced = new LinkedHashMap<>();
        advanced.put("remove_background", true);
        advanced.put("clean", false);
        advanced.put("ocr_engine", "tesseract");
        preset.setAdvancedSettings(advanced);

        List<String> args = OcrmypdfTextLayerService.buildArguments(preset);

        assertThat(args).containsExactly(
                "--force-ocr", "--language", "eng+nld", "--jpg-quality", "90", "--deskew", "--remove-background");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("a hung command is killed once the timeout elapses")
    void addTextLayer_hungCommand_timesOut(@TempDir Path dir) throws IOException {
        OcrmypdfTextLayerService service = serviceRunning(script(dir, "exec sleep 10"), Duration.ofMillis(500));

        long started = System.nanoTime();
        assertThatThrownBy(() -> service.addTextLayer("%PDF-1.4".getBytes(StandardCharsets.US_ASCII), new OcrPreset()))
                .isInstanceOf(OcrBackendException.class)
                .hasMessageContaining("timed out");
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void addTextLayer_failingCommand_reportsExitCodeAndOutput(@TempDir Path dir) throws IOException {
        OcrmypdfTextLayerService service = serviceRunning(script(dir, "echo 'tesseract not found'\nexit 3"),
                Duration.ofSeconds(10));

        assertThatThrownBy(() -> service.addTextLayer("%PDF-1.4".getBytes(StandardCharsets.US_ASCII), new OcrPreset()))
                .isInstanceOf(OcrBackendException.class)
                .hasMessageContaining("code 3")
                .hasMessageContaining("tesseract not found");
    }

    private static OcrmypdfTextLayerService serviceRunning(Path command, Duration timeout) {
        OcrProperties properties = new OcrProperties();
        properties.getTextLayer().setCommand(command.toString());
        properties.getTextLayer().setTimeout(timeout);
        return new OcrmypdfTextLayerService(properties);
    }

    private static Path script(Path dir, String body) throws IOException {
        Path script = dir.resolve("fake-ocrmypdf.sh");
        Files.writeString(script, "#!/bin/sh\n" + body + "\n");
        if (!script.toFile().setExecutable(true)) {
            throw new IOException("Could not make " + script + " executable");
        }
        return script;
    }
}
