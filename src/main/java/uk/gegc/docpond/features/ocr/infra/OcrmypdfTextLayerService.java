package uk.gegc.docpond.features.ocr.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;
import uk.gegc.docpond.features.ocr.application.TextLayerService;
import uk.gegc.docpond.features.ocr.config.OcrProperties;
import uk.gegc.docpond.features.preset.domain.model.OcrPreset;
import uk.gegc.docpond.shared.exception.OcrBackendException;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Runs the OCRmyPDF command line on temp copies of the PDF. Both temp files are deleted on every
 * exit path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OcrmypdfTextLayerService implements TextLayerService {

    private static final Set<String> IGNORED_ADVANCED_KEYS = Set.of("ocr_engine", "ocr-engine");
    private static final Set<String> REDO_CONFLICTS = Set.of("deskew", "clean_final", "remove_background");

    private final OcrProperties ocrProperties;

    @Override
    public byte[] addTextLayer(byte[] pdfBytes, OcrPreset preset) {
        Path input = null;
        Path output = null;
        try {
            input = Files.createTempFile("docpond-ocr-in-", ".pdf");
            output = Files.createTempFile("docpond-ocr-out-", ".pdf");
            FileUtils.writeByteArrayToFile(input.toFile(), pdfBytes);

            List<String> command = new ArrayList<>();
            command.add(ocrProperties.getTextLayer().getCommand());
            command.addAll(buildArguments(preset));
            command.add(input.toString());
            command.add(output.toString());
            log.info("Running text layer with preset '{}': {}", preset.getName(), command);

            run(command);

            byte[] result = FileUtils.readFileToByteArray(output.toFile());
            if (result.length == 0) {
                throw new OcrBackendException("Text layer produced an empty PDF");
            }
            return result;
        } catch (IOException e) {
            throw new OcrBackendException("Text layer failed: " + e.getMessage(), e);
        } finally {
            deleteQuietly(input);
            deleteQuietly(output);
        }
    }

    /**
     * OCRmyPDF flags for a preset. redo_ocr wins over force_ocr, which wins over skip_text; page
     * preprocessing is left out when redoing OCR.
     */
    public static List<String> buildArguments(OcrPreset preset) {
        List<String> args = new ArrayList<>();
        if (preset.isRedoOcr()) {
            args.add("--redo-ocr");
        } else if (preset.isForceOcr()) {
            args.add("--force-ocr");
        } else if (preset.isSkipText()) {
            args.add("--skip-text");
        }
        if (preset.getLanguage() != null && !preset.getLanguage().isBlank()) {
            args.add("--language");
            args.add(preset.getLanguage());
        }
        if (preset.getOptimize() > 0) {
            args.add("--optimize");
            args.add(String.valueOf(preset.getOptimize()));
        }
        if (preset.getJpegQuality() > 0 && preset.getJpegQuality() != OcrPreset.DEFAULT_JPEG_QUALITY) {
            args.add("--jpg-quality");
            args.add(String.valueOf(preset.getJpegQuality()));
        }
        if (preset.getPngQuality() > 0 && preset.getPngQuality() != OcrPreset.DEFAULT_PNG_QUALITY) {
            args.add("--png-quality");
            args.add(String.valueOf(preset.getPngQuality()));
        }
        if (!preset.isRedoOcr()) {
            if (preset.isDeskew()) {
                args.add("--deskew");
            }
            if (preset.isRotatePages()) {
                args.add("--rotate-pages");
            }
        }
        if (preset.getAdvancedSettings() != null) {
            preset.getAdvancedSettings().forEach((key, value) -> {
                if (IGNORED_ADVANCED_KEYS.contains(key)) {
                    return;
                }
                if (preset.isRedoOcr() && REDO_CONFLICTS.contains(key)) {
                    log.warn("Skipping advanced setting '{}' because it conflicts with redo_ocr", key);
                    return;
                }
                String flag = "--" + key.replace('_', '-').toLowerCase(Locale.ROOT);
                if (value instanceof Boolean enabled) {
                    if (enabled) {
                        args.add(flag);
                    }
                } else if (value != null) {
                    args.add(flag);
                    args.add(String.valueOf(value));
                }
            });
        }
        return args;
    }

    private void run(List<String> command) throws IOException {
        Path processLog = Files.createTempFile("docpond-ocr-log-", ".txt");
        try {
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(processLog.toFile())
                    .start();
            long timeoutMs = ocrProperties.getTextLayer().getTimeout().toMillis();
            try {
                if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                    throw new OcrBackendException("Text layer timed out after " + timeoutMs + " ms");
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new OcrBackendException("Interrupted while adding text layer", e);
            }
            String processOutput = FileUtils.readFileToString(processLog.toFile(), StandardCharsets.UTF_8).strip();
            if (process.exitValue() != 0) {
                throw new OcrBackendException("Text layer exited with code %d: %s"
                        .formatted(process.exitValue(), processOutput));
            }
            log.debug("Text layer output: {}", processOutput);
        } finally {
            deleteQuietly(processLog);
        }
    }

    private void deleteQuietly(Path path) {
        if (path != null) {
            File file = path.toFile();
            if (!FileUtils.deleteQuietly(file)) {
                log.debug("Temp file {} was already gone", file);
            }
        }
    }
}
