package uk.gegc.docpond.features.storage.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import uk.gegc.docpond.features.storage.application.StorageService;
import uk.gegc.docpond.features.storage.config.StorageProperties;
import uk.gegc.docpond.shared.exception.StorageException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Service
@Slf4j
@ConditionalOnProperty(prefix = "app.storage", name = "type", havingValue = "local", matchIfMissing = true)
public class LocalFileStorageService implements StorageService {

    private final Path root;

    public LocalFileStorageService(StorageProperties properties) {
        this.root = Path.of(properties.getLocalRoot()).toAbsolutePath().normalize();
    }

    @Override
    public byte[] read(String key) {
        Path path = resolve(key);
        try {
            return FileUtils.readFileToByteArray(path.toFile());
        } catch (IOException e) {
            throw new StorageException("Failed to read object " + key, e);
        }
    }

    @Override
    public void save(String key, byte[] data, String contentType) {
        Path path = resolve(key);
        try {
            FileUtils.writeByteArrayToFile(path.toFile(), data);
            log.debug("Stored {} ({} bytes, {})", key, data.length, contentType);
        } catch (IOException e) {
            throw new StorageException("Failed to write object " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new StorageException("Failed to delete object " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        return Files.isRegularFile(resolve(key));
    }

    private Path resolve(String key) {
        if (key == null || key.isBlank()) {
            throw new StorageException("Storage key must not be blank");
        }
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root)) {
            throw new StorageException("Storage key escapes the storage root: " + key);
        }
        return path;
    }
}
