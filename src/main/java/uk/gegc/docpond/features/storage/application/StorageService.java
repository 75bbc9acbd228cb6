package uk.gegc.docpond.features.storage.application;

/**
 * Object storage for source PDFs, page PDFs, thumbnails and extracted images.
 * Keys are slash-separated relative paths.
 */
public interface StorageService {

    byte[] read(String key);

    void save(String key, byte[] data, String contentType);

    void delete(String key);

    boolean exists(String key);
}
