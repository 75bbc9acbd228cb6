package uk.gegc.docpond.features.storage.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import uk.gegc.docpond.features.storage.application.StorageService;
import uk.gegc.docpond.features.storage.config.StorageProperties;
import uk.gegc.docpond.shared.exception.StorageException;

@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "app.storage", name = "type", havingValue = "s3")
public class S3StorageService implements StorageService {

    private final S3Client s3Client;
    private final StorageProperties properties;

    @Override
    public byte[] read(String key) {
        try {
            return s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucket())
                    .key(key)
                    .build()).asByteArray();
        } catch (S3Exception e) {
            throw new StorageException("Failed to read object " + key, e);
        }
    }

    @Override
    public void save(String key, byte[] data, String contentType) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket())
                .key(key)
                .contentType(contentType)
                .contentLength((long) data.length)
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(data));
            log.debug("Uploaded {} to bucket {} ({} bytes)", key, bucket(), data.length);
        } catch (S3Exception e) {
            throw new StorageException("Failed to write object " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(bucket())
                    .key(key)
                    .build());
        } catch (S3Exception e) {
            throw new StorageException("Failed to delete object " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucket()).key(key).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw new StorageException("Failed to check object " + key, e);
        }
    }

    private String bucket() {
        return properties.getS3().getBucket();
    }
}
