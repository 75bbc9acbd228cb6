package uk.gegc.docpond.features.storage.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.net.URI;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.storage")
public class StorageProperties {

    /**
     * Which backend holds objects: {@code local} or {@code s3}.
     */
    @NotBlank
    private String type = "local";

    /**
     * Root directory for the local backend.
     */
    @NotBlank
    private String localRoot = "./data/storage";

    @Valid
    @NotNull
    private S3 s3 = new S3();

    @Data
    public static class S3 {

        @NotBlank
        private String bucket = "docpond";

        @NotBlank
        private String region = "us-east-1";

        /**
         * S3-compatible API endpoint, e.g. a MinIO or Spaces region endpoint.
         */
        @NotNull
        private URI endpoint = URI.create("http://localhost:9000");

        @NotBlank
        private String accessKey = "dev-access-key";

        @NotBlank
        private String secretKey = "dev-secret-key";
    }
}
