package com.coparent.service.storage;

import com.coparent.config.CoparentProperties;
import com.coparent.exception.InternalErrorException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.util.UUID;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "coparent.storage", name = "provider", havingValue = "s3", matchIfMissing = true)
public class S3ObjectStorage implements ObjectStorage {

    private final S3Client s3Client;
    private final CoparentProperties properties;

    @Override
    public String store(byte[] content, String folder, String filename, String contentType) {
        String key = folder + "/" + UUID.randomUUID() + "-" + ObjectStorage.sanitize(filename);
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(properties.getStorage().getBucket())
                .key(key)
                .contentType(contentType)
                .contentLength((long) content.length)
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(content));
        } catch (SdkException e) {
            log.error("Failed to upload {} to bucket {}", key, request.bucket(), e);
            throw new InternalErrorException("upload-failed", "Failed to store uploaded file");
        }
        log.info("Uploaded {} ({} bytes, {})", key, content.length, contentType);
        return publicBase() + "/" + key;
    }

    @Override
    public void delete(String url) {
        String base = publicBase() + "/";
        if (url == null || !url.startsWith(base)) {
            return;
        }
        String key = url.substring(base.length());
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(properties.getStorage().getBucket())
                    .key(key)
                    .build());
        } catch (SdkException e) {
            log.warn("Failed to delete stored object {}", key, e);
        }
    }

    private String publicBase() {
        CoparentProperties.Storage storage = properties.getStorage();
        String cdn = storage.getCdnUrl();
        if (cdn != null && !cdn.isBlank()) {
            return cdn.endsWith("/") ? cdn.substring(0, cdn.length() - 1) : cdn;
        }
        return "https://" + storage.getBucket() + ".s3." + storage.getRegion() + ".amazonaws.com";
    }
}
