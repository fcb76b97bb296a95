package com.coparent.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

@Configuration
@ConditionalOnProperty(prefix = "coparent.storage", name = "provider", havingValue = "s3", matchIfMissing = true)
public class StorageConfig {

    // credentials come from the default AWS provider chain
    @Bean(destroyMethod = "close")
    public S3Client s3Client(CoparentProperties properties) {
        return S3Client.builder()
                .region(Region.of(properties.getStorage().getRegion()))
                .build();
    }
}
