package com.coparent.service.storage;

import com.coparent.config.CoparentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

/**
 * Development store writing under {@code coparent.storage.root-dir}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "coparent.storage", name = "provider", havingValue = "local")
public class LocalDiskObjectStorage implements ObjectStorage {

    private final CoparentProperties properties;

    @Override
    public String store(byte[] content, String folder, String filename, String contentType) {
        String safeName = UUID.randomUUID() + "-" + ObjectStorage.sanitize(filename);
        Path root = root();
        Path target = root.resolve(folder).resolve(safeName).normalize();
        if (!target.startsWith(root)) {
            throw new IllegalArgumentException("Invalid storage folder: " + folder);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store " + filename, e);
        }
        log.info("Stored {} ({} bytes, {})", target, content.length, contentType);
        return publicBase() + "/" + folder + "/" + safeName;
    }

    @Override
    public void delete(String url) {
        if (url == null || !url.startsWith(publicBase() + "/")) {
            return;
        }
        Path root = root();
        Path target = root.resolve(url.substring(publicBase().length() + 1)).normalize();
        if (!target.startsWith(root)) {
            return;
        }
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            log.warn("Failed to delete stored object {}", target, e);
        }
    }

    private Path root() {
        return Paths.get(properties.getStorage().getRootDir()).toAbsolutePath().normalize();
    }

    private String publicBase() {
        String base = properties.getStorage().getPublicBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
