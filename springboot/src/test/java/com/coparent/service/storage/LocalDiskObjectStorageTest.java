package com.coparent.service.storage;

import com.coparent.config.CoparentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("LocalDiskObjectStorage")
class LocalDiskObjectStorageTest {

    @TempDir
    Path root;

    private LocalDiskObjectStorage storage;

    @BeforeEach
    void setUp() {
        CoparentProperties properties = new CoparentProperties();
        properties.getStorage().setProvider("local");
        properties.getStorage().setRootDir(root.toString());
        properties.getStorage().setPublicBaseUrl("/files");
        storage = new LocalDiskObjectStorage(properties);
    }

    @Test
    @DisplayName("writes under the root and serves from the public base")
    void storeAndDelete() {
        String url = storage.store(new byte[]{7, 8}, "families/3", "kid.png", "image/png");

        assertThat(url).startsWith("/files/families/3/").endsWith("-kid.png");
        Path stored = root.resolve(url.substring("/files/".length()));
        assertThat(stored).exists();

        storage.delete(url);

        assertThat(Files.exists(stored)).isFalse();
    }

    @Test
    @DisplayName("rejects folders escaping the root")
    void rejectsTraversal() {
        assertThatThrownBy(() -> storage.store(new byte[]{1}, "../outside", "a.png", "image/png"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
