package com.coparent.service.storage;

import com.coparent.config.CoparentProperties;
import com.coparent.exception.InternalErrorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("S3ObjectStorage")
class S3ObjectStorageTest {

    @Mock
    private S3Client s3Client;

    private final CoparentProperties properties = new CoparentProperties();

    private S3ObjectStorage storage;

    @BeforeEach
    void setUp() {
        properties.getStorage().setBucket("coparent-files");
        properties.getStorage().setRegion("eu-central-1");
        properties.getStorage().setCdnUrl("https://cdn.example.com/");
        storage = new S3ObjectStorage(s3Client, properties);
    }

    @Nested
    @DisplayName("store")
    class Store {

        @Test
        @DisplayName("uploads under the folder and returns the CDN url")
        void uploadsToBucket() {
            String url = storage.store(new byte[]{1, 2, 3}, "families/10", "my photo.png", "image/png");

            ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
            verify(s3Client).putObject(captor.capture(), any(RequestBody.class));
            PutObjectRequest request = captor.getValue();
            assertThat(request.bucket()).isEqualTo("coparent-files");
            assertThat(request.key()).startsWith("families/10/").endsWith("-my_photo.png");
            assertThat(request.contentType()).isEqualTo("image/png");
            assertThat(request.contentLength()).isEqualTo(3L);
            assertThat(url).isEqualTo("https://cdn.example.com/" + request.key());
        }

        @Test
        @DisplayName("falls back to the bucket url without a CDN")
        void bucketUrlWithoutCdn() {
            properties.getStorage().setCdnUrl(null);

            String url = storage.store(new byte[]{1}, "users/alice", "a.jpg", "image/jpeg");

            assertThat(url).startsWith("https://coparent-files.s3.eu-central-1.amazonaws.com/users/alice/");
        }

        @Test
        @DisplayName("reports a failed upload as upload-failed")
        void uploadFailure() {
            when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                    .thenThrow(SdkClientException.create("unreachable"));

            assertThatThrownBy(() -> storage.store(new byte[]{1}, "families/10", "a.png", "image/png"))
                    .isInstanceOf(InternalErrorException.class)
                    .extracting("code").isEqualTo("upload-failed");
        }
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        @DisplayName("derives the key from the public url")
        void deletesKey() {
            storage.delete("https://cdn.example.com/families/10/abc-a.png");

            ArgumentCaptor<DeleteObjectRequest> captor = ArgumentCaptor.forClass(DeleteObjectRequest.class);
            verify(s3Client).deleteObject(captor.capture());
            assertThat(captor.getValue().bucket()).isEqualTo("coparent-files");
            assertThat(captor.getValue().key()).isEqualTo("families/10/abc-a.png");
        }

        @Test
        @DisplayName("ignores urls outside the store")
        void ignoresForeignUrl() {
            storage.delete("https://elsewhere.example.com/a.png");
            storage.delete(null);

            verifyNoInteractions(s3Client);
        }

        @Test
        @DisplayName("does not fail the caller when the delete fails")
        void deleteFailureIsLogged() {
            doThrow(SdkClientException.create("unreachable"))
                    .when(s3Client).deleteObject(any(DeleteObjectRequest.class));

            assertThatCode(() -> storage.delete("https://cdn.example.com/families/10/abc-a.png"))
                    .doesNotThrowAnyException();
        }
    }
}
