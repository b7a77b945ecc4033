package com.resona.storage;

import com.resona.exception.TransientDependencyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for S3ObjectStorageProvider.
 */
class S3ObjectStorageProviderTest {

    private static final String KEY = "ab".repeat(32);

    private S3Client s3Client;
    private S3ObjectStorageProvider provider;

    @BeforeEach
    void setUp() {
        s3Client = mock(S3Client.class);
        provider = new S3ObjectStorageProvider(s3Client, "alert-audio", "audio-cache/", Duration.ofHours(24));
    }

    @Test
    void testObjectKeyUsesPrefix() {
        assertEquals("audio-cache/" + KEY, provider.objectKey(KEY));
    }

    @Test
    void testGetReturnsPayloadAndLastModified() {
        Instant modified = Instant.parse("2024-05-01T10:00:00Z");
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class))).thenReturn(ResponseBytes.fromByteArray(
                GetObjectResponse.builder().lastModified(modified).build(), new byte[]{1, 2, 3}));

        Optional<StoredObject> stored = provider.get(KEY);

        assertTrue(stored.isPresent());
        assertArrayEquals(new byte[]{1, 2, 3}, stored.get().payload());
        assertEquals(modified, stored.get().lastModified());

        ArgumentCaptor<GetObjectRequest> captor = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3Client).getObjectAsBytes(captor.capture());
        assertEquals("alert-audio", captor.getValue().bucket());
        assertEquals("audio-cache/" + KEY, captor.getValue().key());
    }

    @Test
    void testGetMissingObjectIsEmpty() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("not found").build());

        assertTrue(provider.get(KEY).isEmpty());
    }

    @Test
    void testHeadNotFoundIsEmpty() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenThrow(S3Exception.builder().statusCode(404).message("Not Found").build());

        assertTrue(provider.headMetadata(KEY).isEmpty());
    }

    @Test
    void testHeadReturnsLastModified() {
        Instant modified = Instant.parse("2024-05-01T10:00:00Z");
        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenReturn(HeadObjectResponse.builder().lastModified(modified).build());

        assertEquals(Optional.of(modified), provider.headMetadata(KEY));
    }

    @Test
    void testServerErrorIsTransient() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenThrow(S3Exception.builder().statusCode(503).message("Slow Down").build());

        TransientDependencyException e = assertThrows(TransientDependencyException.class,
                () -> provider.headMetadata(KEY));
        assertEquals("s3-cache", e.getDependency());
    }

    @Test
    void testClientErrorIsTransient() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(SdkClientException.create("Unable to execute HTTP request"));

        assertThrows(TransientDependencyException.class, () -> provider.get(KEY));
    }

    @Test
    void testPutSetsCacheControlAndMetadata() {
        provider.put(KEY, new byte[]{9}, Map.of("cacheKey", KEY));

        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(captor.capture(), any(RequestBody.class));
        PutObjectRequest request = captor.getValue();
        assertEquals("alert-audio", request.bucket());
        assertEquals("audio-cache/" + KEY, request.key());
        assertEquals("max-age=86400", request.cacheControl());
        assertEquals(KEY, request.metadata().get("cacheKey"));
    }

    @Test
    void testPingFailureIsTransient() {
        when(s3Client.headBucket(any(HeadBucketRequest.class)))
                .thenThrow(SdkClientException.create("connection refused"));

        assertThrows(TransientDependencyException.class, () -> provider.ping());
    }
}
