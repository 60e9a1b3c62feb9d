package com.sitesmith.storage;

import com.sitesmith.core.error.UpstreamUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class S3ObjectStoreTest {

    private S3Client s3;
    private S3ObjectStore store;

    @BeforeEach
    void setUp() {
        s3 = mock(S3Client.class);
        store = new S3ObjectStore(s3, "sites");
    }

    @Test
    @DisplayName("put sends bucket, key and content type")
    void put() {
        store.put("website/a.example/index.html", "<html/>".getBytes(StandardCharsets.UTF_8), "text/html");

        var captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3).putObject(captor.capture(), any(RequestBody.class));
        assertEquals("sites", captor.getValue().bucket());
        assertEquals("website/a.example/index.html", captor.getValue().key());
        assertEquals("text/html", captor.getValue().contentType());
    }

    @Test
    @DisplayName("SDK failures surface as upstream unavailable")
    void putFailure() {
        when(s3.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(SdkClientException.create("connection reset"));

        var error = assertThrows(UpstreamUnavailableException.class,
                () -> store.put("k", new byte[]{1}, "text/html"));
        assertEquals("object-store", error.collaborator());
    }

    @Test
    @DisplayName("get returns bytes, and empty for a missing key")
    void get() {
        when(s3.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(),
                        "hi".getBytes(StandardCharsets.UTF_8)))
                .thenThrow(NoSuchKeyException.builder().message("missing").build());

        assertEquals("hi", new String(store.get("k").orElseThrow(), StandardCharsets.UTF_8));
        assertTrue(store.get("k").isEmpty());
    }

    @Test
    @DisplayName("delete targets the bucket and key")
    void delete() {
        store.delete("website/a.example/assets/logo.png");

        var captor = ArgumentCaptor.forClass(DeleteObjectRequest.class);
        verify(s3).deleteObject(captor.capture());
        assertEquals("sites", captor.getValue().bucket());
        assertEquals("website/a.example/assets/logo.png", captor.getValue().key());
    }

    @Test
    @DisplayName("list follows continuation tokens and sorts keys")
    void listPages() {
        when(s3.listObjectsV2(any(ListObjectsV2Request.class)))
                .thenReturn(ListObjectsV2Response.builder()
                        .contents(S3Object.builder().key("website/a/index.html").build())
                        .isTruncated(true)
                        .nextContinuationToken("t1")
                        .build())
                .thenReturn(ListObjectsV2Response.builder()
                        .contents(S3Object.builder().key("website/a/assets/x.png").build())
                        .isTruncated(false)
                        .build());

        assertEquals(List.of("website/a/assets/x.png", "website/a/index.html"), store.list("website/a/"));

        var captor = ArgumentCaptor.forClass(ListObjectsV2Request.class);
        verify(s3, times(2)).listObjectsV2(captor.capture());
        assertNull(captor.getAllValues().get(0).continuationToken());
        assertEquals("t1", captor.getAllValues().get(1).continuationToken());
    }
}
