package com.resona.edge;

import com.resona.exception.TransientDependencyException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.cloudfront.CloudFrontClient;
import software.amazon.awssdk.services.cloudfront.model.CreateInvalidationRequest;
import software.amazon.awssdk.services.cloudfront.model.CreateInvalidationResponse;
import software.amazon.awssdk.services.cloudfront.model.Invalidation;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for CloudFrontEdgeDeliveryProvider.
 */
class CloudFrontEdgeDeliveryProviderTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(1714557600000L), ZoneOffset.UTC);

    @Test
    void testInvalidateRequestsSinglePath() {
        CloudFrontClient client = mock(CloudFrontClient.class);
        when(client.createInvalidation(any(CreateInvalidationRequest.class))).thenReturn(CreateInvalidationResponse
                .builder()
                .invalidation(Invalidation.builder().id("I2J0I21PCUYOIK").build())
                .build());
        CloudFrontEdgeDeliveryProvider provider = new CloudFrontEdgeDeliveryProvider(client, "E2QWRUHAPOMQZL",
                "d123.cloudfront.net", CLOCK);

        provider.invalidate("/audio-cache/abc");

        ArgumentCaptor<CreateInvalidationRequest> captor = ArgumentCaptor.forClass(CreateInvalidationRequest.class);
        verify(client).createInvalidation(captor.capture());
        CreateInvalidationRequest request = captor.getValue();
        assertEquals("E2QWRUHAPOMQZL", request.distributionId());
        assertEquals(List.of("/audio-cache/abc"), request.invalidationBatch().paths().items());
        assertEquals(1, request.invalidationBatch().paths().quantity());
        assertEquals("invalidation-1714557600000", request.invalidationBatch().callerReference());
    }

    @Test
    void testInvalidateWithoutDistributionIsSkipped() {
        CloudFrontClient client = mock(CloudFrontClient.class);

        new CloudFrontEdgeDeliveryProvider(client, null, null, CLOCK).invalidate("/audio-cache/abc");

        verifyNoInteractions(client);
    }

    @Test
    void testInvalidationFailureIsTransient() {
        CloudFrontClient client = mock(CloudFrontClient.class);
        when(client.createInvalidation(any(CreateInvalidationRequest.class)))
                .thenThrow(SdkClientException.create("connection reset"));
        CloudFrontEdgeDeliveryProvider provider = new CloudFrontEdgeDeliveryProvider(client, "E2QWRUHAPOMQZL",
                "d123.cloudfront.net", CLOCK);

        assertThrows(TransientDependencyException.class, () -> provider.invalidate("/audio-cache/abc"));
    }

    @Test
    void testUrlForUsesDomain() {
        CloudFrontClient client = mock(CloudFrontClient.class);

        assertEquals(Optional.of("https://d123.cloudfront.net/audio-cache/abc"),
                new CloudFrontEdgeDeliveryProvider(client, "E2QWRUHAPOMQZL", "d123.cloudfront.net", CLOCK)
                        .urlFor("audio-cache/abc"));
        assertTrue(new CloudFrontEdgeDeliveryProvider(client, "E2QWRUHAPOMQZL", " ", CLOCK)
                .urlFor("audio-cache/abc").isEmpty());
    }
}
