package com.resona.edge;

import com.resona.exception.TransientDependencyException;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudfront.CloudFrontClient;
import software.amazon.awssdk.services.cloudfront.model.CreateInvalidationRequest;
import software.amazon.awssdk.services.cloudfront.model.CreateInvalidationResponse;
import software.amazon.awssdk.services.cloudfront.model.InvalidationBatch;
import software.amazon.awssdk.services.cloudfront.model.Paths;

import java.time.Clock;
import java.util.Optional;

/**
 * Amazon CloudFront edge delivery.
 */
@Slf4j
public class CloudFrontEdgeDeliveryProvider implements EdgeDeliveryProvider {

    private final CloudFrontClient cloudFrontClient;
    private final String distributionId;
    private final String domain;
    private final Clock clock;

    /**
     * @param distributionId null disables invalidation
     * @param domain         null disables edge URLs
     */
    public CloudFrontEdgeDeliveryProvider(CloudFrontClient cloudFrontClient, String distributionId,
                                          String domain, Clock clock) {
        this.cloudFrontClient = cloudFrontClient;
        this.distributionId = distributionId;
        this.domain = domain;
        this.clock = clock;
    }

    @Override
    public void invalidate(String path) {
        if (distributionId == null || distributionId.isBlank()) {
            log.warn("CloudFront distribution not configured, skipping invalidation of {}", path);
            return;
        }

        try {
            CreateInvalidationResponse response = cloudFrontClient.createInvalidation(CreateInvalidationRequest.builder()
                    .distributionId(distributionId)
                    .invalidationBatch(InvalidationBatch.builder()
                            .paths(Paths.builder().quantity(1).items(path).build())
                            .callerReference("invalidation-" + clock.millis())
                            .build())
                    .build());
            log.info("Requested CloudFront invalidation of {}: id={}", path, response.invalidation().id());
        } catch (SdkException e) {
            throw new TransientDependencyException("cloudfront", "invalidation of " + path + " failed: "
                    + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> urlFor(String objectKey) {
        if (domain == null || domain.isBlank()) {
            return Optional.empty();
        }
        return Optional.of("https://" + domain + "/" + objectKey);
    }
}
