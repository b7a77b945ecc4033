package com.resona.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resona.alert.AlertDispatcher;
import com.resona.alert.LoggingNotificationChannel;
import com.resona.alert.NotificationChannel;
import com.resona.alert.SnsNotificationChannel;
import com.resona.edge.CloudFrontEdgeDeliveryProvider;
import com.resona.edge.EdgeDeliveryProvider;
import com.resona.failover.DegradedModeFlags;
import com.resona.storage.ObjectStorageProvider;
import com.resona.storage.S3ObjectStorageProvider;
import com.resona.synthesis.PollySpeechSynthesisProvider;
import com.resona.synthesis.SpeechSynthesisProvider;
import com.resona.synthesis.SynthesisProviderRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudfront.CloudFrontClient;
import software.amazon.awssdk.services.polly.PollyClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sns.SnsClient;

import java.time.Clock;

/**
 * AWS clients and the collaborators built on them. Each client is created once here and
 * injected; credentials come from the default AWS provider chain.
 */
@Slf4j
@Configuration
public class AwsConfiguration {

    private final ResonaProperties properties;

    public AwsConfiguration(ResonaProperties properties) {
        this.properties = properties;
    }

    @Bean(destroyMethod = "close")
    @Primary
    public PollyClient pollyClient() {
        return PollyClient.builder()
                .region(Region.of(properties.getSynthesis().getRegion()))
                .build();
    }

    @Bean(destroyMethod = "close")
    public PollyClient fallbackPollyClient() {
        return PollyClient.builder()
                .region(Region.of(properties.getSynthesis().getFallbackRegion()))
                .build();
    }

    @Bean(destroyMethod = "close")
    public S3Client s3Client() {
        return S3Client.builder()
                .region(Region.of(properties.getSynthesis().getRegion()))
                .build();
    }

    @Bean(destroyMethod = "close")
    public CloudFrontClient cloudFrontClient() {
        return CloudFrontClient.builder()
                .region(Region.AWS_GLOBAL)
                .build();
    }

    @Bean(destroyMethod = "close")
    public SnsClient snsClient() {
        return SnsClient.builder()
                .region(Region.of(properties.getSynthesis().getRegion()))
                .build();
    }

    @Bean
    @Primary
    public SpeechSynthesisProvider primarySynthesisProvider(PollyClient pollyClient) {
        return new PollySpeechSynthesisProvider(pollyClient, properties.getSynthesis().getRegion());
    }

    @Bean
    public SpeechSynthesisProvider alternateSynthesisProvider(
            @Qualifier("fallbackPollyClient") PollyClient fallbackPollyClient) {
        return new PollySpeechSynthesisProvider(fallbackPollyClient, properties.getSynthesis().getFallbackRegion());
    }

    @Bean
    public SynthesisProviderRouter synthesisProviderRouter(
            @Qualifier("primarySynthesisProvider") SpeechSynthesisProvider primary,
            @Qualifier("alternateSynthesisProvider") SpeechSynthesisProvider alternate,
            DegradedModeFlags flags) {
        return new SynthesisProviderRouter(primary, alternate, flags);
    }

    @Bean
    @ConditionalOnProperty(prefix = "resona.cache.remote", name = "backend", havingValue = "s3", matchIfMissing = true)
    public ObjectStorageProvider s3ObjectStorageProvider(S3Client s3Client) {
        ResonaProperties.RemoteConfig remote = properties.getCache().getRemote();
        log.info("Remote cache tier backed by S3 bucket {} (prefix {})", remote.getBucket(), remote.getPrefix());
        return new S3ObjectStorageProvider(s3Client, remote.getBucket(), remote.getPrefix(),
                properties.getCache().getTtl());
    }

    @Bean
    public EdgeDeliveryProvider edgeDeliveryProvider(CloudFrontClient cloudFrontClient, Clock clock) {
        return new CloudFrontEdgeDeliveryProvider(cloudFrontClient,
                properties.getEdge().getDistributionId(), properties.getEdge().getDomain(), clock);
    }

    @Bean
    public NotificationChannel notificationChannel(SnsClient snsClient) {
        String topicArn = properties.getAlerts().getTopicArn();
        if (topicArn == null || topicArn.isBlank()) {
            log.warn("No alert topic configured, alerts will only be logged");
            return new LoggingNotificationChannel();
        }
        return new SnsNotificationChannel(snsClient, topicArn);
    }

    @Bean
    public AlertDispatcher alertDispatcher(NotificationChannel notificationChannel, ObjectMapper objectMapper,
                                           Clock clock) {
        return new AlertDispatcher(notificationChannel, objectMapper, properties, clock);
    }
}
