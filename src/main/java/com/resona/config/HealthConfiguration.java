package com.resona.config;

import com.resona.alert.AlertDispatcher;
import com.resona.failover.DegradedModeFlags;
import com.resona.failover.FailoverController;
import com.resona.health.DependencyHealthMonitor;
import com.resona.health.DependencyType;
import com.resona.health.DurableStoreProbe;
import com.resona.health.EdgeDeliveryProbe;
import com.resona.health.HealthProbe;
import com.resona.health.PollySynthesisProbe;
import com.resona.metrics.MetricsRecorder;
import com.resona.storage.ObjectStorageProvider;
import com.resona.synthesis.SpeechSynthesisProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import software.amazon.awssdk.services.polly.PollyClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Dependency health probes, the monitor that runs them and the failover controller it notifies.
 */
@Configuration
public class HealthConfiguration {

    private final ResonaProperties properties;

    public HealthConfiguration(ResonaProperties properties) {
        this.properties = properties;
    }

    @Bean
    public FailoverController failoverController(
            DegradedModeFlags flags,
            @Qualifier("alternateSynthesisProvider") SpeechSynthesisProvider alternateProvider,
            AlertDispatcher alertDispatcher,
            MetricsRecorder metrics) {
        return new FailoverController(flags, alternateProvider, alertDispatcher, metrics,
                properties.getFailover().getRecovery());
    }

    @Bean
    public DependencyHealthMonitor dependencyHealthMonitor(
            PollyClient pollyClient,
            @Qualifier("fallbackPollyClient") PollyClient fallbackPollyClient,
            ObjectProvider<ObjectStorageProvider> storageProvider,
            WebClient webClient,
            FailoverController failoverController,
            MetricsRecorder metrics,
            Clock clock) {
        List<HealthProbe> probes = new ArrayList<>();
        String engine = properties.getSynthesis().getDefaultEngine();
        probes.add(new PollySynthesisProbe("Polly", DependencyType.SYNTHESIS, pollyClient, engine));
        probes.add(new PollySynthesisProbe("PollyFallback", DependencyType.ALTERNATE_SYNTHESIS,
                fallbackPollyClient, engine));

        ObjectStorageProvider provider = storageProvider.getIfAvailable();
        if (properties.getCache().getRemote().isEnabled() && provider != null) {
            probes.add(new DurableStoreProbe(provider));
        }

        probes.add(new EdgeDeliveryProbe(webClient, properties.getEdge().getDomain(),
                properties.getHealth().getTimeout()));

        return new DependencyHealthMonitor(probes, List.of(failoverController), metrics,
                properties.getHealth(), clock);
    }
}
