package com.resona.health;

import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Edge delivery health: {@code HEAD https://<domain>/health-check}. Any status below 500 is
 * healthy. Without a configured domain there is nothing to deliver through, so the probe passes.
 */
public class EdgeDeliveryProbe implements HealthProbe {

    private final WebClient webClient;
    private final String domain;
    private final Duration timeout;

    public EdgeDeliveryProbe(WebClient webClient, String domain, Duration timeout) {
        this.webClient = webClient;
        this.domain = domain;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return "CloudFront";
    }

    @Override
    public DependencyType type() {
        return DependencyType.EDGE_DELIVERY;
    }

    @Override
    public ProbeResult probe() {
        if (domain == null || domain.isBlank()) {
            return ProbeResult.success(Duration.ZERO);
        }

        long start = System.nanoTime();
        Integer status = webClient.head()
                .uri("https://" + domain + "/health-check")
                .exchangeToMono(response -> Mono.just(response.statusCode().value()))
                .block(timeout);
        Duration latency = Duration.ofNanos(System.nanoTime() - start);

        if (status == null) {
            return ProbeResult.failure(latency, "no response from " + domain);
        }
        if (status >= 500) {
            return ProbeResult.failure(latency, "edge returned HTTP " + status);
        }
        return ProbeResult.success(latency);
    }
}
