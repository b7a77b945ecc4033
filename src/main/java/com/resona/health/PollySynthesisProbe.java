package com.resona.health;

import software.amazon.awssdk.services.polly.PollyClient;
import software.amazon.awssdk.services.polly.model.DescribeVoicesRequest;
import software.amazon.awssdk.services.polly.model.DescribeVoicesResponse;
import software.amazon.awssdk.services.polly.model.Engine;

import java.time.Duration;

/**
 * Synthesis health: lists the voices available for the configured engine.
 * One instance watches the primary region, another the fallback region.
 */
public class PollySynthesisProbe implements HealthProbe {

    private final String name;
    private final DependencyType type;
    private final PollyClient pollyClient;
    private final String engine;

    public PollySynthesisProbe(String name, DependencyType type, PollyClient pollyClient, String engine) {
        this.name = name;
        this.type = type;
        this.pollyClient = pollyClient;
        this.engine = engine;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DependencyType type() {
        return type;
    }

    @Override
    public ProbeResult probe() {
        long start = System.nanoTime();
        DescribeVoicesResponse response = pollyClient.describeVoices(DescribeVoicesRequest.builder()
                .engine(Engine.fromValue(engine))
                .build());
        Duration latency = Duration.ofNanos(System.nanoTime() - start);
        if (!response.hasVoices() || response.voices().isEmpty()) {
            return ProbeResult.failure(latency, "no voices available for engine " + engine);
        }
        return ProbeResult.success(latency);
    }
}
