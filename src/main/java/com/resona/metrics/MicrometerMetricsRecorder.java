package com.resona.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * {@link MetricsRecorder} over Micrometer.
 * Counts become counters, milliseconds become timers, everything else a distribution summary.
 * All meters are registered under the {@code resona.} prefix.
 */
@Slf4j
@Component
public class MicrometerMetricsRecorder implements MetricsRecorder {

    static final String PREFIX = "resona.";

    private final MeterRegistry meterRegistry;

    public MicrometerMetricsRecorder(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void record(String name, double value, MetricUnit unit, Map<String, String> tags) {
        try {
            List<Tag> meterTags = tags == null ? List.of() : tags.entrySet().stream()
                    .map(e -> Tag.of(e.getKey(), e.getValue()))
                    .toList();
            String meterName = PREFIX + name;

            switch (unit) {
                case COUNT -> Counter.builder(meterName)
                        .tags(meterTags)
                        .register(meterRegistry)
                        .increment(value);
                case MILLISECONDS -> Timer.builder(meterName)
                        .tags(meterTags)
                        .register(meterRegistry)
                        .record(Duration.ofMillis((long) value));
                default -> DistributionSummary.builder(meterName)
                        .baseUnit(unit == MetricUnit.BYTES ? "bytes" : null)
                        .tags(meterTags)
                        .register(meterRegistry)
                        .record(value);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to record metric {}: {}", name, e.getMessage());
        }
    }
}
