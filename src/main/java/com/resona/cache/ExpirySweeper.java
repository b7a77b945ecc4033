package com.resona.cache;

import com.resona.cache.tier.BoundedTierStore;
import com.resona.metrics.MetricUnit;
import com.resona.metrics.MetricsRecorder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.List;
import java.util.Map;

/**
 * Background removal of expired entries from the memory and disk tiers.
 * Runs on the scheduler thread; each removal holds the tier lock for one key only.
 */
@Slf4j
public class ExpirySweeper {

    private final List<BoundedTierStore> tiers;
    private final MetricsRecorder metrics;

    public ExpirySweeper(List<BoundedTierStore> tiers, MetricsRecorder metrics) {
        this.tiers = List.copyOf(tiers);
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "${resona.cache.sweep-interval:PT1H}",
            initialDelayString = "${resona.cache.sweep-interval:PT1H}")
    public void scheduledSweep() {
        sweep();
    }

    /**
     * @return total number of entries removed
     */
    public int sweep() {
        int total = 0;
        for (BoundedTierStore tier : tiers) {
            try {
                int removed = tier.removeExpired();
                total += removed;
                if (removed > 0) {
                    log.info("Removed {} expired entries from {} tier", removed, tier.tier().label());
                    metrics.record("ExpiredEntriesRemoved", removed, MetricUnit.COUNT,
                            Map.of("tier", tier.tier().label()));
                }
            } catch (RuntimeException e) {
                log.warn("Expiry sweep of {} tier failed: {}", tier.tier().label(), e.getMessage());
            }
        }
        return total;
    }
}
