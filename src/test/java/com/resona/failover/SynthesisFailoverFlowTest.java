package com.resona.failover;

import com.resona.alert.AlertDispatcher;
import com.resona.cache.MutableClock;
import com.resona.config.ResonaProperties;
import com.resona.config.ResonaProperties.RecoveryPolicy;
import com.resona.exception.GenerationUnavailableException;
import com.resona.failover.DegradedModeFlags.SynthesisMode;
import com.resona.health.DependencyHealthMonitor;
import com.resona.health.DependencyType;
import com.resona.health.HealthStatus;
import com.resona.health.PollySynthesisProbe;
import com.resona.metrics.MetricsRecorder;
import com.resona.synthesis.SpeechSynthesisProvider;
import com.resona.synthesis.SynthesisProviderRouter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.polly.PollyClient;
import software.amazon.awssdk.services.polly.model.DescribeVoicesRequest;
import software.amazon.awssdk.services.polly.model.DescribeVoicesResponse;
import software.amazon.awssdk.services.polly.model.Voice;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Health monitor and failover controller driving the synthesis mode together.
 */
class SynthesisFailoverFlowTest {

    private final AtomicBoolean primaryUp = new AtomicBoolean(true);
    private final AtomicBoolean fallbackUp = new AtomicBoolean(true);

    private DegradedModeFlags flags;
    private SpeechSynthesisProvider primary;
    private SpeechSynthesisProvider alternate;
    private AlertDispatcher alerts;
    private SynthesisProviderRouter router;
    private DependencyHealthMonitor monitor;

    @BeforeEach
    void setUp() {
        ResonaProperties.HealthConfig config = new ResonaProperties.HealthConfig();
        config.setEnabled(false);
        config.setTimeout(Duration.ofSeconds(1));
        config.setFailureThreshold(3);

        flags = new DegradedModeFlags();
        primary = mock(SpeechSynthesisProvider.class);
        when(primary.getName()).thenReturn("polly-ap-south-1");
        alternate = mock(SpeechSynthesisProvider.class);
        when(alternate.getName()).thenReturn("polly-us-east-1");
        doAnswer(invocation -> {
            if (!fallbackUp.get()) {
                throw new IllegalStateException("fallback region unreachable");
            }
            return null;
        }).when(alternate).checkAvailable();
        alerts = mock(AlertDispatcher.class);
        MetricsRecorder metrics = mock(MetricsRecorder.class);

        router = new SynthesisProviderRouter(primary, alternate, flags);
        FailoverController controller = new FailoverController(flags, alternate, alerts, metrics,
                RecoveryPolicy.AUTOMATIC);
        monitor = new DependencyHealthMonitor(
                List.of(new PollySynthesisProbe("Polly", DependencyType.SYNTHESIS, pollyClient(primaryUp), "neural"),
                        new PollySynthesisProbe("PollyFallback", DependencyType.ALTERNATE_SYNTHESIS,
                                pollyClient(fallbackUp), "neural")),
                List.of(controller), metrics, config, new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
    }

    @AfterEach
    void tearDown() {
        monitor.stop();
    }

    private static PollyClient pollyClient(AtomicBoolean up) {
        PollyClient client = mock(PollyClient.class);
        when(client.describeVoices(any(DescribeVoicesRequest.class))).thenAnswer(invocation -> {
            if (!up.get()) {
                throw new IllegalStateException("region unreachable");
            }
            return DescribeVoicesResponse.builder().voices(Voice.builder().id("Joanna").build()).build();
        });
        return client;
    }

    private void runChecks(String dependency, int times) {
        for (int i = 0; i < times; i++) {
            monitor.runProbe(dependency);
        }
    }

    @Test
    void testAlternateOutageWhileInUseFallsBackToCacheOnly() {
        primaryUp.set(false);
        runChecks("Polly", 3);
        assertEquals(SynthesisMode.ALTERNATE, flags.synthesis());
        assertSame(alternate, router.activeProvider());

        fallbackUp.set(false);
        runChecks("Polly", 1);
        runChecks("PollyFallback", 3);

        assertEquals(HealthStatus.FAILED, monitor.getHealth("PollyFallback").orElseThrow().status());
        assertEquals(SynthesisMode.CACHE_ONLY, flags.synthesis());
        assertThrows(GenerationUnavailableException.class, () -> router.activeProvider());
        verify(alerts).dispatchFailover(eq("PollyFallback"), anyString(), eq("CACHE_ONLY"));
    }

    @Test
    void testRecoveriesStepBackThroughAlternateToPrimary() {
        primaryUp.set(false);
        runChecks("Polly", 3);
        fallbackUp.set(false);
        runChecks("PollyFallback", 3);
        assertEquals(SynthesisMode.CACHE_ONLY, flags.synthesis());

        fallbackUp.set(true);
        runChecks("PollyFallback", 1);
        assertEquals(SynthesisMode.ALTERNATE, flags.synthesis());
        verify(alerts).dispatchRecovery("PollyFallback", "ALTERNATE");

        primaryUp.set(true);
        runChecks("Polly", 1);
        assertEquals(SynthesisMode.NORMAL, flags.synthesis());
        assertSame(primary, router.activeProvider());
    }

    @Test
    void testAlternateOutageWhilePrimaryHealthyKeepsSynthesis() {
        fallbackUp.set(false);
        runChecks("PollyFallback", 3);

        assertEquals(SynthesisMode.NORMAL, flags.synthesis());
        assertSame(primary, router.activeProvider());
        verify(alerts).dispatchFailover(eq("PollyFallback"), anyString(), eq("NORMAL"));
    }

    @Test
    void testPrimaryOutageWithAlternateAlreadyDownGoesCacheOnly() {
        fallbackUp.set(false);
        runChecks("PollyFallback", 3);

        primaryUp.set(false);
        runChecks("Polly", 3);

        assertEquals(SynthesisMode.CACHE_ONLY, flags.synthesis());
    }
}
