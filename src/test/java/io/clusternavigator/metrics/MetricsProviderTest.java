package io.clusternavigator.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static io.clusternavigator.metrics.MetricsConstants.*;
import static org.assertj.core.api.Assertions.*;

class MetricsProviderTest {

    private static final String TEST_INSTANCE_ID = "navigator-test-01";

    private MeterRegistry registry;
    private MetricsProvider provider;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        provider = new MetricsProvider(registry, TEST_INSTANCE_ID);
    }

    @Test
    void testSyncCyclesAreCountedPerResult() {
        provider.recordSyncCycle(RESULT_SUCCESS);
        provider.recordSyncCycle(RESULT_SUCCESS);
        provider.recordSyncCycle(RESULT_FALLBACK);

        Counter success = registry.find(VLAN_SYNC_CYCLES_METRIC_NAME).tag(RESULT_TAG, RESULT_SUCCESS).counter();
        Counter fallback = registry.find(VLAN_SYNC_CYCLES_METRIC_NAME).tag(RESULT_TAG, RESULT_FALLBACK).counter();
        assertThat(success.count()).isEqualTo(2.0);
        assertThat(fallback.count()).isEqualTo(1.0);
        assertThat(success.getId().getTag("hostname")).isEqualTo(TEST_INSTANCE_ID);
    }

    @Test
    void testSyncedClustersGaugeIsRegisteredOnce() {
        provider.setSyncedClusters(12);
        provider.setSyncedClusters(7);

        assertThat(registry.find(VLAN_SYNCED_CLUSTERS_METRIC_NAME).gauges()).hasSize(1);
        Gauge gauge = registry.find(VLAN_SYNCED_CLUSTERS_METRIC_NAME).gauge();
        assertThat(gauge.value()).isEqualTo(7.0);
        assertThat(gauge.getId().getTag("hostname")).isEqualTo(TEST_INSTANCE_ID);

        AtomicDouble holder = provider.gauge(VLAN_SYNCED_CLUSTERS_METRIC_NAME, Map.of());
        assertThat(holder.get()).isEqualTo(7.0);
    }

    @Test
    void testDnsLookupTimerIsTaggedWithOutcome() {
        provider.recordDnsLookup(OUTCOME_RESOLVED, Duration.ofMillis(100));

        Timer timer = registry.find(DNS_LOOKUP_METRIC_NAME).tag(OUTCOME_TAG, OUTCOME_RESOLVED).timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(100);
        assertThat(registry.find(DNS_LOOKUP_METRIC_NAME).tag(OUTCOME_TAG, OUTCOME_ERROR).timer()).isNull();
    }

    @Test
    void testSyncDurationTimer() {
        provider.recordSyncDuration(Duration.ofSeconds(2));

        Timer timer = registry.find(VLAN_SYNC_DURATION_METRIC_NAME).timer();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.SECONDS)).isEqualTo(2.0);
    }
}
