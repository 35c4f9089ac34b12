package io.clusternavigator.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static io.clusternavigator.metrics.MetricsConstants.DNS_LOOKUP_METRIC_NAME;
import static io.clusternavigator.metrics.MetricsConstants.OUTCOME_TAG;
import static io.clusternavigator.metrics.MetricsConstants.RESULT_TAG;
import static io.clusternavigator.metrics.MetricsConstants.VLAN_SYNCED_CLUSTERS_METRIC_NAME;
import static io.clusternavigator.metrics.MetricsConstants.VLAN_SYNC_CYCLES_METRIC_NAME;
import static io.clusternavigator.metrics.MetricsConstants.VLAN_SYNC_DURATION_METRIC_NAME;

/*
 * Records navigator metrics. Every meter carries the instance hostname tag.
 */
@Component
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};
    private static final String HOST_NAME_TAG = "hostname";

    private final MeterRegistry registry;
    private final Tags commonTags;
    // Keyed by name and tags so each gauge is registered once
    private final Map<String, AtomicDouble> gauges = new ConcurrentHashMap<>();

    @Autowired
    public MetricsProvider(
        MeterRegistry registry,
        @Value("${navigator.id:cluster-navigator}") String instanceId) {
        this.registry = registry;
        this.commonTags = Tags.of(HOST_NAME_TAG, instanceId);
        log.info("MetricsProvider initialized for navigator instance {}", instanceId);
    }

    /**
     * Count one finished sync cycle.
     *
     * @param result one of the {@code RESULT_*} values in {@link MetricsConstants}
     */
    public void recordSyncCycle(String result) {
        counter(VLAN_SYNC_CYCLES_METRIC_NAME, Map.of(RESULT_TAG, result)).increment();
    }

    public void recordSyncDuration(Duration duration) {
        timer(VLAN_SYNC_DURATION_METRIC_NAME, Map.of()).record(duration);
    }

    public void setSyncedClusters(int count) {
        gauge(VLAN_SYNCED_CLUSTERS_METRIC_NAME, Map.of()).set(count);
    }

    /**
     * @param outcome one of the {@code OUTCOME_*} values in {@link MetricsConstants}
     */
    public void recordDnsLookup(String outcome, Duration duration) {
        timer(DNS_LOOKUP_METRIC_NAME, Map.of(OUTCOME_TAG, outcome)).record(duration);
    }

    Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(withHost(tags)).register(registry);
    }

    AtomicDouble gauge(String name, Map<String, String> tags) {
        return gauges.computeIfAbsent(name + tags, key -> {
            AtomicDouble holder = new AtomicDouble(0);
            Gauge.builder(name, holder::get).tags(withHost(tags)).register(registry);
            return holder;
        });
    }

    Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
            .tags(withHost(tags))
            .publishPercentileHistogram()
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }

    private Tags withHost(Map<String, String> tags) {
        Tags result = commonTags;
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            result = result.and(tag.getKey(), tag.getValue());
        }
        return result;
    }
}
