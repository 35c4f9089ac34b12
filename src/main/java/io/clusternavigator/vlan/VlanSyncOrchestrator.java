package io.clusternavigator.vlan;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.clusternavigator.dns.LoadBalancerResolver;
import io.clusternavigator.metrics.MetricsProvider;
import io.clusternavigator.models.Cluster;
import io.clusternavigator.models.Segment;
import io.clusternavigator.models.SyncDataset;
import io.clusternavigator.models.SyncStats;
import io.clusternavigator.store.VlanCacheStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.clusternavigator.config.Constants.SYNC_FETCH_POOL_SIZE;
import static io.clusternavigator.metrics.MetricsConstants.RESULT_EMPTY;
import static io.clusternavigator.metrics.MetricsConstants.RESULT_ERROR;
import static io.clusternavigator.metrics.MetricsConstants.RESULT_FALLBACK;
import static io.clusternavigator.metrics.MetricsConstants.RESULT_SUCCESS;

/**
 * Periodically pulls segments and sites from VLAN Manager, turns them into clusters and
 * persists the result in the cache.
 * <p>
 * When VLAN Manager returns no segments the last cached dataset is served instead, so a
 * temporary outage never empties the cluster list. Exceptions inside a scheduled cycle are
 * logged and the loop carries on.
 */
@Slf4j
public class VlanSyncOrchestrator {

    private final VlanManagerClient client;
    private final SegmentTransformer transformer;
    private final LoadBalancerResolver resolver;
    private final VlanCacheStore cacheStore;
    private final MetricsProvider metricsProvider;
    private final long intervalSeconds;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ExecutorService fetchPool;
    private ScheduledExecutorService scheduler;

    public VlanSyncOrchestrator(VlanManagerClient client, SegmentTransformer transformer, LoadBalancerResolver resolver,
                                VlanCacheStore cacheStore, MetricsProvider metricsProvider, long intervalSeconds) {
        this.client = client;
        this.transformer = transformer;
        this.resolver = resolver;
        this.cacheStore = cacheStore;
        this.metricsProvider = metricsProvider;
        this.intervalSeconds = intervalSeconds;
        this.fetchPool = Executors.newFixedThreadPool(SYNC_FETCH_POOL_SIZE,
            new ThreadFactoryBuilder().setNameFormat("vlan-fetch-%d").setDaemon(true).build());
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("VlanSync - service already running");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("vlan-sync-%d").setDaemon(true).build());
        scheduler.scheduleWithFixedDelay(this::syncLoop, 0, intervalSeconds, TimeUnit.SECONDS);
        log.info("VlanSync - service started (interval: {}s, URL: {})", intervalSeconds, client.getBaseUrl());
    }

    /**
     * Stop scheduling cycles. A cycle already in progress runs to completion.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        if (scheduler != null) {
            scheduler.shutdown();
            scheduler = null;
        }
        log.info("VlanSync - service stopped");
    }

    /**
     * Stop the loop and release the fetch threads. The orchestrator cannot sync afterwards.
     */
    public synchronized void close() {
        stop();
        fetchPool.shutdown();
        log.info("VlanSync - fetch pool shut down");
    }

    public boolean isRunning() {
        return running.get();
    }

    private void syncLoop() {
        if (!running.get()) {
            return;
        }
        try {
            syncData();
        } catch (Exception e) {
            log.error("VlanSync - error in sync loop: {}", e.getMessage(), e);
            recordCycle(RESULT_ERROR);
        }
    }

    /**
     * Run one sync cycle.
     *
     * @return the fresh dataset, the cached one when VLAN Manager returned no segments,
     *         or an empty dataset when there is no cache either
     */
    public SyncDataset syncData() {
        long start = System.nanoTime();
        log.info("VlanSync - starting VLAN Manager data sync");

        CompletableFuture<List<Segment>> segmentsFuture =
            CompletableFuture.supplyAsync(client::fetchAllocatedSegments, fetchPool);
        CompletableFuture<List<String>> sitesFuture =
            CompletableFuture.supplyAsync(client::fetchSites, fetchPool);
        List<Segment> segments = segmentsFuture.join();
        List<String> sites = sitesFuture.join();

        try {
            if (segments.isEmpty()) {
                log.warn("VlanSync - no segments fetched, attempting to load from cache");
                Optional<SyncDataset> cached = cacheStore.load();
                if (cached.isPresent()) {
                    log.info("VlanSync - using cached data");
                    recordCycle(RESULT_FALLBACK);
                    return cached.get();
                }
                log.error("VlanSync - no cached data available");
                recordCycle(RESULT_EMPTY);
                return SyncDataset.empty();
            }

            List<Cluster> clusters = transformer.transform(segments);
            for (Cluster cluster : clusters) {
                cluster.setLoadBalancerIP(resolver.resolve(cluster.getClusterName(), cluster.getDomainName()));
            }
            SyncStats stats = transformer.calculateStats(clusters, sites);
            SyncDataset dataset = new SyncDataset(clusters, sites, stats);

            if (!cacheStore.save(dataset)) {
                log.error("VlanSync - failed to persist synced data, serving it uncached");
            }

            log.info("VlanSync - sync complete: {} clusters, {} sites, {} segments",
                stats.getTotalClusters(), stats.getTotalSites(), stats.getTotalSegments());
            metricsProvider.setSyncedClusters(stats.getTotalClusters());
            recordCycle(RESULT_SUCCESS);
            return dataset;
        } finally {
            metricsProvider.recordSyncDuration(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * @return the cached dataset, or an empty one when nothing is cached
     */
    public SyncDataset loadFromCache() {
        return cacheStore.load().orElseGet(SyncDataset::empty);
    }

    public long getIntervalSeconds() {
        return intervalSeconds;
    }

    public String getVlanManagerUrl() {
        return client.getBaseUrl();
    }

    private void recordCycle(String result) {
        metricsProvider.recordSyncCycle(result);
    }
}
