package io.clusternavigator.merge;

import io.clusternavigator.dns.LoadBalancerResolver;
import io.clusternavigator.enums.ClusterSource;
import io.clusternavigator.models.Cluster;
import io.clusternavigator.models.ClusterKey;
import io.clusternavigator.models.DnsStats;
import io.clusternavigator.models.SiteView;
import io.clusternavigator.models.SyncDataset;
import io.clusternavigator.store.ManualClusterStore;
import io.clusternavigator.util.ConsoleUrlGenerator;
import io.clusternavigator.vlan.VlanSyncOrchestrator;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static io.clusternavigator.config.Constants.SYNCED_CLUSTER_ID_PREFIX;

/**
 * Combines synced clusters with manually entered ones into a per-site view.
 * <p>
 * A synced cluster always wins over a manual cluster with the same (name, site) key; the
 * manual record is dropped as a whole. Neither the cached dataset nor the manual store is modified.
 */
@Slf4j
public class ClusterMergeService {

    private final VlanSyncOrchestrator orchestrator;
    private final ManualClusterStore manualStore;
    private final LoadBalancerResolver resolver;
    private final ConsoleUrlGenerator consoleUrlGenerator;

    public ClusterMergeService(VlanSyncOrchestrator orchestrator, ManualClusterStore manualStore,
                               LoadBalancerResolver resolver, ConsoleUrlGenerator consoleUrlGenerator) {
        this.orchestrator = orchestrator;
        this.manualStore = manualStore;
        this.resolver = resolver;
        this.consoleUrlGenerator = consoleUrlGenerator;
    }

    /**
     * Build the combined view, sorted by site. Within a site synced clusters come first.
     */
    public List<SiteView> getCombinedView() {
        resolver.resetStats();
        log.info("Starting cluster processing and DNS resolution");

        SyncDataset synced = orchestrator.loadFromCache();
        List<Cluster> manualClusters = manualStore.getAll();
        log.debug("Loaded {} synced and {} manual clusters", synced.getClusters().size(), manualClusters.size());

        Instant now = Instant.now();
        Map<String, List<Cluster>> sites = new TreeMap<>();
        Set<ClusterKey> syncedKeys = new HashSet<>();

        for (Cluster cluster : synced.getClusters()) {
            ClusterKey key = ClusterKey.of(cluster);
            syncedKeys.add(key);

            Cluster view = cluster.copy();
            view.setId(SYNCED_CLUSTER_ID_PREFIX + key);
            view.setSource(ClusterSource.SYNCED);
            view.setConsoleUrl(consoleUrlGenerator.consoleUrl(cluster.getClusterName(), cluster.getDomainName()));
            view.setCreatedAt(now);
            view.setLoadBalancerIP(resolver.resolve(cluster.getClusterName(), cluster.getDomainName()));
            sites.computeIfAbsent(cluster.getSite(), s -> new ArrayList<>()).add(view);
        }

        int suppressed = 0;
        for (Cluster cluster : manualClusters) {
            ClusterKey key = ClusterKey.of(cluster);
            if (syncedKeys.contains(key)) {
                log.debug("Manual cluster {} is shadowed by a synced cluster", key);
                suppressed++;
                continue;
            }

            Cluster view = cluster.copy();
            view.setSource(ClusterSource.MANUAL);
            if (view.getLoadBalancerIP() == null || view.getLoadBalancerIP().isEmpty()) {
                view.setLoadBalancerIP(resolver.resolve(cluster.getClusterName(), cluster.getDomainName()));
            }
            sites.computeIfAbsent(cluster.getSite(), s -> new ArrayList<>()).add(view);
        }

        List<SiteView> result = new ArrayList<>();
        sites.forEach((site, clusters) -> result.add(SiteView.of(site, clusters)));

        DnsStats stats = resolver.getStats();
        log.info("Cluster processing completed: {} sites, {} manual clusters shadowed - DNS resolution stats: "
                + "{} requests, {} successful, {} failed, total time: {}s, average time: {}s",
            result.size(), suppressed, stats.getRequestCount(), stats.getSuccessCount(), stats.getFailureCount(),
            String.format("%.3f", stats.getTotalTimeSeconds()), String.format("%.3f", stats.getAverageTimeSeconds()));
        return result;
    }
}
