package io.clusternavigator.vlan;

import io.clusternavigator.models.SiteList;
import io.clusternavigator.models.SyncStatus;
import io.clusternavigator.store.VlanCacheStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Reports the state of the sync service and its cache file.
 */
@Slf4j
public class VlanSyncStatusService {

    private final VlanSyncOrchestrator orchestrator;
    private final VlanCacheStore cacheStore;

    public VlanSyncStatusService(VlanSyncOrchestrator orchestrator, VlanCacheStore cacheStore) {
        this.orchestrator = orchestrator;
        this.cacheStore = cacheStore;
    }

    public SyncStatus getSyncStatus() {
        Optional<Instant> modified = cacheStore.lastModified();
        Double cacheAgeMinutes = null;
        String lastUpdated = null;

        if (modified.isPresent()) {
            double minutes = Duration.between(modified.get(), Instant.now()).toMillis() / 60_000.0;
            cacheAgeMinutes = Math.round(minutes * 100.0) / 100.0;
            lastUpdated = modified.get().toString();
        }

        return SyncStatus.builder()
            .serviceRunning(orchestrator.isRunning())
            .syncIntervalSeconds(orchestrator.getIntervalSeconds())
            .cacheExists(modified.isPresent())
            .cacheAgeMinutes(cacheAgeMinutes)
            .lastUpdated(lastUpdated)
            .vlanManagerUrl(orchestrator.getVlanManagerUrl())
            .build();
    }

    /**
     * Site names of the cached dataset, sorted and de-duplicated.
     */
    public SiteList getSites() {
        List<String> cachedSites = orchestrator.loadFromCache().getSites();
        List<String> siteNames = new ArrayList<>(new TreeSet<>(cachedSites != null ? cachedSites : List.of()));
        log.debug("VlanSync - {} distinct cached sites", siteNames.size());
        return new SiteList(siteNames, siteNames.size());
    }
}
