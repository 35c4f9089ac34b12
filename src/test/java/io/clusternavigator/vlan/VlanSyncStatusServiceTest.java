package io.clusternavigator.vlan;

import io.clusternavigator.models.SiteList;
import io.clusternavigator.models.SyncDataset;
import io.clusternavigator.models.SyncStatus;
import io.clusternavigator.store.VlanCacheStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.when;

class VlanSyncStatusServiceTest {

    @Mock
    private VlanSyncOrchestrator orchestrator;

    @Mock
    private VlanCacheStore cacheStore;

    private VlanSyncStatusService statusService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        statusService = new VlanSyncStatusService(orchestrator, cacheStore);
        when(orchestrator.isRunning()).thenReturn(true);
        when(orchestrator.getIntervalSeconds()).thenReturn(300L);
        when(orchestrator.getVlanManagerUrl()).thenReturn("http://vlan.test/api");
    }

    @Test
    void testStatusWithCache() {
        Instant modified = Instant.now().minus(90, ChronoUnit.SECONDS);
        when(cacheStore.lastModified()).thenReturn(Optional.of(modified));

        SyncStatus status = statusService.getSyncStatus();

        assertThat(status.isServiceRunning()).isTrue();
        assertThat(status.getSyncIntervalSeconds()).isEqualTo(300L);
        assertThat(status.isCacheExists()).isTrue();
        assertThat(status.getCacheAgeMinutes()).isBetween(1.49, 1.6);
        assertThat(Instant.parse(status.getLastUpdated())).isEqualTo(modified);
        assertThat(status.getVlanManagerUrl()).isEqualTo("http://vlan.test/api");
    }

    @Test
    void testStatusWithoutCache() {
        when(cacheStore.lastModified()).thenReturn(Optional.empty());

        SyncStatus status = statusService.getSyncStatus();

        assertThat(status.isCacheExists()).isFalse();
        assertThat(status.getCacheAgeMinutes()).isNull();
        assertThat(status.getLastUpdated()).isNull();
    }

    @Test
    void testSitesAreSortedAndDistinct() {
        when(orchestrator.loadFromCache()).thenReturn(
            new SyncDataset(new ArrayList<>(), new ArrayList<>(List.of("s2", "s1", "s2", "s3")), null));

        SiteList sites = statusService.getSites();

        assertThat(sites.getSites()).containsExactly("s1", "s2", "s3");
        assertThat(sites.getCount()).isEqualTo(3);
    }

    @Test
    void testSitesWithoutCache() {
        when(orchestrator.loadFromCache()).thenReturn(SyncDataset.empty());

        SiteList sites = statusService.getSites();

        assertThat(sites.getSites()).isEmpty();
        assertThat(sites.getCount()).isZero();
    }
}
