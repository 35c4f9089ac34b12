package io.clusternavigator.api.handlers;

import io.clusternavigator.api.models.responses.ErrorResponse;
import io.clusternavigator.api.models.responses.StatusResponse;
import io.clusternavigator.models.SyncDataset;
import io.clusternavigator.store.VlanCacheStore;
import io.clusternavigator.vlan.VlanSyncOrchestrator;
import io.clusternavigator.vlan.VlanSyncStatusService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;

/**
 * REST API handler for the VLAN Manager synchronization.
 *
 * Supported operations:
 * - GET /api/vlan-sync/data - Cached synced dataset
 * - POST /api/vlan-sync/sync - Run a sync cycle now
 * - GET /api/vlan-sync/status - Sync service and cache status
 * - GET /api/vlan-sync/sites - Site names of the cached dataset
 */
@Slf4j
@RestController
@RequestMapping("/api/vlan-sync")
public class VlanSyncHandler {

    private final VlanSyncOrchestrator orchestrator;
    private final VlanSyncStatusService statusService;
    private final VlanCacheStore cacheStore;

    public VlanSyncHandler(VlanSyncOrchestrator orchestrator, VlanSyncStatusService statusService,
                           VlanCacheStore cacheStore) {
        this.orchestrator = orchestrator;
        this.statusService = statusService;
        this.cacheStore = cacheStore;
    }

    /**
     * Get the cached dataset.
     * GET /api/vlan-sync/data
     */
    @GetMapping("/data")
    public ResponseEntity<Object> getData() {
        try {
            Optional<SyncDataset> dataset = cacheStore.load();
            if (dataset.isEmpty()) {
                log.warn("No VLAN sync data available yet");
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ErrorResponse.serviceUnavailable("VLAN Manager data not yet available. Sync in progress."));
            }
            return ResponseEntity.ok(dataset.get());
        } catch (Exception e) {
            log.error("Error reading VLAN sync data: {}", e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    /**
     * Trigger a sync cycle and return its result.
     * POST /api/vlan-sync/sync
     */
    @PostMapping("/sync")
    public ResponseEntity<Object> triggerSync() {
        try {
            log.info("Manual VLAN sync triggered");
            SyncDataset dataset = orchestrator.syncData();
            return ResponseEntity.ok(StatusResponse.success("Sync completed successfully", dataset));
        } catch (Exception e) {
            log.error("Manual VLAN sync failed: {}", e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.internalError("Sync failed: " + e.getMessage()));
        }
    }

    /**
     * GET /api/vlan-sync/status
     */
    @GetMapping("/status")
    public ResponseEntity<Object> getStatus() {
        try {
            return ResponseEntity.ok(statusService.getSyncStatus());
        } catch (Exception e) {
            log.error("Error getting VLAN sync status: {}", e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    /**
     * GET /api/vlan-sync/sites
     */
    @GetMapping("/sites")
    public ResponseEntity<Object> getSites() {
        try {
            return ResponseEntity.ok(statusService.getSites());
        } catch (Exception e) {
            log.error("Error getting VLAN sync sites: {}", e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }
}
