package io.clusternavigator.api.handlers;

import io.clusternavigator.api.models.requests.ClusterCreateRequest;
import io.clusternavigator.api.models.responses.ErrorResponse;
import io.clusternavigator.api.models.responses.StatusResponse;
import io.clusternavigator.exceptions.ClusterAlreadyExistsException;
import io.clusternavigator.models.Cluster;
import io.clusternavigator.store.ManualClusterStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;

import static io.clusternavigator.config.Constants.SYNCED_CLUSTER_ID_PREFIX;

/**
 * REST API handler for manually registered clusters.
 *
 * Supported operations:
 * - GET /api/clusters - All manual clusters
 * - GET /api/clusters/{id} - One manual cluster
 * - POST /api/clusters - Register a manual cluster
 * - DELETE /api/clusters/{id} - Remove a manual cluster
 *
 * Synced clusters (ids starting with "vlan-") are read-only and cannot be deleted here.
 */
@Slf4j
@RestController
@RequestMapping("/api/clusters")
public class ClusterHandler {

    private final ManualClusterStore manualStore;

    public ClusterHandler(ManualClusterStore manualStore) {
        this.manualStore = manualStore;
    }

    @GetMapping
    public ResponseEntity<Object> getClusters() {
        try {
            return ResponseEntity.ok(manualStore.getAll());
        } catch (Exception e) {
            log.error("Error listing clusters: {}", e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<Object> getCluster(@PathVariable String id) {
        try {
            Optional<Cluster> cluster = manualStore.get(id);
            if (cluster.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Cluster '" + id + "'"));
            }
            return ResponseEntity.ok(cluster.get());
        } catch (Exception e) {
            log.error("Error getting cluster '{}': {}", id, e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @PostMapping
    public ResponseEntity<Object> createCluster(@RequestBody ClusterCreateRequest request) {
        try {
            log.info("Creating manual cluster '{}' at site '{}'", request.getClusterName(), request.getSite());
            Cluster created = manualStore.create(request.toDraft());
            return ResponseEntity.status(HttpStatus.CREATED).body(created);
        } catch (ClusterAlreadyExistsException e) {
            log.warn("Duplicate manual cluster: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.conflict(e.getMessage()));
        } catch (IllegalArgumentException e) {
            log.error("Invalid cluster request: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.badRequest(e.getMessage()));
        } catch (Exception e) {
            log.error("Error creating cluster: {}", e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Object> deleteCluster(@PathVariable String id) {
        try {
            if (id.startsWith(SYNCED_CLUSTER_ID_PREFIX)) {
                return ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .body(ErrorResponse.forbidden("Cannot delete VLAN Manager synced clusters. They are read-only."));
            }
            if (!manualStore.delete(id)) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Cluster '" + id + "'"));
            }
            return ResponseEntity.ok(StatusResponse.success("Cluster deleted successfully"));
        } catch (Exception e) {
            log.error("Error deleting cluster '{}': {}", id, e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }
}
