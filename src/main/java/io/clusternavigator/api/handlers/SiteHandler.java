package io.clusternavigator.api.handlers;

import io.clusternavigator.api.models.responses.ErrorResponse;
import io.clusternavigator.merge.ClusterMergeService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API handler for the combined per-site cluster view.
 * GET /api/sites-combined
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class SiteHandler {

    private final ClusterMergeService mergeService;

    public SiteHandler(ClusterMergeService mergeService) {
        this.mergeService = mergeService;
    }

    @GetMapping("/sites-combined")
    public ResponseEntity<Object> getCombinedSites() {
        try {
            return ResponseEntity.ok(mergeService.getCombinedView());
        } catch (Exception e) {
            log.error("Error building combined site view: {}", e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }
}
