package io.clusternavigator.api.handlers;

import io.clusternavigator.api.models.responses.ErrorResponse;
import io.clusternavigator.api.models.responses.StatusResponse;
import io.clusternavigator.dns.LoadBalancerResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API handler for DNS resolution statistics.
 */
@Slf4j
@RestController
@RequestMapping("/api/dns")
public class DnsHandler {

    private final LoadBalancerResolver resolver;

    public DnsHandler(LoadBalancerResolver resolver) {
        this.resolver = resolver;
    }

    @GetMapping("/stats")
    public ResponseEntity<Object> getStats() {
        try {
            return ResponseEntity.ok(resolver.getStats());
        } catch (Exception e) {
            log.error("Error getting DNS stats: {}", e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @PostMapping("/stats/reset")
    public ResponseEntity<Object> resetStats() {
        try {
            resolver.resetStats();
            log.info("DNS statistics reset");
            return ResponseEntity.ok(StatusResponse.success("DNS statistics reset"));
        } catch (Exception e) {
            log.error("Error resetting DNS stats: {}", e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }
}
