package io.clusternavigator.dns;

import io.clusternavigator.metrics.MetricsProvider;
import io.clusternavigator.models.DnsStats;
import io.clusternavigator.util.ClusterNameValidator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static io.clusternavigator.config.Constants.PLACEHOLDER_CLUSTER_NAME;
import static io.clusternavigator.config.Constants.PLACEHOLDER_DOMAIN_NAME;
import static io.clusternavigator.metrics.MetricsConstants.OUTCOME_ERROR;
import static io.clusternavigator.metrics.MetricsConstants.OUTCOME_RESOLVED;
import static io.clusternavigator.metrics.MetricsConstants.OUTCOME_UNRESOLVED;

/**
 * Resolves cluster load balancer addresses through DNS and keeps resolution statistics.
 * <p>
 * The host name is built from the configured resolution path template. Lookups never fail:
 * a missing name, an empty answer or a timeout all yield an empty list.
 */
@Slf4j
public class LoadBalancerResolver {

    private final AddressLookup addressLookup;
    private final String resolutionPath;
    private final String defaultDomain;
    private final MetricsProvider metricsProvider;
    private final DnsStatistics statistics = new DnsStatistics();

    public LoadBalancerResolver(AddressLookup addressLookup, String resolutionPath, String defaultDomain,
                                MetricsProvider metricsProvider) {
        this.addressLookup = addressLookup;
        this.resolutionPath = resolutionPath;
        this.defaultDomain = defaultDomain;
        this.metricsProvider = metricsProvider;
    }

    /**
     * Resolve every A-record address of a cluster's load balancer.
     *
     * @param clusterName the cluster name, normalized before use
     * @param domainName the cluster domain, or null for the default domain
     * @return the addresses, empty when the name cannot be resolved
     */
    public List<String> resolve(String clusterName, String domainName) {
        long start = System.nanoTime();
        String hostname = clusterName;
        List<String> addresses = new ArrayList<>();
        String outcome;

        try {
            hostname = hostnameFor(clusterName, domainName);
            addresses = addressLookup.lookup(hostname);
            if (addresses == null) {
                addresses = new ArrayList<>();
            }
            if (addresses.isEmpty()) {
                log.debug("DNS - no A records for {}", hostname);
                outcome = OUTCOME_UNRESOLVED;
            } else {
                log.debug("DNS - resolved {} to {}", hostname, addresses);
                outcome = OUTCOME_RESOLVED;
            }
        } catch (IOException e) {
            log.debug("DNS - lookup of {} failed: {}", hostname, e.getMessage());
            outcome = OUTCOME_UNRESOLVED;
        } catch (Exception e) {
            log.warn("DNS - unexpected error resolving {}: {}", hostname, e.getMessage());
            outcome = OUTCOME_ERROR;
        }

        long elapsedNanos = System.nanoTime() - start;
        statistics.record(!addresses.isEmpty(), elapsedNanos / 1_000_000_000.0);
        metricsProvider.recordDnsLookup(outcome, Duration.ofNanos(elapsedNanos));
        return addresses;
    }

    String hostnameFor(String clusterName, String domainName) {
        if (clusterName == null || clusterName.isBlank()) {
            throw new IllegalArgumentException("cluster name is missing");
        }
        String domain = domainName != null && !domainName.isBlank() ? domainName.trim() : defaultDomain;
        return resolutionPath
            .replace(PLACEHOLDER_CLUSTER_NAME, ClusterNameValidator.normalize(clusterName))
            .replace(PLACEHOLDER_DOMAIN_NAME, domain);
    }

    public DnsStats getStats() {
        return statistics.snapshot();
    }

    public void resetStats() {
        statistics.reset();
        log.debug("DNS - statistics reset");
    }
}
