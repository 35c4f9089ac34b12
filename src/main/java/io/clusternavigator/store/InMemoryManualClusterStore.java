package io.clusternavigator.store;

import io.clusternavigator.enums.ClusterSource;
import io.clusternavigator.exceptions.ClusterAlreadyExistsException;
import io.clusternavigator.models.Cluster;
import io.clusternavigator.models.ClusterKey;
import io.clusternavigator.util.CidrValidator;
import io.clusternavigator.util.ClusterNameValidator;
import io.clusternavigator.util.ConsoleUrlGenerator;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Process-local {@link ManualClusterStore}. Contents do not survive a restart.
 */
@Slf4j
public class InMemoryManualClusterStore implements ManualClusterStore {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z0-9]([-a-z0-9]*[a-z0-9])?$");

    private final ClusterNameValidator nameValidator;
    private final ConsoleUrlGenerator consoleUrlGenerator;
    private final String defaultDomain;

    // Guarded by this
    private final Map<String, Cluster> clusters = new LinkedHashMap<>();

    public InMemoryManualClusterStore(ClusterNameValidator nameValidator, ConsoleUrlGenerator consoleUrlGenerator,
                                      String defaultDomain) {
        this.nameValidator = nameValidator;
        this.consoleUrlGenerator = consoleUrlGenerator;
        this.defaultDomain = defaultDomain;
    }

    @Override
    public synchronized Cluster create(Cluster draft) {
        if (draft == null) {
            throw new IllegalArgumentException("Cluster cannot be null");
        }
        String clusterName = nameValidator.validate(draft.getClusterName());
        if (!NAME_PATTERN.matcher(clusterName).matches()) {
            throw new IllegalArgumentException("Cluster name '" + draft.getClusterName()
                + "' must be lowercase alphanumeric with inner hyphens");
        }
        String site = draft.getSite() != null ? draft.getSite().trim() : "";
        if (site.isEmpty()) {
            throw new IllegalArgumentException("Site cannot be null or empty");
        }
        if (draft.getSegments() == null || draft.getSegments().isEmpty()) {
            throw new IllegalArgumentException("At least one segment is required");
        }
        CidrValidator.validate(draft.getSegments());

        ClusterKey key = new ClusterKey(clusterName, site);
        if (exists(clusterName, site)) {
            throw new ClusterAlreadyExistsException(key);
        }

        String domainName = draft.getDomainName() != null && !draft.getDomainName().isBlank()
            ? draft.getDomainName().trim() : defaultDomain;
        List<String> loadBalancerIP = draft.getLoadBalancerIP() != null && !draft.getLoadBalancerIP().isEmpty()
            ? new ArrayList<>(draft.getLoadBalancerIP()) : null;

        Cluster cluster = Cluster.builder()
            .id(UUID.randomUUID().toString())
            .clusterName(clusterName)
            .site(site)
            .segments(new ArrayList<>(draft.getSegments()))
            .domainName(domainName)
            .consoleUrl(consoleUrlGenerator.consoleUrl(clusterName, domainName))
            .createdAt(Instant.now())
            .source(ClusterSource.MANUAL)
            .loadBalancerIP(loadBalancerIP)
            .build();

        clusters.put(cluster.getId(), cluster);
        log.info("Created manual cluster {} with id {}", key, cluster.getId());
        return cluster.copy();
    }

    @Override
    public synchronized Optional<Cluster> get(String id) {
        return Optional.ofNullable(clusters.get(id)).map(Cluster::copy);
    }

    @Override
    public synchronized List<Cluster> getAll() {
        return clusters.values().stream().map(Cluster::copy).collect(Collectors.toList());
    }

    @Override
    public synchronized boolean delete(String id) {
        Cluster removed = clusters.remove(id);
        if (removed == null) {
            log.debug("Manual cluster {} not found for deletion", id);
            return false;
        }
        log.info("Deleted manual cluster {} ({})", id, ClusterKey.of(removed));
        return true;
    }

    @Override
    public synchronized boolean exists(String clusterName, String site) {
        String name = ClusterNameValidator.normalize(clusterName);
        return clusters.values().stream()
            .anyMatch(c -> c.getClusterName().equals(name) && c.getSite().equals(site));
    }
}
