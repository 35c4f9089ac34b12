package io.clusternavigator.vlan;

import io.clusternavigator.enums.ClusterSource;
import io.clusternavigator.models.Cluster;
import io.clusternavigator.models.ClusterKey;
import io.clusternavigator.models.ClusterMetadata;
import io.clusternavigator.models.Segment;
import io.clusternavigator.models.SyncStats;
import io.clusternavigator.util.ClusterNameValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw VLAN Manager segments into cluster entities keyed by (name, site).
 * Pure and deterministic: the same input always yields the same output, in first-seen key order.
 */
@Slf4j
public class SegmentTransformer {

    private final ClusterNameValidator nameValidator;
    private final String defaultDomain;

    public SegmentTransformer(ClusterNameValidator nameValidator, String defaultDomain) {
        this.nameValidator = nameValidator;
        this.defaultDomain = defaultDomain;
    }

    public List<Cluster> transform(List<Segment> segments) {
        Map<ClusterKey, Cluster> clusters = new LinkedHashMap<>();
        if (segments == null) {
            return new ArrayList<>();
        }

        for (Segment segment : segments) {
            if (segment == null || isBlank(segment.getClusterName()) || isBlank(segment.getSite())
                || isBlank(segment.getSegment()) || segment.isReleased()) {
                continue;
            }

            for (String rawName : segment.getClusterName().split(",")) {
                String name = ClusterNameValidator.normalize(rawName);
                if (name.isEmpty()) {
                    continue;
                }
                if (!nameValidator.isValid(name)) {
                    log.debug("VlanSync - skipping cluster '{}' without required prefix '{}'",
                        rawName.trim(), nameValidator.getPrefix());
                    continue;
                }

                ClusterKey key = new ClusterKey(name, segment.getSite());
                Cluster cluster = clusters.computeIfAbsent(key, k -> newCluster(k));
                addSegment(cluster, segment);
            }
        }

        log.debug("VlanSync - transformed {} segments into {} clusters", segments.size(), clusters.size());
        return new ArrayList<>(clusters.values());
    }

    public SyncStats calculateStats(List<Cluster> clusters, List<String> sites) {
        int totalSegments = 0;
        for (Cluster cluster : clusters) {
            totalSegments += cluster.getSegments() != null ? cluster.getSegments().size() : 0;
        }
        return new SyncStats(clusters.size(), sites != null ? sites.size() : 0, totalSegments);
    }

    private Cluster newCluster(ClusterKey key) {
        return Cluster.builder()
            .clusterName(key.clusterName())
            .site(key.site())
            .segments(new ArrayList<>())
            .domainName(defaultDomain)
            .source(ClusterSource.SYNCED)
            .metadata(new ClusterMetadata())
            .build();
    }

    private static void addSegment(Cluster cluster, Segment segment) {
        if (!cluster.getSegments().contains(segment.getSegment())) {
            cluster.getSegments().add(segment.getSegment());
        }
        ClusterMetadata metadata = cluster.getMetadata();
        metadata.addVlanId(segment.getVlanId());
        metadata.addEpgName(segment.getEpgName());
        metadata.addVrf(segment.getVrf());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
