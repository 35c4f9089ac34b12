package io.clusternavigator.vlan;

import io.clusternavigator.enums.ClusterSource;
import io.clusternavigator.models.Cluster;
import io.clusternavigator.models.ClusterKey;
import io.clusternavigator.models.Segment;
import io.clusternavigator.models.SyncStats;
import io.clusternavigator.util.ClusterNameValidator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class SegmentTransformerTest {

    private final SegmentTransformer transformer =
        new SegmentTransformer(new ClusterNameValidator("ocp4-"), "example.com");

    private static Segment segment(String cidr, String clusterName, String site) {
        return Segment.builder().segment(cidr).clusterName(clusterName).site(site).build();
    }

    private static List<ClusterKey> keys(List<Cluster> clusters) {
        return clusters.stream().map(ClusterKey::of).collect(Collectors.toList());
    }

    @Test
    void testCommaJoinedNamesYieldOneClusterEach() {
        List<Cluster> clusters = transformer.transform(List.of(segment("10.0.0.0/24", "ocp4-a,ocp4-b", "s1")));

        assertThat(keys(clusters)).containsExactly(new ClusterKey("ocp4-a", "s1"), new ClusterKey("ocp4-b", "s1"));
        assertThat(clusters).allSatisfy(cluster -> {
            assertThat(cluster.getSegments()).containsExactly("10.0.0.0/24");
            assertThat(cluster.getSource()).isEqualTo(ClusterSource.SYNCED);
            assertThat(cluster.getDomainName()).isEqualTo("example.com");
        });
    }

    @Test
    void testReleasedSegmentsAreExcluded() {
        Segment released = segment("10.0.1.0/24", "ocp4-a", "s1");
        released.setReleased(true);

        List<Cluster> clusters = transformer.transform(List.of(segment("10.0.0.0/24", "ocp4-a", "s1"), released));

        assertThat(clusters).hasSize(1);
        assertThat(clusters.get(0).getSegments()).containsExactly("10.0.0.0/24");
    }

    @Test
    void testOnlyReleasedSegmentsYieldNothing() {
        Segment released = segment("10.0.1.0/24", "ocp4-a", "s1");
        released.setReleased(true);

        assertThat(transformer.transform(List.of(released))).isEmpty();
    }

    @Test
    void testNamesWithoutPrefixAreSkippedButSiblingsKept() {
        List<Cluster> clusters = transformer.transform(List.of(segment("10.0.0.0/24", "legacy-x, OCP4-Y ,", "s1")));

        assertThat(keys(clusters)).containsExactly(new ClusterKey("ocp4-y", "s1"));
    }

    @Test
    void testSameNameAtDifferentSitesStaysDistinct() {
        List<Cluster> clusters = transformer.transform(List.of(
            segment("10.0.0.0/24", "ocp4-a", "s1"),
            segment("10.1.0.0/24", "ocp4-a", "s2")));

        assertThat(keys(clusters)).containsExactly(new ClusterKey("ocp4-a", "s1"), new ClusterKey("ocp4-a", "s2"));
        assertThat(clusters.get(0).getSegments()).containsExactly("10.0.0.0/24");
        assertThat(clusters.get(1).getSegments()).containsExactly("10.1.0.0/24");
    }

    @Test
    void testIncompleteSegmentsAreSkipped() {
        List<Cluster> clusters = transformer.transform(List.of(
            segment(null, "ocp4-a", "s1"),
            segment("10.0.0.0/24", "", "s1"),
            segment("10.0.0.0/24", "ocp4-a", " ")));

        assertThat(clusters).isEmpty();
    }

    @Test
    void testDuplicateSegmentsAndMetadataAreCollapsed() {
        Segment first = Segment.builder().segment("10.0.0.0/24").clusterName("ocp4-a").site("s1")
            .vlanId("100").epgName("epg-a").vrf("vrf-1").build();
        Segment again = Segment.builder().segment("10.0.0.0/24").clusterName("ocp4-a").site("s1")
            .vlanId("100").epgName("").vrf("vrf-2").build();
        Segment second = Segment.builder().segment("10.0.1.0/24").clusterName("ocp4-a").site("s1")
            .vlanId("101").build();

        List<Cluster> clusters = transformer.transform(List.of(first, again, second));

        assertThat(clusters).hasSize(1);
        Cluster cluster = clusters.get(0);
        assertThat(cluster.getSegments()).containsExactly("10.0.0.0/24", "10.0.1.0/24");
        assertThat(cluster.getMetadata().getVlanIds()).containsExactly("100", "101");
        assertThat(cluster.getMetadata().getEpgNames()).containsExactly("epg-a");
        assertThat(cluster.getMetadata().getVrfs()).containsExactly("vrf-1", "vrf-2");
    }

    @Test
    void testTransformIsDeterministic() {
        List<Segment> segments = List.of(
            segment("10.0.0.0/24", "ocp4-b,ocp4-a", "s2"),
            segment("10.0.1.0/24", "ocp4-a", "s1"),
            segment("10.0.2.0/24", "ocp4-b", "s2"));

        assertThat(transformer.transform(segments)).isEqualTo(transformer.transform(segments));
        assertThat(keys(transformer.transform(segments))).containsExactly(
            new ClusterKey("ocp4-b", "s2"), new ClusterKey("ocp4-a", "s2"), new ClusterKey("ocp4-a", "s1"));
    }

    @Test
    void testCalculateStats() {
        List<Cluster> clusters = transformer.transform(List.of(
            segment("10.0.0.0/24", "ocp4-a,ocp4-b", "s1"),
            segment("10.0.1.0/24", "ocp4-a", "s1")));

        SyncStats stats = transformer.calculateStats(clusters, List.of("s1", "s2", "s3"));

        assertThat(stats.getTotalClusters()).isEqualTo(2);
        assertThat(stats.getTotalSites()).isEqualTo(3);
        assertThat(stats.getTotalSegments()).isEqualTo(3);
    }
}
