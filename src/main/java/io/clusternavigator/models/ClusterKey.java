package io.clusternavigator.models;

import static io.clusternavigator.config.Constants.CLUSTER_KEY_SEPARATOR;

/**
 * Composite identity of a cluster. The same cluster name may exist at several sites.
 */
public record ClusterKey(String clusterName, String site) {

    public static ClusterKey of(Cluster cluster) {
        return new ClusterKey(cluster.getClusterName(), cluster.getSite());
    }

    @Override
    public String toString() {
        return clusterName + CLUSTER_KEY_SEPARATOR + site;
    }
}
