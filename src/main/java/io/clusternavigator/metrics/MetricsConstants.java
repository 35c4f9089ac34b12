package io.clusternavigator.metrics;

/**
 * Constants for metrics names and tags used in the Cluster Navigator.
 */
public class MetricsConstants {
    public final static String VLAN_SYNC_CYCLES_METRIC_NAME = "vlan_sync_cycles";
    public final static String VLAN_SYNC_DURATION_METRIC_NAME = "vlan_sync_duration";
    public final static String VLAN_SYNCED_CLUSTERS_METRIC_NAME = "vlan_synced_clusters";
    public final static String DNS_LOOKUP_METRIC_NAME = "dns_lookup";
    public final static String RESULT_TAG = "result";
    public final static String OUTCOME_TAG = "outcome";

    public final static String RESULT_SUCCESS = "success";
    public final static String RESULT_FALLBACK = "fallback";
    public final static String RESULT_EMPTY = "empty";
    public final static String RESULT_ERROR = "error";

    public final static String OUTCOME_RESOLVED = "resolved";
    public final static String OUTCOME_UNRESOLVED = "unresolved";
    public final static String OUTCOME_ERROR = "error";

    private MetricsConstants() {}
}
