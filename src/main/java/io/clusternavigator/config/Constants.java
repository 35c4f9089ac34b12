package io.clusternavigator.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_VLAN_MANAGER_URL = "http://0.0.0.0:9000/api";
    public static final long DEFAULT_SYNC_INTERVAL_SECONDS = 300L;
    public static final long DEFAULT_HTTP_TIMEOUT_SECONDS = 10L;
    public static final String DEFAULT_DNS_SERVER = "8.8.8.8";
    public static final double DEFAULT_DNS_TIMEOUT_SECONDS = 2.0;
    public static final String DEFAULT_DNS_RESOLUTION_PATH = "api.{cluster_name}.{domain_name}";
    public static final String DEFAULT_DOMAIN = "example.com";
    public static final String DEFAULT_CLUSTER_PREFIX = "ocp4-";
    public static final String DEFAULT_CACHE_FILE = "data/vlan_cache.json";

    // VLAN Manager endpoints (relative to the configured base URL)
    public static final String ENDPOINT_SEGMENTS = "/segments";
    public static final String ENDPOINT_SITES = "/sites";
    public static final String PARAM_ALLOCATED = "allocated";

    // DNS resolution template placeholders
    public static final String PLACEHOLDER_CLUSTER_NAME = "{cluster_name}";
    public static final String PLACEHOLDER_DOMAIN_NAME = "{domain_name}";

    // Console URL
    public static final String CONSOLE_URL_PREFIX = "https://console-openshift-console.apps.";

    // Synced cluster ids are derived from the composite key
    public static final String SYNCED_CLUSTER_ID_PREFIX = "vlan-";
    public static final String CLUSTER_KEY_SEPARATOR = "@";

    // Cache file handling
    public static final String CACHE_TEMP_SUFFIX = ".tmp";
    public static final int CACHE_WRITE_MAX_RETRIES = 5;
    public static final long CACHE_WRITE_RETRY_DELAY_MILLIS = 200L;
    public static final int CACHE_READ_MAX_RETRIES = 3;
    public static final long CACHE_READ_RETRY_DELAY_MILLIS = 100L;

    // Sync fetch pool
    public static final int SYNC_FETCH_POOL_SIZE = 2;
}
