package io.clusternavigator.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Status of the background VLAN sync service and its cache file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncStatus {

    @JsonProperty("service_running")
    private boolean serviceRunning;

    @JsonProperty("sync_interval_seconds")
    private long syncIntervalSeconds;

    @JsonProperty("cache_exists")
    private boolean cacheExists;

    @JsonProperty("cache_age_minutes")
    private Double cacheAgeMinutes;

    @JsonProperty("last_updated")
    private String lastUpdated;

    @JsonProperty("vlan_manager_url")
    private String vlanManagerUrl;
}
