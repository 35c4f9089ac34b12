package io.clusternavigator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * On-disk layout of the VLAN cache file.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CacheEnvelope {

    @JsonProperty("last_updated")
    private Instant lastUpdated;

    @JsonProperty("data")
    private SyncDataset data;
}
