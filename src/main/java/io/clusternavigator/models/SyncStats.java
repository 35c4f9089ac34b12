package io.clusternavigator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary counts of one synchronized dataset.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncStats {

    @JsonProperty("total_clusters")
    private int totalClusters;

    @JsonProperty("total_sites")
    private int totalSites;

    @JsonProperty("total_segments")
    private int totalSegments;
}
