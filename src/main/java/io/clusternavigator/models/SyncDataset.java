package io.clusternavigator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Materialized result of one sync cycle: clusters, known sites and summary counts.
 * An empty dataset carries no stats.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncDataset {

    @JsonProperty("clusters")
    private List<Cluster> clusters = new ArrayList<>();

    @JsonProperty("sites")
    private List<String> sites = new ArrayList<>();

    @JsonProperty("stats")
    private SyncStats stats;

    public static SyncDataset empty() {
        return new SyncDataset(new ArrayList<>(), new ArrayList<>(), null);
    }
}
