package io.clusternavigator.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One site of the combined view with its clusters.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SiteView {

    @JsonProperty("site")
    private String site;

    @JsonProperty("clusterCount")
    private int clusterCount;

    @JsonProperty("clusters")
    private List<Cluster> clusters;

    public static SiteView of(String site, List<Cluster> clusters) {
        return new SiteView(site, clusters.size(), clusters);
    }
}
