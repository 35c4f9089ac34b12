package io.clusternavigator.api.models.requests;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusternavigator.models.Cluster;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body for registering a manual cluster.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterCreateRequest {

    @JsonProperty("clusterName")
    private String clusterName;

    @JsonProperty("site")
    private String site;

    @JsonProperty("segments")
    private List<String> segments;

    @JsonProperty("domainName")
    private String domainName;

    // Accepts a single address or a list
    @JsonProperty("loadBalancerIP")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> loadBalancerIP;

    public Cluster toDraft() {
        return Cluster.builder()
            .clusterName(clusterName)
            .site(site)
            .segments(segments != null ? new ArrayList<>(segments) : null)
            .domainName(domainName)
            .loadBalancerIP(loadBalancerIP)
            .build();
    }
}
