package io.clusternavigator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw network segment record as returned by the VLAN Manager API.
 * The cluster name field may carry several comma separated names when clusters share a segment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Segment {

    @JsonProperty("segment")
    private String segment; // CIDR, e.g. "10.0.0.0/24"

    @JsonProperty("site")
    private String site;

    @JsonProperty("cluster_name")
    private String clusterName;

    @JsonProperty("released")
    private boolean released;

    @JsonProperty("vlan_id")
    private String vlanId;

    @JsonProperty("epg_name")
    private String epgName;

    @JsonProperty("vrf")
    private String vrf;
}
