package io.clusternavigator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Network metadata collected from the segments of a cluster.
 * Each list holds distinct values in first-seen order.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterMetadata {

    @JsonProperty("vlan_ids")
    private List<String> vlanIds = new ArrayList<>();

    @JsonProperty("epg_names")
    private List<String> epgNames = new ArrayList<>();

    @JsonProperty("vrfs")
    private List<String> vrfs = new ArrayList<>();

    public ClusterMetadata(ClusterMetadata other) {
        this.vlanIds = new ArrayList<>(other.getVlanIds());
        this.epgNames = new ArrayList<>(other.getEpgNames());
        this.vrfs = new ArrayList<>(other.getVrfs());
    }

    public void addVlanId(String vlanId) {
        addDistinct(vlanIds, vlanId);
    }

    public void addEpgName(String epgName) {
        addDistinct(epgNames, epgName);
    }

    public void addVrf(String vrf) {
        addDistinct(vrfs, vrf);
    }

    private static void addDistinct(List<String> values, String value) {
        if (value != null && !value.isEmpty() && !values.contains(value)) {
            values.add(value);
        }
    }
}
