package io.clusternavigator.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Sorted, distinct site names with their count.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SiteList {

    @JsonProperty("sites")
    private List<String> sites;

    @JsonProperty("count")
    private int count;
}
