package io.clusternavigator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusternavigator.enums.ClusterSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Cluster entity, identified by its {@link ClusterKey} (name, site).
 * <p>
 * The same type is cached by the sync cycle, kept by the manual store and returned by the
 * combined view. The view-only fields (id, console URL, creation time) stay null in the cache.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Cluster {

    @JsonProperty("id")
    private String id;

    @JsonProperty("clusterName")
    private String clusterName;

    @JsonProperty("site")
    private String site;

    @JsonProperty("segments")
    @Builder.Default
    private List<String> segments = new ArrayList<>();

    @JsonProperty("domainName")
    private String domainName;

    @JsonProperty("consoleUrl")
    private String consoleUrl;

    @JsonProperty("createdAt")
    private Instant createdAt;

    @JsonProperty("source")
    private ClusterSource source;

    @JsonProperty("loadBalancerIP")
    private List<String> loadBalancerIP; // null until resolved, may hold several round-robin addresses

    @JsonProperty("metadata")
    private ClusterMetadata metadata;

    /**
     * Deep copy, so view copies never alias the cached or stored entity.
     */
    public Cluster copy() {
        return toBuilder()
            .segments(segments != null ? new ArrayList<>(segments) : new ArrayList<>())
            .loadBalancerIP(loadBalancerIP != null ? new ArrayList<>(loadBalancerIP) : null)
            .metadata(metadata != null ? new ClusterMetadata(metadata) : null)
            .build();
    }
}
