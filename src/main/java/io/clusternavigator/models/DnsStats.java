package io.clusternavigator.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of the DNS resolution counters.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DnsStats {

    @JsonProperty("request_count")
    private long requestCount;

    @JsonProperty("success_count")
    private long successCount;

    @JsonProperty("failure_count")
    private long failureCount;

    @JsonProperty("total_time_seconds")
    private double totalTimeSeconds;

    @JsonProperty("average_time_seconds")
    private double averageTimeSeconds;
}
