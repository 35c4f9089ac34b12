package io.clusternavigator.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of an action endpoint, optionally carrying the resulting data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusResponse {

    @JsonProperty("status")
    private String status;

    @JsonProperty("message")
    private String message;

    @JsonProperty("data")
    private Object data;

    public static StatusResponse success(String message) {
        return success(message, null);
    }

    public static StatusResponse success(String message, Object data) {
        return StatusResponse.builder()
            .status("success")
            .message(message)
            .data(data)
            .build();
    }
}
