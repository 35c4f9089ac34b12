package io.clusternavigator.api.models.responses;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body returned by every navigator endpoint. {@code status} mirrors the HTTP status code.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ErrorResponse {
    private String error;
    private String type;
    private String reason;
    private Integer status;

    public static ErrorResponse notFound(String resource) {
        return of("resource_not_found_exception", resource + " not found", 404);
    }

    public static ErrorResponse badRequest(String message) {
        return of("bad_request", message, 400);
    }

    /** Used for attempts to modify read-only synced clusters. */
    public static ErrorResponse forbidden(String message) {
        return of("forbidden", message, 403);
    }

    /** A manual cluster with the same name already exists at the site. */
    public static ErrorResponse conflict(String message) {
        return of("resource_already_exists_exception", message, 409);
    }

    public static ErrorResponse internalError(String message) {
        return of("internal_server_error", message, 500);
    }

    /** No synced data has been cached yet. */
    public static ErrorResponse serviceUnavailable(String message) {
        return of("service_unavailable", message, 503);
    }

    private static ErrorResponse of(String error, String reason, int status) {
        return ErrorResponse.builder().error(error).reason(reason).status(status).build();
    }
}
