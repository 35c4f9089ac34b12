package io.clusternavigator.api.models.responses;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorResponseTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
    }

    @Test
    void testNotFound_StaticFactory() {
        ErrorResponse response = ErrorResponse.notFound("Cluster 'abc'");

        assertThat(response.getError()).isEqualTo("resource_not_found_exception");
        assertThat(response.getReason()).isEqualTo("Cluster 'abc' not found");
        assertThat(response.getStatus()).isEqualTo(404);
        assertThat(response.getType()).isNull();
    }

    @Test
    void testClientErrorFactories() {
        assertThat(ErrorResponse.badRequest("bad").getStatus()).isEqualTo(400);
        assertThat(ErrorResponse.forbidden("read-only").getStatus()).isEqualTo(403);
        assertThat(ErrorResponse.conflict("taken").getError()).isEqualTo("resource_already_exists_exception");
        assertThat(ErrorResponse.conflict("taken").getStatus()).isEqualTo(409);
    }

    @Test
    void testServerErrorFactories() {
        assertThat(ErrorResponse.internalError("boom").getStatus()).isEqualTo(500);
        ErrorResponse unavailable = ErrorResponse.serviceUnavailable("no cache");
        assertThat(unavailable.getError()).isEqualTo("service_unavailable");
        assertThat(unavailable.getReason()).isEqualTo("no cache");
        assertThat(unavailable.getStatus()).isEqualTo(503);
    }

    @Test
    void testSerialization_OmitsEmptyFields() throws Exception {
        String json = objectMapper.writeValueAsString(ErrorResponse.badRequest("Invalid CIDR"));

        assertThat(json).contains("\"error\":\"bad_request\"");
        assertThat(json).contains("\"reason\":\"Invalid CIDR\"");
        assertThat(json).contains("\"status\":400");
        assertThat(json).doesNotContain("\"type\"");
    }

    @Test
    void testDeserialization_IgnoresUnknownFields() throws Exception {
        String json = """
            {
                "error": "service_unavailable",
                "reason": "VLAN Manager data not yet available",
                "status": 503,
                "retry_after": 30
            }
            """;

        ErrorResponse response = objectMapper.readValue(json, ErrorResponse.class);

        assertThat(response).isEqualTo(ErrorResponse.serviceUnavailable("VLAN Manager data not yet available"));
    }
}
