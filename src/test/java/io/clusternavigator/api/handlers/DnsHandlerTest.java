package io.clusternavigator.api.handlers;

import io.clusternavigator.dns.LoadBalancerResolver;
import io.clusternavigator.models.DnsStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class DnsHandlerTest {

    @Mock
    private LoadBalancerResolver resolver;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testGetStats() {
        DnsStats stats = new DnsStats(4, 3, 1, 0.4, 0.1);
        when(resolver.getStats()).thenReturn(stats);

        ResponseEntity<Object> response = new DnsHandler(resolver).getStats();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(stats);
    }

    @Test
    void testResetStats() {
        ResponseEntity<Object> response = new DnsHandler(resolver).resetStats();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        verify(resolver).resetStats();
    }
}
