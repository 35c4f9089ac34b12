package io.clusternavigator.api.handlers;

import io.clusternavigator.api.models.responses.ErrorResponse;
import io.clusternavigator.merge.ClusterMergeService;
import io.clusternavigator.models.Cluster;
import io.clusternavigator.models.SiteView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

class SiteHandlerTest {

    @Mock
    private ClusterMergeService mergeService;

    @InjectMocks
    private SiteHandler siteHandler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testGetCombinedSites() {
        List<SiteView> view = List.of(
            SiteView.of("site1", List.of(Cluster.builder().clusterName("ocp4-a").site("site1").build())),
            SiteView.of("site2", List.of()));
        when(mergeService.getCombinedView()).thenReturn(view);

        ResponseEntity<Object> response = siteHandler.getCombinedSites();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(view);
    }

    @Test
    void testGetCombinedSites_Failure() {
        when(mergeService.getCombinedView()).thenThrow(new IllegalStateException("cache unreadable"));

        ResponseEntity<Object> response = siteHandler.getCombinedSites();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(((ErrorResponse) response.getBody()).getReason()).isEqualTo("cache unreadable");
    }
}
