package io.clusternavigator.api.handlers;

import io.clusternavigator.api.models.requests.ClusterCreateRequest;
import io.clusternavigator.api.models.responses.ErrorResponse;
import io.clusternavigator.api.models.responses.StatusResponse;
import io.clusternavigator.exceptions.ClusterAlreadyExistsException;
import io.clusternavigator.models.Cluster;
import io.clusternavigator.models.ClusterKey;
import io.clusternavigator.store.ManualClusterStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ClusterHandlerTest {

    @Mock
    private ManualClusterStore manualStore;

    @InjectMocks
    private ClusterHandler clusterHandler;

    private ClusterCreateRequest request;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        request = ClusterCreateRequest.builder()
            .clusterName("ocp4-roi")
            .site("site1")
            .segments(List.of("192.178.1.0/24"))
            .build();
    }

    @Test
    void testCreateCluster_Created() {
        Cluster created = Cluster.builder().id("abc").clusterName("ocp4-roi").site("site1").build();
        when(manualStore.create(any(Cluster.class))).thenReturn(created);

        ResponseEntity<Object> response = clusterHandler.createCluster(request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(response.getBody()).isEqualTo(created);
        ArgumentCaptor<Cluster> draft = ArgumentCaptor.forClass(Cluster.class);
        verify(manualStore).create(draft.capture());
        assertThat(draft.getValue().getClusterName()).isEqualTo("ocp4-roi");
        assertThat(draft.getValue().getSegments()).containsExactly("192.178.1.0/24");
    }

    @Test
    void testCreateCluster_Duplicate() {
        when(manualStore.create(any(Cluster.class)))
            .thenThrow(new ClusterAlreadyExistsException(new ClusterKey("ocp4-roi", "site1")));

        ResponseEntity<Object> response = clusterHandler.createCluster(request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(((ErrorResponse) response.getBody()).getStatus()).isEqualTo(409);
    }

    @Test
    void testCreateCluster_Invalid() {
        when(manualStore.create(any(Cluster.class))).thenThrow(new IllegalArgumentException("bad prefix"));

        ResponseEntity<Object> response = clusterHandler.createCluster(request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(((ErrorResponse) response.getBody()).getReason()).isEqualTo("bad prefix");
    }

    @Test
    void testGetCluster_NotFound() {
        when(manualStore.get("missing")).thenReturn(Optional.empty());

        ResponseEntity<Object> response = clusterHandler.getCluster("missing");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void testGetClusters() {
        List<Cluster> clusters = List.of(Cluster.builder().id("a").build());
        when(manualStore.getAll()).thenReturn(clusters);

        ResponseEntity<Object> response = clusterHandler.getClusters();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(clusters);
    }

    @Test
    void testDeleteCluster_SyncedIsForbidden() {
        ResponseEntity<Object> response = clusterHandler.deleteCluster("vlan-ocp4-a@s1");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        verify(manualStore, never()).delete(anyString());
    }

    @Test
    void testDeleteCluster_Success() {
        when(manualStore.delete("abc")).thenReturn(true);

        ResponseEntity<Object> response = clusterHandler.deleteCluster("abc");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(((StatusResponse) response.getBody()).getStatus()).isEqualTo("success");
    }

    @Test
    void testDeleteCluster_NotFound() {
        when(manualStore.delete("abc")).thenReturn(false);

        ResponseEntity<Object> response = clusterHandler.deleteCluster("abc");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }
}
