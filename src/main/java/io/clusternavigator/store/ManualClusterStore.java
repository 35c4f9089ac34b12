package io.clusternavigator.store;

import io.clusternavigator.exceptions.ClusterAlreadyExistsException;
import io.clusternavigator.models.Cluster;

import java.util.List;
import java.util.Optional;

/**
 * Store of operator-entered clusters. Keys (name, site) are unique within the store.
 * Implementations hand out copies, never their own entities.
 */
public interface ManualClusterStore {

    /**
     * Validate and store a new cluster.
     *
     * @param draft cluster name, site, segments and optionally domain and load balancer addresses
     * @return the stored cluster with id, console URL and creation time filled in
     * @throws IllegalArgumentException if the draft is invalid
     * @throws ClusterAlreadyExistsException if the (name, site) key is taken
     */
    Cluster create(Cluster draft);

    Optional<Cluster> get(String id);

    /**
     * All clusters in creation order.
     */
    List<Cluster> getAll();

    boolean delete(String id);

    boolean exists(String clusterName, String site);
}
