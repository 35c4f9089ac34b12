package io.clusternavigator.exceptions;

import io.clusternavigator.models.ClusterKey;
import lombok.Getter;

/**
 * Thrown when a manual cluster is created with a (name, site) key that is already taken.
 */
@Getter
public class ClusterAlreadyExistsException extends RuntimeException {

    private final ClusterKey key;

    public ClusterAlreadyExistsException(ClusterKey key) {
        super("Cluster '" + key.clusterName() + "' already exists in site '" + key.site() + "'");
        this.key = key;
    }
}
