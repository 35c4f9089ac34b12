package io.clusternavigator.util;

import lombok.Getter;

/**
 * Validates and normalizes cluster names against the required name prefix.
 */
@Getter
public class ClusterNameValidator {

    private final String prefix;

    public ClusterNameValidator(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Cluster name prefix cannot be null or empty");
        }
        this.prefix = prefix.trim().toLowerCase();
    }

    /**
     * Lowercase and trim a cluster name.
     */
    public static String normalize(String clusterName) {
        return clusterName == null ? null : clusterName.trim().toLowerCase();
    }

    /**
     * Normalize a cluster name and check the prefix.
     *
     * @return the normalized name
     * @throws IllegalArgumentException if the name is empty or lacks the prefix
     */
    public String validate(String clusterName) {
        String normalized = normalize(clusterName);
        if (normalized == null || normalized.isEmpty()) {
            throw new IllegalArgumentException("Cluster name cannot be null or empty");
        }
        if (!normalized.startsWith(prefix)) {
            throw new IllegalArgumentException(
                "Cluster name '" + clusterName + "' must start with '" + prefix + "' prefix");
        }
        return normalized;
    }

    public boolean isValid(String clusterName) {
        try {
            validate(clusterName);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
