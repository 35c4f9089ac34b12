package io.clusternavigator.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Provenance of a cluster entity.
 *
 * <ul>
 *   <li><strong>SYNCED</strong> - built from VLAN Manager segments by the sync cycle</li>
 *   <li><strong>MANUAL</strong> - entered by an operator into the manual cluster store</li>
 * </ul>
 */
public enum ClusterSource {
    SYNCED("synced"),
    MANUAL("manual");

    private final String value;

    ClusterSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ClusterSource fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (ClusterSource source : values()) {
            if (source.value.equalsIgnoreCase(value.trim()) || source.name().equalsIgnoreCase(value.trim())) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown cluster source: " + value);
    }
}
