package io.clusternavigator.config;

import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.*;
import static io.clusternavigator.config.Constants.*;

/**
 * Tests for Constants.
 */
class ConstantsTest {

    @Test
    void testDefaultConfigurationConstants() {
        assertThat(DEFAULT_VLAN_MANAGER_URL).isEqualTo("http://0.0.0.0:9000/api");
        assertThat(DEFAULT_SYNC_INTERVAL_SECONDS).isEqualTo(300L);
        assertThat(DEFAULT_DNS_RESOLUTION_PATH)
            .contains(PLACEHOLDER_CLUSTER_NAME)
            .contains(PLACEHOLDER_DOMAIN_NAME);
        assertThat(DEFAULT_CLUSTER_PREFIX).isEqualTo("ocp4-");
    }

    @Test
    void testCacheRetryConstants() {
        assertThat(CACHE_TEMP_SUFFIX).isEqualTo(".tmp");
        assertThat(CACHE_WRITE_MAX_RETRIES).isGreaterThan(CACHE_READ_MAX_RETRIES);
        assertThat(CACHE_WRITE_RETRY_DELAY_MILLIS).isEqualTo(200L);
        assertThat(CACHE_READ_RETRY_DELAY_MILLIS).isEqualTo(100L);
    }

    @Test
    void testSyncedIdConstants() {
        assertThat(SYNCED_CLUSTER_ID_PREFIX + "ocp4-a" + CLUSTER_KEY_SEPARATOR + "site1")
            .isEqualTo("vlan-ocp4-a@site1");
    }
}
