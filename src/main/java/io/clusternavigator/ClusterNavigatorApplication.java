package io.clusternavigator;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.clusternavigator.config.NavigatorConfig;
import io.clusternavigator.dns.AddressLookup;
import io.clusternavigator.dns.DnsjavaAddressLookup;
import io.clusternavigator.dns.LoadBalancerResolver;
import io.clusternavigator.merge.ClusterMergeService;
import io.clusternavigator.metrics.MetricsProvider;
import io.clusternavigator.store.InMemoryManualClusterStore;
import io.clusternavigator.store.ManualClusterStore;
import io.clusternavigator.store.VlanCacheStore;
import io.clusternavigator.util.ClusterNameValidator;
import io.clusternavigator.util.ConsoleUrlGenerator;
import io.clusternavigator.vlan.SegmentTransformer;
import io.clusternavigator.vlan.VlanManagerClient;
import io.clusternavigator.vlan.VlanSyncOrchestrator;
import io.clusternavigator.vlan.VlanSyncStatusService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.nio.file.Paths;
import java.time.Duration;

/**
 * Main Spring Boot application class for the Cluster Navigator.
 *
 * Keeps a cached copy of the clusters known to VLAN Manager, refreshed in the background,
 * and serves it merged with manually registered clusters through REST APIs.
 */
@Slf4j
@SpringBootApplication
public class ClusterNavigatorApplication {

    public static void main(String[] args) {
        log.info("Starting Cluster Navigator Application");

        try {
            SpringApplication.run(ClusterNavigatorApplication.class, args);
            log.info("Cluster Navigator started successfully");
        } catch (Exception e) {
            log.error("Failed to start Cluster Navigator: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public NavigatorConfig config() {
        NavigatorConfig config = new NavigatorConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    public ClusterNameValidator clusterNameValidator(NavigatorConfig config) {
        return new ClusterNameValidator(config.getClusterPrefix());
    }

    @Bean
    public ConsoleUrlGenerator consoleUrlGenerator(NavigatorConfig config) {
        return new ConsoleUrlGenerator(config.getDefaultDomain());
    }

    @Bean
    public VlanManagerClient vlanManagerClient(NavigatorConfig config, ObjectMapper objectMapper) {
        log.info("Initializing VlanManagerClient for {}", config.getVlanManagerUrl());
        return new VlanManagerClient(config.getVlanManagerUrl(), config.isInsecureTlsVerify(),
            Duration.ofSeconds(config.getHttpTimeoutSeconds()), objectMapper);
    }

    @Bean
    public SegmentTransformer segmentTransformer(ClusterNameValidator clusterNameValidator, NavigatorConfig config) {
        return new SegmentTransformer(clusterNameValidator, config.getDefaultDomain());
    }

    @Bean
    public AddressLookup addressLookup(NavigatorConfig config) {
        log.info("Initializing DNS lookups against {}", config.getDnsServer());
        try {
            return new DnsjavaAddressLookup(config.getDnsServer(),
                Duration.ofMillis(Math.round(config.getDnsTimeoutSeconds() * 1000)));
        } catch (Exception e) {
            log.error("Failed to initialize DNS resolver for {}: {}", config.getDnsServer(), e.getMessage(), e);
            throw new RuntimeException("DNS resolver initialization failed", e);
        }
    }

    @Bean
    public LoadBalancerResolver loadBalancerResolver(AddressLookup addressLookup, NavigatorConfig config,
                                                     MetricsProvider metricsProvider) {
        return new LoadBalancerResolver(addressLookup, config.getDnsResolutionPath(), config.getDefaultDomain(),
            metricsProvider);
    }

    @Bean
    public VlanCacheStore vlanCacheStore(NavigatorConfig config) {
        return new VlanCacheStore(Paths.get(config.getCacheFile()));
    }

    @Bean
    public ManualClusterStore manualClusterStore(ClusterNameValidator clusterNameValidator,
                                                 ConsoleUrlGenerator consoleUrlGenerator, NavigatorConfig config) {
        log.info("Initializing in-memory manual cluster store");
        return new InMemoryManualClusterStore(clusterNameValidator, consoleUrlGenerator, config.getDefaultDomain());
    }

    /**
     * Sync orchestrator bean. Starts the background sync loop at creation and closes it on shutdown.
     */
    @Bean(destroyMethod = "close")
    public VlanSyncOrchestrator vlanSyncOrchestrator(VlanManagerClient client, SegmentTransformer transformer,
                                                     LoadBalancerResolver resolver, VlanCacheStore cacheStore,
                                                     MetricsProvider metricsProvider, NavigatorConfig config) {
        VlanSyncOrchestrator orchestrator = new VlanSyncOrchestrator(client, transformer, resolver, cacheStore,
            metricsProvider, config.getSyncIntervalSeconds());
        orchestrator.start();
        log.info("VlanSyncOrchestrator started with background sync every {}s", config.getSyncIntervalSeconds());
        return orchestrator;
    }

    @Bean
    public VlanSyncStatusService vlanSyncStatusService(VlanSyncOrchestrator orchestrator, VlanCacheStore cacheStore) {
        return new VlanSyncStatusService(orchestrator, cacheStore);
    }

    @Bean
    public ClusterMergeService clusterMergeService(VlanSyncOrchestrator orchestrator, ManualClusterStore manualStore,
                                                   LoadBalancerResolver resolver,
                                                   ConsoleUrlGenerator consoleUrlGenerator) {
        return new ClusterMergeService(orchestrator, manualStore, resolver, consoleUrlGenerator);
    }
}
