package io.clusternavigator.config;

import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import static io.clusternavigator.config.Constants.*;

/**
 * Configuration for the cluster navigator.
 * Loads configuration from application.yml with fallbacks to constants.
 * <p>
 * The file location can be overridden through the NAVIGATOR_CONFIG_FILE environment variable.
 */
@Slf4j
@Getter
public class NavigatorConfig {

    private final String vlanManagerUrl;
    private final long syncIntervalSeconds;
    private final boolean insecureTlsVerify;
    private final long httpTimeoutSeconds;
    private final String dnsServer;
    private final double dnsTimeoutSeconds;
    private final String dnsResolutionPath;
    private final String defaultDomain;
    private final String clusterPrefix;
    private final String cacheFile;

    private static final String CLASSPATH_CONFIG_FILE = "application.yml";
    private static final String CONFIG_FILE_ENV_VAR = "NAVIGATOR_CONFIG_FILE";

    public NavigatorConfig() {
        this(loadYamlConfig(System.getenv(CONFIG_FILE_ENV_VAR)));
    }

    public NavigatorConfig(ConfigModel config) {
        ConfigModel model = config != null ? config : new ConfigModel();

        this.vlanManagerUrl = parseVlanManagerUrl(model);
        this.syncIntervalSeconds = parseSyncIntervalSeconds(model);
        this.insecureTlsVerify = parseInsecureTlsVerify(model);
        this.httpTimeoutSeconds = parseHttpTimeoutSeconds(model);
        this.dnsServer = parseDnsServer(model);
        this.dnsTimeoutSeconds = parseDnsTimeoutSeconds(model);
        this.dnsResolutionPath = parseDnsResolutionPath(model);
        this.defaultDomain = parseDefaultDomain(model);
        this.clusterPrefix = parseClusterPrefix(model);
        this.cacheFile = parseCacheFile(model);

        log.info("Loaded navigator config - VLAN Manager: {}, sync interval: {}s, DNS server: {}, cache: {}",
                vlanManagerUrl, syncIntervalSeconds, dnsServer, cacheFile);
    }

    /**
     * Read the YAML model from the given file, or from the classpath when the file is unset or missing.
     * A document that cannot be parsed yields an empty model so every value takes its default.
     */
    static ConfigModel loadYamlConfig(String externalConfigPath) {
        Path externalFile = resolveExternalFile(externalConfigPath);
        String source = externalFile != null
                ? "file " + externalFile
                : "classpath resource " + CLASSPATH_CONFIG_FILE;

        try (InputStream in = externalFile != null
                ? Files.newInputStream(externalFile)
                : NavigatorConfig.class.getClassLoader().getResourceAsStream(CLASSPATH_CONFIG_FILE)) {
            if (in == null) {
                log.warn("No configuration found at {}, using defaults", source);
                return new ConfigModel();
            }
            Yaml yaml = new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
            ConfigModel model = yaml.load(in);
            log.info("Read configuration from {}", source);
            return model != null ? model : new ConfigModel();
        } catch (IOException | YAMLException e) {
            log.warn("Cannot read configuration from {} ({}), using defaults", source, e.getMessage());
            return new ConfigModel();
        }
    }

    private static Path resolveExternalFile(String externalConfigPath) {
        if (externalConfigPath == null || externalConfigPath.isBlank()) {
            log.debug("{} not set", CONFIG_FILE_ENV_VAR);
            return null;
        }
        Path path = Paths.get(externalConfigPath.trim());
        if (!Files.isRegularFile(path)) {
            log.warn("{} points to {}, which is not a file; falling back to the classpath", CONFIG_FILE_ENV_VAR, path);
            return null;
        }
        return path;
    }

    private String parseVlanManagerUrl(ConfigModel config) {
        VlanManager vlanManager = config.getVlan_manager();
        if (vlanManager != null && vlanManager.getUrl() != null && !vlanManager.getUrl().isBlank()) {
            String url = vlanManager.getUrl().trim();
            // Endpoints are appended with a leading slash
            return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        }
        return DEFAULT_VLAN_MANAGER_URL;
    }

    private long parseSyncIntervalSeconds(ConfigModel config) {
        VlanManager vlanManager = config.getVlan_manager();
        if (vlanManager != null && vlanManager.getSync_interval_seconds() != null) {
            if (vlanManager.getSync_interval_seconds() > 0) {
                return vlanManager.getSync_interval_seconds();
            }
            log.warn("Invalid sync interval {}s, using default: {}s",
                    vlanManager.getSync_interval_seconds(), DEFAULT_SYNC_INTERVAL_SECONDS);
        }
        return DEFAULT_SYNC_INTERVAL_SECONDS;
    }

    private boolean parseInsecureTlsVerify(ConfigModel config) {
        VlanManager vlanManager = config.getVlan_manager();
        return vlanManager != null && Boolean.TRUE.equals(vlanManager.getInsecure_tls_verify());
    }

    private long parseHttpTimeoutSeconds(ConfigModel config) {
        VlanManager vlanManager = config.getVlan_manager();
        if (vlanManager != null && vlanManager.getTimeout_seconds() != null && vlanManager.getTimeout_seconds() > 0) {
            return vlanManager.getTimeout_seconds();
        }
        return DEFAULT_HTTP_TIMEOUT_SECONDS;
    }

    private String parseDnsServer(ConfigModel config) {
        Dns dns = config.getDns();
        if (dns != null && dns.getServer() != null && !dns.getServer().isBlank()) {
            return dns.getServer().trim();
        }
        return DEFAULT_DNS_SERVER;
    }

    private double parseDnsTimeoutSeconds(ConfigModel config) {
        Dns dns = config.getDns();
        if (dns != null && dns.getTimeout_seconds() != null) {
            if (dns.getTimeout_seconds() > 0) {
                return dns.getTimeout_seconds();
            }
            log.warn("Invalid DNS timeout {}s, using default: {}s", dns.getTimeout_seconds(), DEFAULT_DNS_TIMEOUT_SECONDS);
        }
        return DEFAULT_DNS_TIMEOUT_SECONDS;
    }

    private String parseDnsResolutionPath(ConfigModel config) {
        Dns dns = config.getDns();
        if (dns != null && dns.getResolution_path() != null && !dns.getResolution_path().isBlank()) {
            return dns.getResolution_path().trim();
        }
        return DEFAULT_DNS_RESOLUTION_PATH;
    }

    private String parseDefaultDomain(ConfigModel config) {
        Cluster cluster = config.getCluster();
        if (cluster != null && cluster.getDefault_domain() != null && !cluster.getDefault_domain().isBlank()) {
            return cluster.getDefault_domain().trim();
        }
        return DEFAULT_DOMAIN;
    }

    private String parseClusterPrefix(ConfigModel config) {
        Cluster cluster = config.getCluster();
        if (cluster != null && cluster.getName_prefix() != null && !cluster.getName_prefix().isBlank()) {
            return cluster.getName_prefix().trim().toLowerCase();
        }
        return DEFAULT_CLUSTER_PREFIX;
    }

    private String parseCacheFile(ConfigModel config) {
        Cache cache = config.getCache();
        if (cache != null && cache.getFile() != null && !cache.getFile().isBlank()) {
            return cache.getFile().trim();
        }
        return DEFAULT_CACHE_FILE;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Server server; // Spring server settings, read by Spring itself
        private Navigator navigator; // Instance settings (used by Spring @Value)
        private VlanManager vlan_manager;
        private Dns dns;
        private Cluster cluster;
        private Cache cache;
        private Map<String, Object> management; // Spring Boot actuator settings, read by Spring itself
    }

    @Data
    public static class Server {
        private Integer port;
    }

    @Data
    public static class Navigator {
        private String id;
    }

    @Data
    public static class VlanManager {
        private String url;
        private Long sync_interval_seconds;
        private Boolean insecure_tls_verify;
        private Long timeout_seconds;
    }

    @Data
    public static class Dns {
        private String server;
        private Double timeout_seconds;
        private String resolution_path;
    }

    @Data
    public static class Cluster {
        private String default_domain;
        private String name_prefix;
    }

    @Data
    public static class Cache {
        private String file;
    }
}
