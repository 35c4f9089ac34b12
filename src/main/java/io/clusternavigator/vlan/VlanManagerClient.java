package io.clusternavigator.vlan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clusternavigator.models.Segment;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import java.net.ConnectException;
import java.net.Socket;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static io.clusternavigator.config.Constants.ENDPOINT_SEGMENTS;
import static io.clusternavigator.config.Constants.ENDPOINT_SITES;
import static io.clusternavigator.config.Constants.PARAM_ALLOCATED;

/**
 * HTTP client for the VLAN Manager API.
 * <p>
 * Every call is a single GET with a bounded timeout. Transport errors, timeouts, non-2xx
 * statuses and undecodable bodies are logged and reported as an absent payload, never thrown.
 */
@Slf4j
public class VlanManagerClient {

    private final String baseUrl;
    private final Duration timeout;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public VlanManagerClient(String baseUrl, boolean insecureTls, Duration timeout, ObjectMapper objectMapper) {
        if (baseUrl == null || baseUrl.trim().isEmpty()) {
            throw new IllegalArgumentException("VLAN Manager URL cannot be null or empty");
        }
        this.baseUrl = baseUrl.trim();
        this.timeout = timeout;
        this.objectMapper = objectMapper;

        HttpClient.Builder builder = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL);
        if (insecureTls) {
            log.warn("TLS certificate verification is disabled for VLAN Manager at {}", this.baseUrl);
            builder.sslContext(insecureSslContext());
        }
        this.httpClient = builder.build();
    }

    /**
     * Fetch JSON from a VLAN Manager endpoint.
     *
     * @param endpoint endpoint path relative to the base URL (e.g. "/sites")
     * @param params optional query parameters, may be null
     * @return the decoded payload, or empty when the service is unavailable
     */
    public Optional<JsonNode> fetch(String endpoint, Map<String, String> params) {
        String fullUrl = baseUrl + endpoint + toQueryString(params);
        try {
            log.debug("Attempting to fetch from: {}", fullUrl);

            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(fullUrl))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.error("Failed to fetch from {}: HTTP {}", endpoint, response.statusCode());
                return Optional.empty();
            }

            JsonNode payload = objectMapper.readTree(response.body());
            log.debug("Successfully fetched from {}", endpoint);
            return Optional.ofNullable(payload);

        } catch (ConnectException e) {
            log.error("Connection error to {}: {}. Check if VLAN Manager is running at {}",
                endpoint, e.getMessage(), baseUrl);
            return Optional.empty();
        } catch (HttpTimeoutException e) {
            log.error("Timeout fetching from {}: {}", endpoint, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while fetching from {}", endpoint);
            return Optional.empty();
        } catch (Exception e) {
            log.error("Failed to fetch from {}: {}: {}", endpoint, e.getClass().getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Fetch allocated (non-released) segments. Degrades to an empty list.
     */
    public List<Segment> fetchAllocatedSegments() {
        Optional<JsonNode> payload = fetch(ENDPOINT_SEGMENTS, Map.of(PARAM_ALLOCATED, "true"));
        if (payload.isEmpty()) {
            return new ArrayList<>();
        }
        if (!payload.get().isArray()) {
            log.error("Unexpected payload from {}: expected a JSON array", ENDPOINT_SEGMENTS);
            return new ArrayList<>();
        }

        List<Segment> segments = new ArrayList<>();
        for (JsonNode node : payload.get()) {
            try {
                segments.add(objectMapper.treeToValue(node, Segment.class));
            } catch (Exception e) {
                log.debug("Skipping undecodable segment record: {}", e.getMessage());
            }
        }
        return segments;
    }

    /**
     * Fetch the site names known to VLAN Manager. Degrades to an empty list.
     */
    public List<String> fetchSites() {
        Optional<JsonNode> payload = fetch(ENDPOINT_SITES, null);
        List<String> sites = new ArrayList<>();
        JsonNode siteNodes = payload.map(node -> node.get("sites")).orElse(null);
        if (siteNodes != null && siteNodes.isArray()) {
            for (JsonNode site : siteNodes) {
                if (site.isTextual()) {
                    sites.add(site.asText());
                }
            }
        }
        return sites;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    private static String toQueryString(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        return params.entrySet().stream()
            .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&", "?", ""));
    }

    private static SSLContext insecureSslContext() {
        try {
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, new TrustManager[]{new TrustAllManager()}, new SecureRandom());
            return sslContext;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to initialize insecure TLS context", e);
        }
    }

    /**
     * Accepts every server certificate and skips hostname identification.
     */
    private static final class TrustAllManager extends X509ExtendedTrustManager {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
