package io.clusternavigator.util;

import static io.clusternavigator.config.Constants.CONSOLE_URL_PREFIX;

/**
 * Builds OpenShift console URLs for clusters.
 */
public class ConsoleUrlGenerator {

    private final String defaultDomain;

    public ConsoleUrlGenerator(String defaultDomain) {
        this.defaultDomain = defaultDomain;
    }

    public String consoleUrl(String clusterName, String domainName) {
        String domain = domainName != null && !domainName.isBlank() ? domainName : defaultDomain;
        return CONSOLE_URL_PREFIX + ClusterNameValidator.normalize(clusterName) + "." + domain;
    }
}
