package io.clusternavigator.util;

import com.google.common.base.Splitter;
import com.google.common.net.InetAddresses;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.List;

/**
 * Checks network segments in CIDR notation, IPv4 or IPv6. Host bits may be set.
 */
public final class CidrValidator {

    private static final Splitter SLASH = Splitter.on('/').trimResults();

    private CidrValidator() {
    }

    public static boolean isValid(String cidr) {
        if (cidr == null || cidr.isBlank()) {
            return false;
        }
        List<String> parts = SLASH.splitToList(cidr);
        if (parts.size() > 2 || !InetAddresses.isInetAddress(parts.get(0))) {
            return false;
        }
        InetAddress address = InetAddresses.forString(parts.get(0));
        int maxPrefix = address instanceof Inet4Address ? 32 : 128;
        if (parts.size() == 1) {
            return true;
        }
        try {
            int prefix = Integer.parseInt(parts.get(1));
            return prefix >= 0 && prefix <= maxPrefix;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * @throws IllegalArgumentException naming the first invalid segment
     */
    public static void validate(List<String> segments) {
        for (String segment : segments) {
            if (!isValid(segment)) {
                throw new IllegalArgumentException("Invalid CIDR notation in segment '" + segment + "'");
            }
        }
    }
}
