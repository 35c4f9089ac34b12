package io.clusternavigator.dns;

import java.io.IOException;
import java.util.List;

/**
 * A-record lookup against a DNS server.
 */
public interface AddressLookup {

    /**
     * Look up the IPv4 addresses of a host name.
     *
     * @param hostname fully qualified host name
     * @return every address in the answer, empty when the name does not exist or has no A records
     * @throws IOException on timeouts and resolver errors
     */
    List<String> lookup(String hostname) throws IOException;
}
