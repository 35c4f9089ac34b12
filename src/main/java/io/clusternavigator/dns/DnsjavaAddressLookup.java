package io.clusternavigator.dns;

import lombok.extern.slf4j.Slf4j;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.SimpleResolver;
import org.xbill.DNS.Type;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link AddressLookup} backed by dnsjava, querying one configured server without caching answers.
 */
@Slf4j
public class DnsjavaAddressLookup implements AddressLookup {

    private final SimpleResolver resolver;
    private final String server;

    public DnsjavaAddressLookup(String server, Duration timeout) throws UnknownHostException {
        this(new SimpleResolver(server), server, timeout);
    }

    /**
     * Query a server on a non-default port.
     */
    public DnsjavaAddressLookup(InetSocketAddress server, Duration timeout) {
        this(new SimpleResolver(server), server.getHostString() + ":" + server.getPort(), timeout);
    }

    private DnsjavaAddressLookup(SimpleResolver resolver, String server, Duration timeout) {
        this.server = server;
        this.resolver = resolver;
        this.resolver.setTimeout(timeout);
        log.info("DNS lookups go to {} with a {} ms timeout", server, timeout.toMillis());
    }

    @Override
    public List<String> lookup(String hostname) throws IOException {
        Lookup lookup = new Lookup(Name.fromString(hostname, Name.root), Type.A);
        lookup.setResolver(resolver);
        lookup.setCache(null);
        Record[] records = lookup.run();

        switch (lookup.getResult()) {
            case Lookup.SUCCESSFUL:
                List<String> addresses = new ArrayList<>();
                for (Record record : records) {
                    if (record instanceof ARecord) {
                        addresses.add(((ARecord) record).getAddress().getHostAddress());
                    }
                }
                return addresses;
            case Lookup.HOST_NOT_FOUND:
            case Lookup.TYPE_NOT_FOUND:
                return new ArrayList<>();
            case Lookup.TRY_AGAIN:
                throw new SocketTimeoutException("DNS server " + server + " did not answer for " + hostname
                    + ": " + lookup.getErrorString());
            default:
                throw new IOException("DNS lookup of " + hostname + " failed: " + lookup.getErrorString());
        }
    }
}
