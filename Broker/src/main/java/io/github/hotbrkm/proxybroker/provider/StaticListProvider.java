package io.github.hotbrkm.proxybroker.provider;

import io.github.hotbrkm.proxybroker.config.ProviderConfig;
import io.github.hotbrkm.proxybroker.config.ProxyConfigurationException;
import io.github.hotbrkm.proxybroker.endpoint.IpVersion;
import io.github.hotbrkm.proxybroker.endpoint.ProxyAddress;
import io.github.hotbrkm.proxybroker.endpoint.ProxyEndpoint;
import io.github.hotbrkm.proxybroker.endpoint.ProxyType;
import io.github.hotbrkm.proxybroker.endpoint.RotationType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cycles through a fixed, pre-parsed pool of endpoints (round-robin).
 * <p>
 * Options:
 * <ul>
 *   <li>{@code entries} - comma or newline separated proxy lines (see {@link ProxyAddress})</li>
 *   <li>{@code scheme} - default scheme, http</li>
 *   <li>{@code proxy_type} - default datacenter</li>
 *   <li>{@code ip_version} - default ipv4</li>
 *   <li>{@code rotation_type} - default sticky</li>
 *   <li>{@code region} - optional region code stamped on every endpoint</li>
 * </ul>
 * The cursor is advanced with a single atomic increment, so two concurrent acquisitions never
 * observe the same index before the pool wraps.
 */
@Slf4j
public class StaticListProvider implements ProxyProvider {

    private final ProviderConfig config;
    private final List<ProxyEndpoint> pool;
    private final AtomicLong cursor = new AtomicLong(0);

    public StaticListProvider(ProviderConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.pool = parsePool(config);
        if (pool.isEmpty()) {
            throw new ProxyConfigurationException("Static list provider " + config.name() + " requires at least one proxy entry");
        }
        log.info("Initialized static list provider. name={}, entries={}, type={}, ipVersion={}",
                config.name(), pool.size(), pool.get(0).proxyType().value(), pool.get(0).ipVersion().value());
    }

    @Override
    public ProviderConfig config() {
        return config;
    }

    @Override
    public ProxyEndpoint acquire(String region, String purpose) {
        long index = cursor.getAndIncrement();
        ProxyEndpoint endpoint = pool.get((int) Math.floorMod(index, (long) pool.size()));
        log.debug("Static endpoint acquired. provider={}, index={}, endpoint={}, purpose={}",
                config.name(), index, endpoint.address(), purpose == null ? "general" : purpose);
        return endpoint;
    }

    public int size() {
        return pool.size();
    }

    /**
     * Number of acquisitions served so far; the next acquisition uses this index modulo the pool size.
     */
    public long position() {
        return cursor.get();
    }

    public List<ProxyEndpoint> entries() {
        return pool;
    }

    private static List<ProxyEndpoint> parsePool(ProviderConfig config) {
        String defaultScheme = config.option("scheme", "http").toLowerCase(Locale.ROOT);
        ProxyType proxyType = ProviderOptions.proxyType(config, ProxyType.DATACENTER);
        IpVersion ipVersion = ProviderOptions.ipVersion(config);
        RotationType rotationType = ProviderOptions.rotationType(config, RotationType.STICKY);
        String region = config.option("region");

        List<ProxyEndpoint> endpoints = new ArrayList<>();
        for (String line : ProviderOptions.entries(config.option("entries"))) {
            ProxyAddress address;
            try {
                address = ProxyAddress.parse(line, defaultScheme);
            } catch (IllegalArgumentException e) {
                throw new ProxyConfigurationException("Static list provider " + config.name() + " has a malformed entry: " + e.getMessage(), e);
            }
            endpoints.add(ProxyEndpoint.builder()
                    .scheme(address.scheme())
                    .host(address.host())
                    .port(address.port())
                    .username(address.username())
                    .password(address.password())
                    .provider(config.name())
                    .proxyType(proxyType)
                    .ipVersion(ipVersion)
                    .rotationType(rotationType)
                    .region(region)
                    .metadata(Map.of("kind", "static"))
                    .build());
            log.debug("Parsed static proxy entry. provider={}, endpoint={}://{}:{}, auth={}",
                    config.name(), address.scheme(), address.host(), address.port(), address.username() != null);
        }
        return List.copyOf(endpoints);
    }
}
