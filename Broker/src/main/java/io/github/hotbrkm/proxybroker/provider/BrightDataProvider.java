package io.github.hotbrkm.proxybroker.provider;

import io.github.hotbrkm.proxybroker.config.ProviderConfig;
import io.github.hotbrkm.proxybroker.endpoint.IpVersion;
import io.github.hotbrkm.proxybroker.endpoint.ProxyEndpoint;
import io.github.hotbrkm.proxybroker.endpoint.ProxyType;
import io.github.hotbrkm.proxybroker.endpoint.RotationType;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Session-token gateway in the Bright Data style: host and port are fixed, every acquisition
 * gets a fresh session token embedded in the username.
 * <p>
 * Resulting username: {@code <username>-session-<token>[-country-<cc>][-city-<city>]}.
 * Sticky use is up to the caller, who keeps reusing the returned endpoint.
 * <p>
 * Options: {@code host}, {@code port}, {@code username} (required), {@code password} (required),
 * {@code country}, {@code city}, {@code proxy_type} (default residential), {@code ip_version}.
 */
@Slf4j
public class BrightDataProvider implements ProxyProvider {

    static final String DEFAULT_HOST = "zproxy.lum-superproxy.io";
    static final String DEFAULT_PORT = "22225";
    private static final int SESSION_TOKEN_BYTES = 6;

    private final ProviderConfig config;
    private final SessionIdGenerator sessionIds;
    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final String country;
    private final String city;
    private final ProxyType proxyType;
    private final IpVersion ipVersion;

    public BrightDataProvider(ProviderConfig config) {
        this(config, new SessionIdGenerator());
    }

    BrightDataProvider(ProviderConfig config, SessionIdGenerator sessionIds) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.sessionIds = Objects.requireNonNull(sessionIds, "sessionIds must not be null");
        this.host = config.option("host", DEFAULT_HOST);
        this.port = ProviderOptions.port(config, DEFAULT_PORT);
        this.username = ProviderOptions.required(config, "username");
        this.password = ProviderOptions.required(config, "password");
        this.country = config.option("country");
        this.city = config.option("city");
        this.proxyType = ProviderOptions.proxyType(config, ProxyType.RESIDENTIAL);
        this.ipVersion = ProviderOptions.ipVersion(config);
        log.info("Initialized session gateway provider. name={}, host={}:{}, type={}, ipVersion={}, country={}",
                config.name(), host, port, proxyType.value(), ipVersion.value(), country == null ? "any" : country);
    }

    @Override
    public ProviderConfig config() {
        return config;
    }

    @Override
    public ProxyEndpoint acquire(String region, String purpose) {
        String sessionId;
        try {
            sessionId = sessionIds.nextHex(SESSION_TOKEN_BYTES);
        } catch (IllegalStateException e) {
            throw new ProviderGenerationException(config.name(), "session token generation failed", e);
        }
        String countryCode = region != null && !region.isBlank() ? region : country;

        StringBuilder user = new StringBuilder(username).append("-session-").append(sessionId);
        if (countryCode != null) {
            user.append("-country-").append(countryCode);
        }
        if (city != null) {
            user.append("-city-").append(city);
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("kind", "metered");
        metadata.put("provider", "brightdata");
        metadata.put("purpose", purpose == null ? "general" : purpose);

        ProxyEndpoint endpoint = ProxyEndpoint.builder()
                .scheme("http")
                .host(host)
                .port(port)
                .username(user.toString())
                .password(password)
                .provider(config.name())
                .session(sessionId)
                .proxyType(proxyType)
                .ipVersion(ipVersion)
                .rotationType(RotationType.ROTATING)
                .region(countryCode)
                .metadata(metadata)
                .build();

        log.debug("Session gateway endpoint acquired. provider={}, session={}, region={}, purpose={}",
                config.name(), sessionId, countryCode == null ? "any" : countryCode, metadata.get("purpose"));
        return endpoint;
    }
}
