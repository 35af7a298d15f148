package io.github.hotbrkm.proxybroker.provider;

import io.github.hotbrkm.proxybroker.config.ProviderConfig;
import io.github.hotbrkm.proxybroker.endpoint.IpVersion;
import io.github.hotbrkm.proxybroker.endpoint.ProxyEndpoint;
import io.github.hotbrkm.proxybroker.endpoint.ProxyType;
import io.github.hotbrkm.proxybroker.endpoint.RotationType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Session pool provider in the MooProxy style, with two modes chosen by configuration shape.
 * <ul>
 *   <li><b>static</b> - {@code entries} holds pre-generated lines
 *       {@code host:port:user:pass_country-XX_session-ID}; region and session are parsed from the
 *       password and the lines are cycled round-robin.</li>
 *   <li><b>dynamic</b> - {@code host}, {@code port}, {@code username}, {@code password} are given;
 *       every acquisition appends {@code _country-<cc>_session-<id>} with a fresh id to the password.</li>
 * </ul>
 * Both modes produce STICKY endpoints. Optional options: {@code country} (default US),
 * {@code scheme}, {@code proxy_type} (default residential), {@code ip_version}.
 */
@Slf4j
public class MooProxyProvider implements ProxyProvider {

    public enum Mode {
        STATIC, DYNAMIC
    }

    static final Pattern SESSION_PATTERN = Pattern.compile("_session-([A-Za-z0-9_-]+)$");
    static final Pattern COUNTRY_PATTERN = Pattern.compile("_country-([A-Za-z]{2})(?=_|$)");
    private static final int SESSION_TOKEN_BYTES = 8;

    private final ProviderConfig config;
    @Getter
    private final Mode mode;
    private final ProxyType proxyType;
    private final IpVersion ipVersion;

    // static mode
    private final List<ProxyEndpoint> sessions;
    private final AtomicLong cursor = new AtomicLong(0);

    // dynamic mode
    private final SessionIdGenerator sessionIds;
    private final String scheme;
    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final String country;

    public MooProxyProvider(ProviderConfig config) {
        this(config, new SessionIdGenerator());
    }

    MooProxyProvider(ProviderConfig config, SessionIdGenerator sessionIds) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.sessionIds = Objects.requireNonNull(sessionIds, "sessionIds must not be null");
        this.proxyType = ProviderOptions.proxyType(config, ProxyType.RESIDENTIAL);
        this.ipVersion = ProviderOptions.ipVersion(config);
        this.scheme = config.option("scheme", "http").toLowerCase(Locale.ROOT);
        this.country = config.option("country", "US");

        List<String> lines = ProviderOptions.entries(config.option("entries"));
        if (!lines.isEmpty()) {
            this.mode = Mode.STATIC;
            this.sessions = parseSessions(lines);
            this.host = null;
            this.port = 0;
            this.username = null;
            this.password = null;
            log.info("Initialized session pool provider (static mode). name={}, entries={}, type={}",
                    config.name(), sessions.size(), proxyType.value());
        } else {
            this.mode = Mode.DYNAMIC;
            this.sessions = List.of();
            this.host = ProviderOptions.required(config, "host");
            this.port = ProviderOptions.port(config, null);
            this.username = ProviderOptions.required(config, "username");
            this.password = ProviderOptions.required(config, "password");
            log.info("Initialized session pool provider (dynamic mode). name={}, host={}:{}, type={}, ipVersion={}, country={}",
                    config.name(), host, port, proxyType.value(), ipVersion.value(), country);
        }
    }

    @Override
    public ProviderConfig config() {
        return config;
    }

    @Override
    public ProxyEndpoint acquire(String region, String purpose) {
        if (mode == Mode.STATIC) {
            long index = cursor.getAndIncrement();
            ProxyEndpoint endpoint = sessions.get((int) Math.floorMod(index, (long) sessions.size()));
            log.debug("Session pool endpoint acquired (static). provider={}, session={}, region={}",
                    config.name(), endpoint.session(), endpoint.region());
            return endpoint;
        }
        return synthesize(region, purpose);
    }

    public int size() {
        return sessions.size();
    }

    private ProxyEndpoint synthesize(String region, String purpose) {
        String sessionId;
        try {
            sessionId = sessionIds.nextUrlSafe(SESSION_TOKEN_BYTES);
        } catch (IllegalStateException e) {
            throw new ProviderGenerationException(config.name(), "session id generation failed", e);
        }
        String countryCode = region != null && !region.isBlank() ? region : country;
        if (!countryCode.matches("[A-Za-z]{2}")) {
            throw new ProviderGenerationException(config.name(), "region must be a two-letter country code: " + countryCode);
        }
        String sessionPassword = password + "_country-" + countryCode + "_session-" + sessionId;

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("kind", "mooproxy");
        metadata.put("mode", "dynamic");
        metadata.put("country", countryCode);
        metadata.put("purpose", purpose == null ? "general" : purpose);

        ProxyEndpoint endpoint = ProxyEndpoint.builder()
                .scheme(scheme)
                .host(host)
                .port(port)
                .username(username)
                .password(sessionPassword)
                .provider(config.name())
                .session(sessionId)
                .proxyType(proxyType)
                .ipVersion(ipVersion)
                .rotationType(RotationType.STICKY)
                .region(countryCode)
                .metadata(metadata)
                .build();

        log.debug("Session pool endpoint acquired (dynamic). provider={}, session={}, region={}, purpose={}",
                config.name(), sessionId, countryCode, metadata.get("purpose"));
        return endpoint;
    }

    private List<ProxyEndpoint> parseSessions(List<String> lines) {
        List<ProxyEndpoint> endpoints = new ArrayList<>();
        for (String line : lines) {
            String[] parts = line.split(":", 4);
            if (parts.length < 4 || parts[0].isBlank() || parts[2].isBlank() || parts[3].isBlank()) {
                throw new ProviderGenerationException(config.name(), "malformed session entry, expected host:port:user:pass: " + line);
            }
            int entryPort;
            try {
                entryPort = Integer.parseInt(parts[1].trim());
            } catch (NumberFormatException e) {
                throw new ProviderGenerationException(config.name(), "invalid port in session entry: " + line, e);
            }
            if (entryPort <= 0 || entryPort > 65_535) {
                throw new ProviderGenerationException(config.name(), "port out of range in session entry: " + line);
            }
            String entryPassword = parts[3];
            String sessionId = extractSession(entryPassword);
            if (sessionId == null) {
                throw new ProviderGenerationException(config.name(), "session entry has no _session- suffix: " + line);
            }
            String region = extractRegion(entryPassword);

            endpoints.add(ProxyEndpoint.builder()
                    .scheme(scheme)
                    .host(parts[0])
                    .port(entryPort)
                    .username(parts[2])
                    .password(entryPassword)
                    .provider(config.name())
                    .session(sessionId)
                    .proxyType(proxyType)
                    .ipVersion(ipVersion)
                    .rotationType(RotationType.STICKY)
                    .region(region)
                    .metadata(Map.of("kind", "mooproxy", "mode", "static"))
                    .build());
        }
        return List.copyOf(endpoints);
    }

    static String extractSession(String password) {
        Matcher matcher = SESSION_PATTERN.matcher(password);
        return matcher.find() ? matcher.group(1) : null;
    }

    static String extractRegion(String password) {
        Matcher matcher = COUNTRY_PATTERN.matcher(password);
        return matcher.find() ? matcher.group(1).toUpperCase(Locale.ROOT) : null;
    }
}
