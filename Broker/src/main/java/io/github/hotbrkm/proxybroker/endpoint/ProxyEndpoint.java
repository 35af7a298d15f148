package io.github.hotbrkm.proxybroker.endpoint;

import lombok.Builder;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fully resolved proxy connection handed out by a provider.
 * <p>
 * Instances are immutable; a released endpoint is simply no longer used by the caller.
 *
 * @param scheme       http, https or socks5
 * @param host         Proxy host name or IP literal
 * @param port         Proxy port
 * @param username     Auth username (may embed provider session parameters)
 * @param password     Auth password (may embed provider session parameters)
 * @param provider     Name of the configured provider that produced this endpoint
 * @param session      Provider session id, or null for session-less endpoints
 * @param proxyType    Network class of the egress address
 * @param ipVersion    IP protocol version
 * @param rotationType Rotation behaviour
 * @param region       Country/region code, or null if untargeted
 * @param metadata     Free-form provider metadata
 */
@Builder(toBuilder = true)
public record ProxyEndpoint(String scheme, String host, int port, String username, String password,
                            String provider, String session, ProxyType proxyType, IpVersion ipVersion,
                            RotationType rotationType, String region, Map<String, String> metadata) {

    public ProxyEndpoint {
        Objects.requireNonNull(host, "host must not be null");
        if (port <= 0 || port > 65_535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        scheme = scheme == null || scheme.isBlank() ? "http" : scheme;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public EndpointKey key() {
        return new EndpointKey(provider, host, port, session);
    }

    public boolean hasCredentials() {
        return username != null && !username.isEmpty() && password != null && !password.isEmpty();
    }

    /**
     * Returns the endpoint as a proxy URL, with credentials embedded when present.
     */
    public String toUrl() {
        StringBuilder sb = new StringBuilder(scheme).append("://");
        if (hasCredentials()) {
            sb.append(encode(username)).append(':').append(encode(password)).append('@');
        }
        return sb.append(hostPort()).toString();
    }

    /**
     * Returns the mapping generic HTTP clients accept: the same URL for both http and https traffic.
     */
    public Map<String, String> asHttpProxySpec() {
        String url = toUrl();
        Map<String, String> spec = new LinkedHashMap<>();
        spec.put("http", url);
        spec.put("https", url);
        return spec;
    }

    public BrowserProxySpec asBrowserProxySpec() {
        return new BrowserProxySpec(scheme + "://" + hostPort(), username, password);
    }

    /**
     * Host and port only, safe for logs.
     */
    public String address() {
        return host + ":" + port;
    }

    @Override
    public String toString() {
        return "ProxyEndpoint[" + scheme + "://" + address() + ", provider=" + provider
                + ", session=" + session + ", region=" + region + "]";
    }

    /**
     * Host and port in URL authority form; IPv6 literals are bracketed.
     */
    private String hostPort() {
        return (host.indexOf(':') >= 0 ? "[" + host + "]" : host) + ":" + port;
    }

    // userinfo has no form encoding, so a space must be %20 rather than '+'
    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
