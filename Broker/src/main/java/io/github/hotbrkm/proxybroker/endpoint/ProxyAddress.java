package io.github.hotbrkm.proxybroker.endpoint;

import java.util.Locale;

/**
 * Connection part of a proxy line, before any provider semantics are attached.
 * <p>
 * Supported line formats, each with an optional {@code scheme://} prefix:
 * <ul>
 *   <li>{@code host:port}</li>
 *   <li>{@code username:password@host:port}</li>
 *   <li>{@code host:port:username:password} (the password may itself contain colons)</li>
 *   <li>{@code [ipv6]:port} in place of {@code host:port} in any of the above</li>
 * </ul>
 */
public record ProxyAddress(String scheme, String host, int port, String username, String password) {

    /**
     * Parses one proxy line.
     *
     * @param line          Raw line
     * @param defaultScheme Scheme used when the line carries none
     * @throws IllegalArgumentException if the line matches no supported format
     */
    public static ProxyAddress parse(String line, String defaultScheme) {
        if (line == null || line.isBlank()) {
            throw new IllegalArgumentException("Proxy line is empty");
        }
        String rest = line.trim();
        String scheme = defaultScheme == null ? "http" : defaultScheme;
        int schemeEnd = rest.indexOf("://");
        if (schemeEnd >= 0) {
            scheme = rest.substring(0, schemeEnd).toLowerCase(Locale.ROOT);
            rest = rest.substring(schemeEnd + 3);
        }

        int at = rest.lastIndexOf('@');
        if (at >= 0) {
            try {
                return parseAtForm(scheme, rest, at, line);
            } catch (IllegalArgumentException e) {
                // host:port:user:pass with an '@' inside the password
                try {
                    return parseColonForm(scheme, rest, line);
                } catch (IllegalArgumentException colonFormFailure) {
                    e.addSuppressed(colonFormFailure);
                    throw e;
                }
            }
        }
        return parseColonForm(scheme, rest, line);
    }

    private static ProxyAddress parseAtForm(String scheme, String rest, int at, String line) {
        String credentials = rest.substring(0, at);
        String username = credentials;
        String password = null;
        int colon = credentials.indexOf(':');
        if (colon >= 0) {
            username = credentials.substring(0, colon);
            password = credentials.substring(colon + 1);
        }
        HostPort hostPort = splitHostPort(rest.substring(at + 1), line);
        return new ProxyAddress(scheme, hostPort.host, hostPort.port, emptyToNull(username), emptyToNull(password));
    }

    private static ProxyAddress parseColonForm(String scheme, String rest, String line) {
        String hostPart;
        String afterHost;
        if (rest.startsWith("[")) {
            int close = rest.indexOf(']');
            if (close < 0 || close + 1 >= rest.length() || rest.charAt(close + 1) != ':') {
                throw new IllegalArgumentException("Invalid IPv6 proxy line: " + line);
            }
            hostPart = rest.substring(1, close);
            afterHost = rest.substring(close + 2);
        } else {
            int colon = rest.indexOf(':');
            if (colon < 0) {
                throw new IllegalArgumentException("Proxy line has no port: " + line);
            }
            hostPart = rest.substring(0, colon);
            afterHost = rest.substring(colon + 1);
        }

        String[] parts = afterHost.split(":", 3);
        if (parts.length == 2) {
            throw new IllegalArgumentException("Proxy line has a username but no password: " + line);
        }
        int port = parsePort(parts[0], line);
        String username = null;
        String password = null;
        if (parts.length == 3) {
            username = parts[1];
            password = parts[2];
        }
        if (hostPart.isEmpty()) {
            throw new IllegalArgumentException("Proxy line has no host: " + line);
        }
        return new ProxyAddress(scheme, hostPart, port, emptyToNull(username), emptyToNull(password));
    }

    private static HostPort splitHostPort(String value, String line) {
        if (value.startsWith("[")) {
            int close = value.indexOf(']');
            if (close < 0 || close + 1 >= value.length() || value.charAt(close + 1) != ':') {
                throw new IllegalArgumentException("Invalid IPv6 proxy line: " + line);
            }
            return new HostPort(value.substring(1, close), parsePort(value.substring(close + 2), line));
        }
        int colon = value.lastIndexOf(':');
        if (colon <= 0) {
            throw new IllegalArgumentException("Proxy line has no port: " + line);
        }
        return new HostPort(value.substring(0, colon), parsePort(value.substring(colon + 1), line));
    }

    private static int parsePort(String value, String line) {
        try {
            int port = Integer.parseInt(value.trim());
            if (port <= 0 || port > 65_535) {
                throw new IllegalArgumentException("Port out of range in proxy line: " + line);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in proxy line: " + line, e);
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private record HostPort(String host, int port) {
    }
}
