package io.github.hotbrkm.proxybroker.endpoint;

import java.util.Locale;

/**
 * Network class of the egress addresses a proxy hands out.
 */
public enum ProxyType {
    RESIDENTIAL, DATACENTER, ISP, MOBILE;

    /**
     * Parses a configuration value case-insensitively.
     *
     * @throws IllegalArgumentException if the value names no known type
     */
    public static ProxyType of(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
